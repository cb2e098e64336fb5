package com.phillippitts.council.service.governor.cache;

import com.phillippitts.council.service.gateway.GatewayCompletion;

import java.time.Duration;
import java.util.Optional;

/**
 * Storage for cached gateway completions. Implementations must be safe for concurrent use.
 *
 * <p>The default is {@link InMemoryResponseCacheStore}; declare another bean of this type to
 * use a shared external store.
 */
public interface ResponseCacheStore {

    /**
     * @return the stored completion, or empty if absent or expired
     */
    Optional<GatewayCompletion> get(String key);

    void set(String key, GatewayCompletion value, Duration ttl);

    void clear();

    CacheStats stats();
}
