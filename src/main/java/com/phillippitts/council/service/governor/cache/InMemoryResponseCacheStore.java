package com.phillippitts.council.service.governor.cache;

import com.phillippitts.council.service.gateway.GatewayCompletion;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process cache with per-entry TTL and least-recently-used eviction.
 *
 * <p>All access is synchronized on the instance; critical sections are map operations only.
 */
public class InMemoryResponseCacheStore implements ResponseCacheStore {

    private final int capacity;
    private final Clock clock;
    private final LinkedHashMap<String, Entry> map;
    private long hits;
    private long misses;
    private long evictions;

    public InMemoryResponseCacheStore(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                boolean evict = size() > InMemoryResponseCacheStore.this.capacity;
                if (evict) {
                    evictions++;
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized Optional<GatewayCompletion> get(String key) {
        Entry e = map.get(key);
        if (e == null) {
            misses++;
            return Optional.empty();
        }
        if (!clock.instant().isBefore(e.expiresAt())) {
            map.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(e.value());
    }

    @Override
    public synchronized void set(String key, GatewayCompletion value, Duration ttl) {
        map.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public synchronized void clear() {
        map.clear();
    }

    @Override
    public synchronized CacheStats stats() {
        return new CacheStats(map.size(), capacity, hits, misses, evictions);
    }

    private record Entry(GatewayCompletion value, Instant expiresAt) {
    }
}
