package com.phillippitts.council.service.governor.cache;

import com.phillippitts.council.service.gateway.GatewayCompletion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Response cache shared by every instance through Redis.
 *
 * <p>Completions are stored as JSON strings under {@value #KEY_PREFIX} plus the cache key,
 * with the TTL set by Redis. Redis evicts on its own; capacity is informational and no
 * evictions are counted. Hits and misses are counted per instance.
 *
 * <p>An unreachable Redis degrades to cache misses: the call goes to the backend and is
 * charged, it never fails because of the cache.
 */
public class RedisResponseCacheStore implements ResponseCacheStore {

    private static final Logger LOG = LogManager.getLogger(RedisResponseCacheStore.class);

    static final String KEY_PREFIX = "council:cache:";

    private final StringRedisTemplate redis;
    private final int capacity;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public RedisResponseCacheStore(StringRedisTemplate redis, int capacity) {
        this.redis = redis;
        this.capacity = capacity;
    }

    @Override
    public Optional<GatewayCompletion> get(String key) {
        String json;
        try {
            json = redis.opsForValue().get(KEY_PREFIX + key);
        } catch (DataAccessException e) {
            LOG.warn("Redis cache read failed, treating as miss: {}", e.getMessage());
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (json == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        try {
            GatewayCompletion value = decode(json);
            hits.incrementAndGet();
            return Optional.of(value);
        } catch (JSONException | IllegalArgumentException e) {
            LOG.warn("Dropping unreadable cache entry {}: {}", key, e.getMessage());
            redis.delete(KEY_PREFIX + key);
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, GatewayCompletion value, Duration ttl) {
        try {
            redis.opsForValue().set(KEY_PREFIX + key, encode(value), ttl);
        } catch (DataAccessException e) {
            LOG.warn("Redis cache write failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void clear() {
        Set<String> keys = redis.keys(KEY_PREFIX + "*");
        if (keys != null && !keys.isEmpty()) {
            redis.delete(keys);
        }
    }

    @Override
    public CacheStats stats() {
        int size;
        try {
            Set<String> keys = redis.keys(KEY_PREFIX + "*");
            size = keys == null ? 0 : keys.size();
        } catch (DataAccessException e) {
            LOG.warn("Redis cache size unavailable: {}", e.getMessage());
            size = 0;
        }
        return new CacheStats(size, capacity, hits.get(), misses.get(), 0L);
    }

    static String encode(GatewayCompletion value) {
        return new JSONObject()
                .put("text", value.text())
                .put("promptTokens", value.promptTokens())
                .put("completionTokens", value.completionTokens())
                .put("latencyMs", value.latencyMs())
                .toString();
    }

    static GatewayCompletion decode(String json) {
        JSONObject o = new JSONObject(json);
        return new GatewayCompletion(o.getString("text"), o.getInt("promptTokens"),
                o.getInt("completionTokens"), o.getLong("latencyMs"));
    }
}
