package com.phillippitts.council.config.council;

import com.phillippitts.council.config.properties.CostGovernorProperties;
import com.phillippitts.council.service.governor.cache.InMemoryResponseCacheStore;
import com.phillippitts.council.service.governor.cache.RedisResponseCacheStore;
import com.phillippitts.council.service.governor.cache.ResponseCacheStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Beans backing the cost governor. Both are replaceable: declare a {@link Clock} for tests or a
 * {@link ResponseCacheStore} for another cache.
 *
 * <p>{@code council.governor.cache-store=redis} shares the response cache between instances
 * through the Redis connection configured under {@code spring.data.redis}; anything else keeps
 * it in memory.
 */
@Configuration
public class GovernorConfig {

    private static final Logger LOG = LogManager.getLogger(GovernorConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "council.governor", name = "cache-store", havingValue = "redis")
    public ResponseCacheStore redisResponseCacheStore(CostGovernorProperties properties, StringRedisTemplate redis) {
        LOG.info("Response cache: redis, enabled={}, ttl={}", properties.isCacheEnabled(), properties.getCacheTtl());
        return new RedisResponseCacheStore(redis, properties.getCacheCapacity());
    }

    @Bean
    @ConditionalOnMissingBean(ResponseCacheStore.class)
    public ResponseCacheStore responseCacheStore(CostGovernorProperties properties, Clock clock) {
        LOG.info("Response cache: memory, enabled={}, capacity={}, ttl={}", properties.isCacheEnabled(),
                properties.getCacheCapacity(), properties.getCacheTtl());
        return new InMemoryResponseCacheStore(properties.getCacheCapacity(), clock);
    }
}
