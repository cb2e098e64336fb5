package com.phillippitts.council.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the council executor through Micrometer.
 *
 * <ul>
 *   <li>council.pool.size - Current number of threads in the pool</li>
 *   <li>council.pool.active - Number of backend calls in flight</li>
 *   <li>council.pool.queued - Number of calls waiting in the queue</li>
 *   <li>council.pool.completed - Cumulative count of completed calls</li>
 *   <li>council.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/council.pool.active}. A health summary is
 * also logged every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> councilExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("councilExecutor") ObjectProvider<ThreadPoolTaskExecutor> councilExecutorProvider) {
        this.councilExecutorProvider = councilExecutorProvider;
    }

    @Bean
    public MeterBinder councilExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = councilExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("council.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the council pool")
                    .register(registry);

            Gauge.builder("council.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of backend calls in flight")
                    .register(registry);

            Gauge.builder("council.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of backend calls waiting in the queue")
                    .register(registry);

            Gauge.builder("council.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed backend calls")
                    .register(registry);

            Gauge.builder("council.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the council executor")
                    .register(registry);

            LOG.info("Council thread pool metrics registered: council.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = councilExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Council Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
