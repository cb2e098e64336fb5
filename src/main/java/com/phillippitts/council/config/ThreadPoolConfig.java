package com.phillippitts.council.config;

import com.phillippitts.council.config.properties.ThreadPoolProperties;
import com.phillippitts.council.config.properties.ThreadPoolProperties.PoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for backend fan-out, tool calls and event offload.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on provider rate limits and workload.
 *
 * <p>Policies:
 * <ul>
 *   <li>Rejection: the council and tool pools abort ({@link ThreadPoolExecutor.AbortPolicy}).
 *       Callers join those tasks under a deadline, and a task run on the submitting thread
 *       would hold the caller past it; a refused task is reported as a REJECTED failure
 *       instead. The event pool keeps {@link ThreadPoolExecutor.CallerRunsPolicy} as
 *       backpressure for listeners.</li>
 *   <li>MDC propagation: the Log4j2 ThreadContext of the submitting thread is copied to the
 *       worker so {@code requestId}, {@code queryId} and {@code workspace} appear in async logs</li>
 * </ul>
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs every priced backend call: the classifier fallback and each stage fan-out.
     * Must be at least as wide as the largest backend selection.
     *
     * @return executor for backend calls
     */
    @Bean(name = "councilExecutor")
    public ThreadPoolTaskExecutor councilExecutor() {
        return newExecutor(threadPoolProperties.getCouncil(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs tool collaborators before Stage1.
     *
     * @return executor for tool calls
     */
    @Bean(name = "toolExecutor")
    public ThreadPoolTaskExecutor toolExecutor() {
        return newExecutor(threadPoolProperties.getTool(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Offloads lifecycle event listeners from the pipeline thread.
     *
     * @return executor for {@code @Async("eventExecutor")} listeners
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return newExecutor(threadPoolProperties.getEvent(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor newExecutor(PoolProperties props, RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext to the worker and restores the worker's
     * own context afterwards.
     */
    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
