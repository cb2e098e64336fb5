package com.phillippitts.council.config;

import com.phillippitts.council.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateCouncilExecutorWithDefaultConfiguration() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).councilExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(20);
        assertThat(executor.getMaxPoolSize()).isEqualTo(40);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("council-pool-");
    }

    @Test
    void shouldApplyConfiguredToolPoolSize() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getTool().setCorePoolSize(2);
        properties.getTool().setMaxPoolSize(3);

        executor = new ThreadPoolConfig(properties).toolExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("tool-pool-");
    }

    @Test
    void councilExecutorShouldRejectWhenSaturatedInsteadOfRunningOnCaller() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getCouncil().setCorePoolSize(1);
        properties.getCouncil().setMaxPoolSize(1);
        properties.getCouncil().setQueueCapacity(1);
        executor = new ThreadPoolConfig(properties).councilExecutor();

        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        executor.execute(blocker);
        executor.execute(blocker);

        AtomicReference<String> ranOn = new AtomicReference<>();
        assertThatThrownBy(() -> executor.execute(() -> ranOn.set(Thread.currentThread().getName())))
                .isInstanceOf(RejectedExecutionException.class);
        release.countDown();

        assertThat(ranOn.get()).isNull();
    }

    @Test
    void eventExecutorShouldRunOnCallerWhenSaturated() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getEvent().setCorePoolSize(1);
        properties.getEvent().setMaxPoolSize(1);
        properties.getEvent().setQueueCapacity(1);
        executor = new ThreadPoolConfig(properties).eventExecutor();

        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        executor.execute(blocker);
        executor.execute(blocker);

        AtomicReference<String> ranOn = new AtomicReference<>();
        executor.execute(() -> ranOn.set(Thread.currentThread().getName()));
        release.countDown();

        assertThat(ranOn.get()).isEqualTo(Thread.currentThread().getName());
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).councilExecutor();

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                completedTasks.incrementAndGet();
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).councilExecutor();
        ThreadContext.put("queryId", "q-42");
        ThreadContext.put("workspace", "Bellcourt");

        AtomicReference<String> seenQuery = new AtomicReference<>();
        AtomicReference<String> seenWorkspace = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        executor.execute(() -> {
            seenQuery.set(ThreadContext.get("queryId"));
            seenWorkspace.set(ThreadContext.get("workspace"));
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seenQuery.get()).isEqualTo("q-42");
        assertThat(seenWorkspace.get()).isEqualTo("Bellcourt");
    }

    @Test
    void shouldRestoreWorkerContextAfterDecoratedTask() {
        ThreadContext.put("queryId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(() ->
                assertThat(ThreadContext.get("queryId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("queryId", "worker-own");
        decorated.run();

        assertThat(ThreadContext.get("queryId")).isEqualTo("worker-own");
    }
}
