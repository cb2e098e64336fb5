package com.phillippitts.council.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs one task per backend concurrently on the council executor and joins them under a
 * stage deadline.
 *
 * <p>Results that arrive after the deadline are discarded by the {@link StageGate}; their
 * tasks are cancelled best-effort. The returned map only holds results accepted before the
 * deadline and iterates in the order of the given keys, so callers see the same result for
 * the same completed set whatever the arrival order.
 *
 * <p>The council executor aborts when saturated instead of running the task on the caller,
 * so submission never blocks and the deadline always holds. A rejected key is offered the
 * value produced by the {@code onRejected} function.
 */
@Component
public class StageFanOut {

    private static final Logger LOG = LogManager.getLogger(StageFanOut.class);

    private final Executor executor;

    public StageFanOut(@Qualifier("councilExecutor") Executor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * @param stage      stage name for logging
     * @param keys       backend ids, in selection order
     * @param task       work per backend; must not throw, may return null for "nothing to report"
     * @param deadline   stage deadline
     * @param onAccepted called once per accepted result, before the stage closes
     * @return accepted results keyed by backend id, in {@code keys} order
     */
    public <T> Map<String, T> run(String stage, List<String> keys, Function<String, T> task, Duration deadline,
                                  Consumer<T> onAccepted) {
        return run(stage, keys, task, key -> null, deadline, onAccepted);
    }

    /**
     * @param onRejected value reported for a key whose task the executor refused; may return null
     * @see #run(String, List, Function, Duration, Consumer)
     */
    public <T> Map<String, T> run(String stage, List<String> keys, Function<String, T> task,
                                  Function<String, T> onRejected, Duration deadline, Consumer<T> onAccepted) {
        StageGate<T> gate = new StageGate<>(stage, onAccepted);
        List<CompletableFuture<Void>> futures = new ArrayList<>(keys.size());
        for (String key : keys) {
            try {
                futures.add(CompletableFuture.runAsync(() -> gate.offer(key, task.apply(key)), executor));
            } catch (RejectedExecutionException e) {
                LOG.warn("{} task for {} rejected: council executor saturated", stage, key);
                gate.offer(key, onRejected.apply(key));
            }
        }

        long deadlineMs = deadline.toMillis();
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(deadlineMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("{} deadline of {} ms reached; abandoning outstanding calls", stage, deadlineMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("{} interrupted while waiting for backends", stage);
        } catch (ExecutionException ee) {
            LOG.error("{} task failed unexpectedly", stage, ee.getCause());
        }

        Map<String, T> accepted = gate.close();
        futures.forEach(f -> {
            if (!f.isDone()) {
                f.cancel(true);
            }
        });

        Map<String, T> ordered = new LinkedHashMap<>();
        for (String key : keys) {
            T value = accepted.get(key);
            if (value != null) {
                ordered.put(key, value);
            }
        }
        return ordered;
    }
}
