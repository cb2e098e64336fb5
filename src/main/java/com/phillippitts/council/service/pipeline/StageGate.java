package com.phillippitts.council.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Collects the results of one stage until the stage is finalized.
 *
 * <p>{@link #offer} and {@link #close} share one monitor: a result is either accepted (and its
 * callback has run) before the stage closes, or it is rejected. Nothing can change the
 * accepted set after {@link #close}.
 */
final class StageGate<T> {

    private static final Logger LOG = LogManager.getLogger(StageGate.class);

    private final String stage;
    private final Consumer<T> onAccepted;
    private final Map<String, T> accepted = new LinkedHashMap<>();
    private boolean closed;

    StageGate(String stage, Consumer<T> onAccepted) {
        this.stage = stage;
        this.onAccepted = onAccepted == null ? v -> { } : onAccepted;
    }

    /**
     * @param value result, or null when the task produced nothing to report
     * @return true if the result was accepted; false if the value is null, the stage already
     *         closed or the key was already reported
     */
    synchronized boolean offer(String key, T value) {
        if (value == null) {
            return false;
        }
        if (closed) {
            LOG.debug("Discarding late {} result from {}", stage, key);
            return false;
        }
        if (accepted.putIfAbsent(key, value) != null) {
            return false;
        }
        try {
            onAccepted.accept(value);
        } catch (RuntimeException e) {
            LOG.warn("{} result callback failed for {}", stage, key, e);
        }
        return true;
    }

    /**
     * Closes the gate.
     *
     * @return results accepted so far, in arrival order
     */
    synchronized Map<String, T> close() {
        closed = true;
        return new LinkedHashMap<>(accepted);
    }

    synchronized boolean isClosed() {
        return closed;
    }
}
