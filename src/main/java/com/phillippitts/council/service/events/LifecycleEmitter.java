package com.phillippitts.council.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits the checkpoints of one run in order to the run's listener and to the application
 * event bus.
 *
 * <p>Emission is serialized, so sequence numbers match delivery order even when Stage1 and
 * Stage2 results are reported from worker threads. Listener exceptions are logged and never
 * affect the run. Nothing is emitted after a terminal event.
 */
public final class LifecycleEmitter {

    private static final Logger LOG = LogManager.getLogger(LifecycleEmitter.class);

    private final String queryId;
    private final LifecycleListener listener;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private int sequence;
    private boolean closed;

    public LifecycleEmitter(String queryId, LifecycleListener listener, ApplicationEventPublisher publisher,
                            Clock clock) {
        this.queryId = queryId;
        this.listener = listener == null ? LifecycleListener.NOOP : listener;
        this.publisher = publisher;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * @param payload alternating key/value pairs; null values are dropped
     */
    public void emit(LifecycleEventType type, Object... payload) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i + 1 < payload.length; i += 2) {
            if (payload[i + 1] != null) {
                data.put(String.valueOf(payload[i]), payload[i + 1]);
            }
        }
        LifecycleEvent event;
        synchronized (this) {
            if (closed) {
                LOG.debug("Dropping {} for query {}: run already finished", type, queryId);
                return;
            }
            event = new LifecycleEvent(queryId, ++sequence, type, clock.instant(), data);
            closed = type.terminal();
            deliver(event);
        }
    }

    public synchronized int emitted() {
        return sequence;
    }

    private void deliver(LifecycleEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Lifecycle listener failed on {} for query {}", event.type(), queryId, e);
        }
        if (publisher != null) {
            try {
                publisher.publishEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Publishing {} for query {} failed", event.type(), queryId, e);
            }
        }
    }
}
