package com.phillippitts.council.service.events;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One checkpoint of a pipeline run.
 *
 * @param queryId   query the run belongs to
 * @param sequence  1-based position within the run
 * @param type      checkpoint type
 * @param timestamp emission time
 * @param payload   checkpoint data (decision, response, ranking, summary, ...)
 */
public record LifecycleEvent(String queryId, int sequence, LifecycleEventType type, Instant timestamp,
                             Map<String, Object> payload) {

    public LifecycleEvent {
        Objects.requireNonNull(queryId, "queryId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
