package com.phillippitts.council.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs failed and degraded runs. Throttled per failure reason to avoid log spam when a
 * provider is down.
 *
 * <p>Runs on the {@code eventExecutor} pool so the pipeline thread never waits on logging.
 */
@Component
class LifecycleEventsListener {
    private static final Logger LOG = LogManager.getLogger(LifecycleEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    @Async("eventExecutor")
    public void onLifecycleEvent(LifecycleEvent e) {
        if (e.type() == LifecycleEventType.FAILED) {
            Object reason = e.payload().getOrDefault("reason", "unknown");
            if (shouldLog("failed-" + reason)) {
                LOG.warn("Deliberation failed: query={}, reason={}, error={}", e.queryId(), reason,
                        e.payload().get("error"));
            }
        } else if (e.type() == LifecycleEventType.COMPLETED && Boolean.TRUE.equals(e.payload().get("degraded"))) {
            if (shouldLog("degraded")) {
                LOG.warn("Deliberation degraded to a raw Stage1 answer: query={}", e.queryId());
            }
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
