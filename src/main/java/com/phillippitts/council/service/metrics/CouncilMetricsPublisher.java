package com.phillippitts.council.service.metrics;

import com.phillippitts.council.domain.FailureKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Null-safe facade over {@link CouncilMetrics} used by the governor, tool coordinator and
 * pipeline.
 *
 * <p>All methods tolerate a missing {@link CouncilMetrics} so components can run without a
 * meter registry in unit tests; use {@link #NOOP} there.
 *
 * @see CouncilMetrics
 */
@Component
public final class CouncilMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(CouncilMetricsPublisher.class);

    /**
     * No-op instance for tests and builder defaults.
     */
    public static final CouncilMetricsPublisher NOOP = new CouncilMetricsPublisher(null);

    private final CouncilMetrics metrics;

    public CouncilMetricsPublisher(CouncilMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("CouncilMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records a priced call that reached the gateway and succeeded.
     */
    public void recordCallSuccess(String backendId, String purpose, long durationNanos, double cost) {
        if (metrics == null) {
            return;
        }
        metrics.recordCallLatency(backendId, purpose, durationNanos);
        metrics.incrementCallSuccess(backendId, purpose);
        if (cost > 0.0) {
            metrics.recordSpend(backendId, cost);
        }
    }

    public void recordCallFailure(String backendId, String purpose, long durationNanos, FailureKind kind) {
        if (metrics == null) {
            return;
        }
        metrics.recordCallLatency(backendId, purpose, durationNanos);
        metrics.incrementCallFailure(backendId, purpose, lower(kind.name()));
    }

    public void recordCacheLookup(boolean hit) {
        if (metrics == null) {
            return;
        }
        metrics.incrementCache(hit ? "hit" : "miss");
    }

    public void recordAdmissionDenied(String scope) {
        if (metrics == null) {
            return;
        }
        metrics.incrementAdmissionDenied(lower(scope));
    }

    public void recordTool(String toolId, String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.incrementTool(toolId, lower(outcome));
    }

    public void recordClassification(String source, String complexity) {
        if (metrics == null) {
            return;
        }
        metrics.incrementClassification(lower(source), lower(complexity));
    }

    public void recordPipeline(String workflow, String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordPipeline(lower(workflow), outcome, durationNanos);
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
