package com.phillippitts.council.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for council operations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Priced call latency, outcome and spend per backend and purpose</li>
 *   <li>Response cache hits and misses</li>
 *   <li>Admission denials per budget scope</li>
 *   <li>Tool outcomes, classification tiers and pipeline outcomes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer under the {@code council.*} prefix.
 */
@Component
public class CouncilMetrics {

    private static final String METRIC_PREFIX = "council";

    private final MeterRegistry registry;

    public CouncilMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency of a priced call that reached the gateway.
     */
    public void recordCallLatency(String backendId, String purpose, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".call.latency")
                .description("Latency of priced backend calls")
                .tag("backend", backendId)
                .tag("purpose", purpose)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementCallSuccess(String backendId, String purpose) {
        Counter.builder(METRIC_PREFIX + ".call.success")
                .description("Number of successful priced calls")
                .tag("backend", backendId)
                .tag("purpose", purpose)
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure kind, lower case (timeout, provider_error, ...)
     */
    public void incrementCallFailure(String backendId, String purpose, String reason) {
        Counter.builder(METRIC_PREFIX + ".call.failure")
                .description("Number of failed priced calls")
                .tag("backend", backendId)
                .tag("purpose", purpose)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSpend(String backendId, double cost) {
        Counter.builder(METRIC_PREFIX + ".spend")
                .description("Spend in USD")
                .baseUnit("usd")
                .tag("backend", backendId)
                .register(registry)
                .increment(cost);
    }

    /**
     * @param result "hit" or "miss"
     */
    public void incrementCache(String result) {
        Counter.builder(METRIC_PREFIX + ".cache")
                .description("Response cache lookups")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void incrementAdmissionDenied(String scope) {
        Counter.builder(METRIC_PREFIX + ".admission.denied")
                .description("Priced calls refused before dispatch")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success" or a failure kind in lower case
     */
    public void incrementTool(String toolId, String outcome) {
        Counter.builder(METRIC_PREFIX + ".tool.invocations")
                .description("Tool invocations by outcome")
                .tag("tool", toolId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementClassification(String source, String complexity) {
        Counter.builder(METRIC_PREFIX + ".classification")
                .description("Intent decisions by tier and complexity")
                .tag("source", source)
                .tag("complexity", complexity)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "completed", "degraded" or "failed"
     */
    public void recordPipeline(String workflow, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".pipeline.latency")
                .description("End-to-end deliberation latency")
                .tag("workflow", workflow)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
