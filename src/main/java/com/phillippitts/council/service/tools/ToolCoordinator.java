package com.phillippitts.council.service.tools;

import com.phillippitts.council.config.properties.ToolProperties;
import com.phillippitts.council.domain.ToolFailureKind;
import com.phillippitts.council.domain.ToolInvocation;
import com.phillippitts.council.service.metrics.CouncilMetricsPublisher;
import com.phillippitts.council.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs requested tools concurrently and merges their outcomes.
 *
 * <ul>
 *   <li><b>Parallel:</b> every tool runs as its own task on {@code toolExecutor}</li>
 *   <li><b>Per-tool timeout:</b> a tool exceeding {@code council.tools.per-tool-timeout}
 *       yields a {@link ToolFailureKind#TIMEOUT} entry</li>
 *   <li><b>Overall timeout:</b> tools still running at {@code council.tools.overall-timeout}
 *       are abandoned with a timeout entry</li>
 *   <li><b>Isolation:</b> a failing tool only affects its own entry</li>
 *   <li><b>Deterministic order:</b> results are returned in catalog priority, not completion
 *       order</li>
 * </ul>
 */
@Service
public class ToolCoordinator {

    private static final Logger LOG = LogManager.getLogger(ToolCoordinator.class);

    private final ToolCatalog catalog;
    private final Executor executor;
    private final ToolProperties properties;
    private final CouncilMetricsPublisher metrics;

    public ToolCoordinator(ToolCatalog catalog,
                           @Qualifier("toolExecutor") Executor executor,
                           ToolProperties properties,
                           CouncilMetricsPublisher metrics) {
        this.catalog = Objects.requireNonNull(catalog);
        this.executor = Objects.requireNonNull(executor);
        this.properties = Objects.requireNonNull(properties);
        this.metrics = metrics == null ? CouncilMetricsPublisher.NOOP : metrics;
    }

    /**
     * Executes the requests. Duplicate tool ids run once (first request wins).
     *
     * @return one invocation per distinct tool id, in catalog-priority order
     */
    public ToolBatch execute(List<ToolRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return ToolBatch.empty();
        }
        Duration perTool = properties.getPerToolTimeout();
        Map<String, ToolRequest> byId = new LinkedHashMap<>();
        requests.forEach(r -> byId.putIfAbsent(r.toolId(), r));

        long start = System.nanoTime();
        Map<String, CompletableFuture<ToolInvocation>> futures = new LinkedHashMap<>();
        for (ToolRequest req : byId.values()) {
            futures.put(req.toolId(), launch(req, perTool));
        }

        long overallMs = properties.getOverallTimeout().toMillis();
        try {
            CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                    .get(overallMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Tool batch exceeded overall timeout of {} ms", overallMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for tools");
        } catch (ExecutionException ee) {
            // Unreachable: each future maps its own failure to an invocation
            LOG.error("Unexpected tool batch failure", ee);
        }

        Map<String, ToolInvocation> outcomes = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<ToolInvocation>> e : futures.entrySet()) {
            CompletableFuture<ToolInvocation> f = e.getValue();
            ToolInvocation inv;
            if (f.isDone() && !f.isCompletedExceptionally()) {
                inv = f.join();
            } else {
                f.cancel(true);
                inv = ToolInvocation.failure(e.getKey(), byId.get(e.getKey()).params(), ToolFailureKind.TIMEOUT,
                        "exceeded overall tool timeout of " + overallMs + " ms", TimeUtils.elapsedMillis(start));
            }
            outcomes.put(e.getKey(), inv);
            metrics.recordTool(inv.toolId(), inv.success() ? "success" : inv.failureKind().name());
        }

        List<ToolInvocation> ordered = new ArrayList<>(outcomes.size());
        for (String id : catalog.order(outcomes.keySet())) {
            ordered.add(outcomes.get(id));
        }
        LOG.info("Tools finished: {} ok, {} failed in {} ms",
                ordered.stream().filter(ToolInvocation::success).count(),
                ordered.stream().filter(i -> !i.success()).count(),
                TimeUtils.elapsedMillis(start));
        return new ToolBatch(ordered);
    }

    private CompletableFuture<ToolInvocation> launch(ToolRequest req, Duration perTool) {
        ToolCollaborator tool = catalog.find(req.toolId()).orElse(null);
        if (tool == null) {
            return CompletableFuture.completedFuture(ToolInvocation.failure(req.toolId(), req.params(),
                    ToolFailureKind.UNAVAILABLE, "no tool registered with this id", 0L));
        }
        long t0 = System.nanoTime();
        CompletableFuture<ToolInvocation> submitted;
        try {
            submitted = CompletableFuture.supplyAsync(() -> invoke(tool, req, perTool, t0), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Tool {} rejected: tool executor saturated", req.toolId());
            return CompletableFuture.completedFuture(ToolInvocation.failure(req.toolId(), req.params(),
                    ToolFailureKind.REJECTED, "tool executor saturated", 0L));
        }
        return submitted
                .orTimeout(perTool.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        LOG.warn("Tool {} timed out after {} ms", req.toolId(), perTool.toMillis());
                        return ToolInvocation.failure(req.toolId(), req.params(), ToolFailureKind.TIMEOUT,
                                "timed out after " + perTool.toMillis() + " ms", TimeUtils.elapsedMillis(t0));
                    }
                    LOG.error("Tool {} task failed", req.toolId(), cause);
                    return ToolInvocation.failure(req.toolId(), req.params(), ToolFailureKind.ERROR,
                            String.valueOf(cause.getMessage()), TimeUtils.elapsedMillis(t0));
                });
    }

    private ToolInvocation invoke(ToolCollaborator tool, ToolRequest req, Duration timeout, long t0) {
        try {
            ToolResult result = tool.invoke(req.params(), timeout);
            return ToolInvocation.success(req.toolId(), req.params(), result.content(),
                    TimeUtils.elapsedMillis(t0), result.cost());
        } catch (ToolFailureException e) {
            LOG.warn("Tool {} failed: kind={}, message={}", req.toolId(), e.getKind(), e.getMessage());
            return ToolInvocation.failure(req.toolId(), req.params(), e.getKind(), e.getMessage(),
                    TimeUtils.elapsedMillis(t0));
        } catch (RuntimeException e) {
            LOG.error("Tool {} unexpected error", req.toolId(), e);
            return ToolInvocation.failure(req.toolId(), req.params(), ToolFailureKind.ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), TimeUtils.elapsedMillis(t0));
        }
    }
}
