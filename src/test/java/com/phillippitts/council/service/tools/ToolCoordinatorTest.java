package com.phillippitts.council.service.tools;

import com.phillippitts.council.config.properties.ToolProperties;
import com.phillippitts.council.domain.ToolFailureKind;
import com.phillippitts.council.domain.ToolInvocation;
import com.phillippitts.council.service.metrics.CouncilMetrics;
import com.phillippitts.council.service.metrics.CouncilMetricsPublisher;
import com.phillippitts.council.testutil.CouncilFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCoordinatorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldReturnInvocationsInCatalogPriorityOrder() {
        ToolCoordinator coordinator = coordinator(CouncilFixtures.toolProperties(),
                tool("web_search", params -> "headlines"),
                tool("rag_search", params -> "passages"));

        ToolBatch batch = coordinator.execute(List.of(request("web_search"), request("rag_search")));

        assertThat(batch.invocations()).extracting(ToolInvocation::toolId).containsExactly("rag_search", "web_search");
        assertThat(batch.successes()).hasSize(2);
        assertThat(batch.asMap().get("web_search").content()).isEqualTo("headlines");
    }

    @Test
    void shouldRunDuplicateToolIdsOnce() {
        AtomicInteger calls = new AtomicInteger();
        ToolCoordinator coordinator = coordinator(CouncilFixtures.toolProperties(),
                tool("calculator", params -> {
                    calls.incrementAndGet();
                    return String.valueOf(params.get("expression"));
                }));

        ToolBatch batch = coordinator.execute(List.of(
                new ToolRequest("calculator", Map.of("expression", "1+1")),
                new ToolRequest("calculator", Map.of("expression", "2+2"))));

        assertThat(calls).hasValue(1);
        assertThat(batch.invocations()).singleElement()
                .satisfies(i -> assertThat(i.content()).isEqualTo("1+1"));
    }

    @Test
    void shouldReportUnregisteredToolAsUnavailable() {
        ToolCoordinator coordinator = coordinator(CouncilFixtures.toolProperties());

        ToolBatch batch = coordinator.execute(List.of(request("sports_data")));

        assertThat(batch.failures()).singleElement()
                .satisfies(i -> assertThat(i.failureKind()).isEqualTo(ToolFailureKind.UNAVAILABLE));
    }

    @Test
    void shouldIsolateToolFailures() {
        ToolCoordinator coordinator = coordinator(CouncilFixtures.toolProperties(),
                tool("web_search", params -> {
                    throw new ToolFailureException("web_search", ToolFailureKind.ERROR, "search backend down");
                }),
                tool("calculator", params -> "4"));

        ToolBatch batch = coordinator.execute(List.of(request("web_search"), request("calculator")));

        assertThat(batch.successes()).extracting(ToolInvocation::toolId).containsExactly("calculator");
        assertThat(batch.failures()).singleElement().satisfies(i -> {
            assertThat(i.failureKind()).isEqualTo(ToolFailureKind.ERROR);
            assertThat(i.error()).contains("search backend down");
        });
        assertThat(registry.get("council.tool.invocations").tag("tool", "calculator").tag("outcome", "success")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldMapUnexpectedExceptionsToError() {
        ToolCoordinator coordinator = coordinator(CouncilFixtures.toolProperties(),
                tool("code_execution", params -> {
                    throw new IllegalStateException("sandbox crashed");
                }));

        ToolBatch batch = coordinator.execute(List.of(request("code_execution")));

        assertThat(batch.failures()).singleElement().satisfies(i -> {
            assertThat(i.failureKind()).isEqualTo(ToolFailureKind.ERROR);
            assertThat(i.error()).contains("IllegalStateException");
        });
    }

    @Test
    void shouldTimeOutSlowToolWithoutBlockingOthers() {
        ToolProperties props = new ToolProperties();
        props.setPerToolTimeout(Duration.ofMillis(100));
        props.setOverallTimeout(Duration.ofSeconds(2));
        ToolCoordinator coordinator = coordinator(props,
                tool("web_search", params -> {
                    sleep(1_000);
                    return "too late";
                }),
                tool("calculator", params -> "4"));

        long start = System.nanoTime();
        ToolBatch batch = coordinator.execute(List.of(request("web_search"), request("calculator")));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(900));
        assertThat(batch.asMap().get("web_search").failureKind()).isEqualTo(ToolFailureKind.TIMEOUT);
        assertThat(batch.asMap().get("calculator").success()).isTrue();
    }

    @Test
    void shouldReportRejectedToolWhenExecutorIsSaturated() {
        ToolProperties props = CouncilFixtures.toolProperties();
        Executor saturated = task -> {
            throw new RejectedExecutionException("pool full");
        };
        ToolCoordinator coordinator = new ToolCoordinator(
                new ToolCatalog(List.of(tool("calculator", params -> "4")), props), saturated, props,
                new CouncilMetricsPublisher(new CouncilMetrics(registry)));

        long start = System.nanoTime();
        ToolBatch batch = coordinator.execute(List.of(request("calculator")));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(props.getOverallTimeout());
        assertThat(batch.failures()).singleElement().satisfies(i -> {
            assertThat(i.failureKind()).isEqualTo(ToolFailureKind.REJECTED);
            assertThat(i.error()).contains("saturated");
        });
    }

    @Test
    void shouldReturnEmptyBatchForNoRequests() {
        assertThat(coordinator(CouncilFixtures.toolProperties()).execute(List.of()).isEmpty()).isTrue();
    }

    private ToolCoordinator coordinator(ToolProperties props, ToolCollaborator... tools) {
        return new ToolCoordinator(new ToolCatalog(List.of(tools), props), pool, props,
                new CouncilMetricsPublisher(new CouncilMetrics(registry)));
    }

    private static ToolRequest request(String toolId) {
        return new ToolRequest(toolId, Map.of("query", "q", "workspace", "General"));
    }

    private static ToolCollaborator tool(String id, Function<Map<String, Object>, String> body) {
        return new ToolCollaborator() {
            @Override
            public String toolId() {
                return id;
            }

            @Override
            public ToolResult invoke(Map<String, Object> params, Duration timeout) {
                return ToolResult.of(body.apply(params));
            }
        };
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
