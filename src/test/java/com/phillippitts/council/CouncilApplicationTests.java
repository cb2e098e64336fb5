package com.phillippitts.council;

import com.phillippitts.council.domain.DeliberationResult;
import com.phillippitts.council.domain.Query;
import com.phillippitts.council.domain.Recommendation;
import com.phillippitts.council.service.events.LifecycleEvent;
import com.phillippitts.council.service.events.LifecycleEventType;
import com.phillippitts.council.service.gateway.ModelGateway;
import com.phillippitts.council.service.governor.CostLedger;
import com.phillippitts.council.service.health.CostBudgetHealthIndicator;
import com.phillippitts.council.service.pipeline.DeliberationPipeline;
import com.phillippitts.council.testutil.FakeModelGateway;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@SpringBootTest(properties = {
        "council.pipeline.shuffle-labels=false",
        "council.pipeline.stage1-timeout=5s",
        "council.pipeline.stage2-timeout=5s",
        "council.pipeline.stage3-timeout=5s",
        "council.pipeline.stage4-timeout=5s"
})
class CouncilApplicationTests {

    @Autowired
    private DeliberationPipeline pipeline;

    @Autowired
    private CostLedger ledger;

    @Autowired
    private FakeModelGateway gateway;

    @Autowired
    private AsyncEventCollector collector;

    @Autowired
    private CostBudgetHealthIndicator costBudgetHealthIndicator;

    @Test
    void contextLoads() {
        assertThat(pipeline).isNotNull();
    }

    @Test
    void deliberatesThroughWiredBeans() {
        Query query = Query.of("Summarise the liability exposure in the supplier agreement and flag any "
                + "clauses that deviate from our standard indemnity terms", "bellcourt");

        DeliberationResult result = pipeline.deliberate(query);

        assertThat(result.degraded()).isFalse();
        assertThat(result.finalAnswer()).isEqualTo("Council synthesis");
        assertThat(result.successfulResponses()).hasSize(3);
        assertThat(result.verdict()).isNotNull();
        assertThat(result.verdict().recommendation()).isEqualTo(Recommendation.APPROVE);
        assertThat(gateway.calls(FakeModelGateway.Kind.STAGE1)).hasSize(3);
        assertThat(ledger.entriesFor(result.queryId())).isNotEmpty();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(collector.events())
                        .anyMatch(e -> e.queryId().equals(result.queryId())
                                && e.type() == LifecycleEventType.COMPLETED));
    }

    @Test
    void reportsBudgetHealthWithGatewayConfigured() {
        Health health = costBudgetHealthIndicator.health();

        assertThat(health.getDetails()).containsEntry("gatewayConfigured", true);
        assertThat(health.getDetails()).containsKeys("spent", "limit", "remaining", "utilisation");
    }

    @TestConfiguration
    static class GatewayTestConfiguration {

        @Bean
        FakeModelGateway fakeModelGateway() {
            return new FakeModelGateway();
        }

        @Bean
        AsyncEventCollector asyncEventCollector() {
            return new AsyncEventCollector();
        }
    }

    static class AsyncEventCollector {

        private final List<LifecycleEvent> events = new CopyOnWriteArrayList<>();

        @EventListener
        @Async("eventExecutor")
        public void onEvent(LifecycleEvent event) {
            events.add(event);
        }

        public List<LifecycleEvent> events() {
            return List.copyOf(events);
        }
    }
}
