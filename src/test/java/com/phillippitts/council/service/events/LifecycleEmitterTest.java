package com.phillippitts.council.service.events;

import com.phillippitts.council.testutil.EventCapturingPublisher;
import com.phillippitts.council.testutil.MutableClock;
import com.phillippitts.council.testutil.RecordingLifecycleListener;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LifecycleEmitterTest {

    private final MutableClock clock = MutableClock.at("2025-11-20T10:00:00Z");
    private final RecordingLifecycleListener listener = new RecordingLifecycleListener();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();

    @Test
    void shouldNumberEventsAndDeliverToListenerAndBus() {
        LifecycleEmitter emitter = new LifecycleEmitter("q1", listener, publisher, clock);

        emitter.emit(LifecycleEventType.INTENT_DECIDED, "complexity", "SIMPLE");
        emitter.emit(LifecycleEventType.STAGE1_COMPLETE, "succeeded", 1);

        assertThat(listener.events()).extracting(LifecycleEvent::sequence).containsExactly(1, 2);
        assertThat(listener.events()).allMatch(e -> e.queryId().equals("q1")
                && e.timestamp().equals(Instant.parse("2025-11-20T10:00:00Z")));
        assertThat(publisher.lifecycleEvents()).isEqualTo(listener.events());
        assertThat(emitter.emitted()).isEqualTo(2);
    }

    @Test
    void shouldDropNullPayloadValues() {
        LifecycleEmitter emitter = new LifecycleEmitter("q1", listener, null, clock);

        emitter.emit(LifecycleEventType.STAGE3_COMPLETE, "success", true, "error", null);

        assertThat(listener.last().payload()).containsOnlyKeys("success");
    }

    @Test
    void shouldIgnoreEventsAfterTerminalEvent() {
        LifecycleEmitter emitter = new LifecycleEmitter("q1", listener, publisher, clock);

        emitter.emit(LifecycleEventType.COMPLETED, "degraded", false);
        emitter.emit(LifecycleEventType.FAILED, "reason", "late");

        assertThat(listener.types()).containsExactly(LifecycleEventType.COMPLETED);
        assertThat(publisher.lifecycleEvents()).hasSize(1);
    }

    @Test
    void shouldKeepRunningWhenListenerThrows() {
        LifecycleEmitter emitter = new LifecycleEmitter("q1", event -> {
            throw new IllegalStateException("listener bug");
        }, publisher, clock);

        emitter.emit(LifecycleEventType.INTENT_DECIDED);
        emitter.emit(LifecycleEventType.COMPLETED);

        assertThat(publisher.lifecycleTypes())
                .containsExactly(LifecycleEventType.INTENT_DECIDED, LifecycleEventType.COMPLETED);
    }

    @Test
    void shouldKeepSequenceConsistentUnderConcurrentEmission() throws InterruptedException {
        LifecycleEmitter emitter = new LifecycleEmitter("q1", listener, null, clock);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 100; i++) {
            pool.execute(() -> emitter.emit(LifecycleEventType.STAGE1_RESPONSE));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        List<Integer> sequences = listener.events().stream().map(LifecycleEvent::sequence).toList();
        assertThat(sequences).hasSize(100).isSorted().doesNotHaveDuplicates();
    }
}
