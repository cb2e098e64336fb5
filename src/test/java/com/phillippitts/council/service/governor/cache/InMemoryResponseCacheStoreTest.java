package com.phillippitts.council.service.governor.cache;

import com.phillippitts.council.service.gateway.GatewayCompletion;
import com.phillippitts.council.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryResponseCacheStoreTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private final MutableClock clock = MutableClock.at("2025-11-20T10:00:00Z");

    @Test
    void shouldReturnStoredValueBeforeExpiry() {
        InMemoryResponseCacheStore store = new InMemoryResponseCacheStore(10, clock);
        store.set("k", completion("cached"), TTL);

        clock.advance(Duration.ofMinutes(9));

        assertThat(store.get("k")).map(GatewayCompletion::text).contains("cached");
        assertThat(store.stats().hits()).isEqualTo(1);
    }

    @Test
    void shouldMissAndDropExpiredEntry() {
        InMemoryResponseCacheStore store = new InMemoryResponseCacheStore(10, clock);
        store.set("k", completion("cached"), TTL);

        clock.advance(TTL);

        assertThat(store.get("k")).isEmpty();
        assertThat(store.stats().size()).isZero();
        assertThat(store.stats().misses()).isEqualTo(1);
    }

    @Test
    void shouldEvictLeastRecentlyUsedBeyondCapacity() {
        InMemoryResponseCacheStore store = new InMemoryResponseCacheStore(2, clock);
        store.set("a", completion("a"), TTL);
        store.set("b", completion("b"), TTL);
        store.get("a");

        store.set("c", completion("c"), TTL);

        assertThat(store.get("b")).isEmpty();
        assertThat(store.get("a")).isPresent();
        assertThat(store.get("c")).isPresent();
        assertThat(store.stats().evictions()).isEqualTo(1);
        assertThat(store.stats().size()).isEqualTo(2);
    }

    @Test
    void shouldReportHitRateAndUtilisation() {
        InMemoryResponseCacheStore store = new InMemoryResponseCacheStore(4, clock);
        store.set("a", completion("a"), TTL);
        store.get("a");
        store.get("missing");

        CacheStats stats = store.stats();
        assertThat(stats.hitRate()).isEqualTo(0.5);
        assertThat(stats.utilisation()).isEqualTo(0.25);
    }

    @Test
    void shouldClearAllEntries() {
        InMemoryResponseCacheStore store = new InMemoryResponseCacheStore(4, clock);
        store.set("a", completion("a"), TTL);

        store.clear();

        assertThat(store.get("a")).isEmpty();
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new InMemoryResponseCacheStore(0, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static GatewayCompletion completion(String text) {
        return new GatewayCompletion(text, 10, 5, 20L);
    }
}
