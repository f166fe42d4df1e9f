package io.bastion.core.cache;

import io.bastion.api.cache.SharedCacheBackend;
import io.bastion.api.status.CircuitState;
import io.bastion.core.breaker.CircuitBreaker;
import io.bastion.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CacheManagerTest {

    private MutableClock clock;
    private InMemorySharedCache shared;
    private CircuitBreaker breaker;
    private CacheManager cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        shared = new InMemorySharedCache(clock);
        breaker = new CircuitBreaker("cache-backend", 3, Duration.ofSeconds(30), 1, clock);
        cache = new CacheManager(shared, breaker, Duration.ofSeconds(60), clock);
    }

    // --- get / set ---

    @Test
    void shouldReturnValueImmediatelyAfterSet() {
        assertThat(cache.set("orders:1", "{\"id\":1}", Duration.ofSeconds(60))).isTrue();

        assertThat(cache.get("orders:1")).contains("{\"id\":1}");
        assertThat(shared.get("orders:1")).contains("{\"id\":1}");
    }

    @Test
    void shouldMissAfterTtlElapses() {
        cache.set("orders:1", "v", Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(60));

        assertThat(cache.get("orders:1")).isEmpty();
    }

    @Test
    void shouldReturnEmptyForUnknownKey() {
        assertThat(cache.get("missing")).isEmpty();
    }

    @Test
    void shouldCapLocalTtlBelowSharedTtl() {
        cache.set("orders:1", "v", Duration.ofSeconds(300));
        shared.delete("orders:1");

        // local tier still serves the hot key within its cap
        assertThat(cache.get("orders:1")).contains("v");

        clock.advance(Duration.ofSeconds(61));
        assertThat(cache.get("orders:1")).isEmpty();
    }

    @Test
    void shouldRepopulateLocalTierWithRemainingSharedTtl() {
        shared.setex("orders:1", Duration.ofSeconds(30), "v");

        assertThat(cache.get("orders:1")).contains("v");
        assertThat(cache.localSize()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(30));
        assertThat(cache.get("orders:1")).isEmpty();
        assertThat(cache.localSize()).isZero();
    }

    // --- invalidation ---

    @Test
    void shouldDeleteFromBothTiers() {
        cache.set("orders:1", "v", Duration.ofSeconds(60));

        assertThat(cache.delete("orders:1")).isTrue();

        assertThat(cache.get("orders:1")).isEmpty();
        assertThat(shared.get("orders:1")).isEmpty();
    }

    @Test
    void shouldInvalidateKeysByPrefix() {
        cache.set("orders:1", "a", Duration.ofSeconds(60));
        cache.set("orders:2", "b", Duration.ofSeconds(60));
        cache.set("users:1", "c", Duration.ofSeconds(60));

        long removed = cache.invalidatePattern("orders");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("orders:1")).isEmpty();
        assertThat(cache.get("orders:2")).isEmpty();
        assertThat(shared.keys("orders*")).isEmpty();
        assertThat(cache.get("users:1")).contains("c");
    }

    @Test
    void shouldTreatWildcardsInPrefixLiterally() {
        cache.set("search?q=1", "a", Duration.ofSeconds(60));
        cache.set("searchXq=1", "b", Duration.ofSeconds(60));
        cache.set("report*", "c", Duration.ofSeconds(60));
        cache.set("reports", "d", Duration.ofSeconds(60));

        assertThat(cache.invalidatePattern("search?")).isEqualTo(1);
        assertThat(cache.invalidatePattern("report*")).isEqualTo(1);

        assertThat(cache.get("search?q=1")).isEmpty();
        assertThat(cache.get("searchXq=1")).contains("b");
        assertThat(cache.get("report*")).isEmpty();
        assertThat(cache.get("reports")).contains("d");
    }

    @Test
    void shouldEscapeGlobMetacharacters() {
        assertThat(CacheManager.escapeGlob("a*b?c[d]\\e")).isEqualTo("a\\*b\\?c\\[d\\]\\\\e");
        assertThat(CacheManager.escapeGlob("bastion:orders")).isEqualTo("bastion:orders");
    }

    @Test
    void shouldPurgeExpiredLocalEntries() {
        cache.set("orders:1", "v", Duration.ofSeconds(10));
        cache.set("orders:2", "v", Duration.ofSeconds(120));

        clock.advance(Duration.ofSeconds(11));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.localSize()).isEqualTo(1);
    }

    // --- shared tier failures ---

    @Test
    void shouldDegradeToMissWhenSharedTierFails() {
        var failing = new FailingBackend();
        var degraded = new CacheManager(failing, breaker, Duration.ofSeconds(60), clock);

        assertThat(degraded.set("orders:1", "v", Duration.ofSeconds(60))).isFalse();
        assertThat(degraded.get("orders:1")).isEmpty();
        assertThat(degraded.invalidatePattern("orders")).isZero();
        assertThat(degraded.localSize()).isZero();
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void shouldSkipSharedTierWhileBreakerOpen() {
        var failing = new FailingBackend();
        var degraded = new CacheManager(failing, breaker, Duration.ofSeconds(60), clock);
        for (int i = 0; i < 3; i++) {
            degraded.get("orders:1");
        }
        int callsWhenOpened = failing.calls.get();

        degraded.get("orders:1");
        degraded.set("orders:1", "v", Duration.ofSeconds(60));

        assertThat(failing.calls.get()).isEqualTo(callsWhenOpened);
    }

    @Test
    void shouldServeLocalTierWhileSharedTierIsDown() {
        cache.set("orders:1", "v", Duration.ofSeconds(60));
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }

        assertThat(cache.get("orders:1")).contains("v");
    }

    private static class FailingBackend implements SharedCacheBackend {

        final AtomicInteger calls = new AtomicInteger();

        private RuntimeException down() {
            calls.incrementAndGet();
            return new IllegalStateException("connection refused");
        }

        @Override
        public Optional<String> get(String key) {
            throw down();
        }

        @Override
        public Optional<Duration> ttl(String key) {
            throw down();
        }

        @Override
        public boolean setex(String key, Duration ttl, String value) {
            throw down();
        }

        @Override
        public long delete(String... keys) {
            throw down();
        }

        @Override
        public List<String> keys(String pattern) {
            throw down();
        }

        @Override
        public boolean ping() {
            return false;
        }

        @Override
        public void close() {
        }
    }
}
