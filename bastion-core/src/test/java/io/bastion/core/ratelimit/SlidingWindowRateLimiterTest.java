package io.bastion.core.ratelimit;

import io.bastion.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    @Test
    void shouldAllowFirstCallForUnseenKey() {
        var limiter = new SlidingWindowRateLimiter(1, Duration.ofSeconds(10), clock);

        RateDecision decision = limiter.isAllowed("orders");

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.retryAfterSeconds()).isEmpty();
    }

    @Test
    void shouldDenyCallBeyondLimitWithRetryAfter() {
        var limiter = new SlidingWindowRateLimiter(3, Duration.ofSeconds(10), clock);
        limiter.isAllowed("orders");
        clock.advance(Duration.ofSeconds(1));
        limiter.isAllowed("orders");
        clock.advance(Duration.ofSeconds(1));
        limiter.isAllowed("orders");

        RateDecision decision = limiter.isAllowed("orders");

        assertThat(decision.allowed()).isFalse();
        // oldest admitted at t0, now t0+2s, window 10s
        assertThat(decision.retryAfterSeconds()).hasValue(8);
        assertThat(limiter.currentCount("orders")).isEqualTo(3);
    }

    @Test
    void shouldAllowAgainAfterWaitingRetryAfter() {
        var limiter = new SlidingWindowRateLimiter(2, Duration.ofSeconds(1), clock);
        limiter.isAllowed("orders");
        limiter.isAllowed("orders");

        RateDecision denied = limiter.isAllowed("orders");
        assertThat(denied.allowed()).isFalse();
        clock.advance(Duration.ofSeconds(denied.retryAfterSeconds().getAsLong()).plusMillis(1));

        assertThat(limiter.isAllowed("orders").allowed()).isTrue();
    }

    @Test
    void shouldTreatTimestampExactlyWindowOldAsOutside() {
        var limiter = new SlidingWindowRateLimiter(1, Duration.ofSeconds(10), clock);
        limiter.isAllowed("orders");

        clock.advance(Duration.ofSeconds(10));

        assertThat(limiter.isAllowed("orders").allowed()).isTrue();
    }

    @Test
    void shouldRoundRetryAfterUpToAtLeastOneSecond() {
        var limiter = new SlidingWindowRateLimiter(1, Duration.ofSeconds(10), clock);
        limiter.isAllowed("orders");
        clock.advance(Duration.ofMillis(9_500));

        assertThat(limiter.isAllowed("orders").retryAfterSeconds()).hasValue(1);
    }

    @Test
    void shouldNotCountDeniedCalls() {
        var limiter = new SlidingWindowRateLimiter(1, Duration.ofSeconds(10), clock);
        limiter.isAllowed("orders");
        limiter.isAllowed("orders");
        limiter.isAllowed("orders");

        assertThat(limiter.currentCount("orders")).isEqualTo(1);
    }

    @Test
    void shouldTrackKeysIndependently() {
        var limiter = new SlidingWindowRateLimiter(1, Duration.ofSeconds(10), clock);
        limiter.isAllowed("orders");

        assertThat(limiter.isAllowed("orders").allowed()).isFalse();
        assertThat(limiter.isAllowed("wallets").allowed()).isTrue();
    }

    @Test
    void shouldDropKeysWhoseWindowEmptied() {
        var limiter = new SlidingWindowRateLimiter(5, Duration.ofSeconds(10), clock);
        limiter.isAllowed("orders");
        limiter.isAllowed("wallets");
        assertThat(limiter.trackedKeys()).isEqualTo(2);

        clock.advance(Duration.ofSeconds(11));
        limiter.isAllowed("tickets");

        assertThat(limiter.trackedKeys()).isEqualTo(1);
        assertThat(limiter.currentCount("orders")).isZero();
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(1, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
