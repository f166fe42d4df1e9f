package io.bastion.core.request;

import io.bastion.api.error.ApiException;
import io.bastion.api.error.RateLimitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a call up to {@code maxAttempts} times, retrying only retryable failure classes.
 * <p>
 * Between attempts it waits for the upstream's {@code Retry-After} when a rate-limit
 * failure carries one, otherwise {@code baseDelay * 2^attempt}. Every other failure
 * propagates on first occurrence.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public RetryExecutor(int maxAttempts, Duration baseDelay) {
        this(maxAttempts, baseDelay, d -> Thread.sleep(d.toMillis()));
    }

    public RetryExecutor(int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    public <T> T execute(Supplier<T> call) {
        for (int attempt = 0; ; attempt++) {
            try {
                return call.get();
            } catch (ApiException e) {
                if (!e.isRetryable() || attempt + 1 >= maxAttempts) {
                    throw e;
                }
                Duration delay = delayFor(e, attempt);
                log.warn("Attempt {}/{} failed with {}, retrying in {}ms",
                        attempt + 1, maxAttempts, e.errorCode().value(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    Duration delayFor(ApiException e, int attempt) {
        if (e instanceof RateLimitException) {
            long retryAfter = ((RateLimitException) e).retryAfterSeconds();
            if (retryAfter > 0) {
                return Duration.ofSeconds(retryAfter);
            }
        }
        return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
