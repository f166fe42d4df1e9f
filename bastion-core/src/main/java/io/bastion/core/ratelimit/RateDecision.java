package io.bastion.core.ratelimit;

import java.util.OptionalLong;

/**
 * Outcome of a rate-limit check.
 *
 * @param allowed           whether the request may proceed
 * @param retryAfterSeconds seconds until a slot frees up, present only when denied
 */
public record RateDecision(boolean allowed, OptionalLong retryAfterSeconds) {

    private static final RateDecision ALLOWED = new RateDecision(true, OptionalLong.empty());

    public static RateDecision allow() {
        return ALLOWED;
    }

    public static RateDecision deny(long retryAfterSeconds) {
        return new RateDecision(false, OptionalLong.of(retryAfterSeconds));
    }
}
