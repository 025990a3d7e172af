/* (C)2026 */
package com.ammann.valuation.pipeline;

import java.time.Duration;

/**
 * Bounded exponential backoff for polling one job within a single advance call.
 *
 * @param baseDelay delay before the second poll
 * @param multiplier growth factor per attempt
 * @param maxDelay cap for a single delay
 * @param maxAttempts polls per advance call
 */
public record PollBackoff(Duration baseDelay, double multiplier, Duration maxDelay, int maxAttempts) {

    public PollBackoff {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1: " + multiplier);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    /**
     * Delay after the given zero-based attempt, never above {@link #maxDelay()}.
     */
    public Duration delayAfter(int attempt) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /** Blocking pause between polls, replaceable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
