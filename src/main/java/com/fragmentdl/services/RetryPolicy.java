package com.fragmentdl.services;

import com.fragmentdl.config.EngineProperties;

import java.time.Duration;
import java.util.Random;

/**
 * Backoff and give-up decisions for one fragment. Stateless: every answer is a function of the attempt number.
 *
 * @param maxAttempts requests a fragment may issue before it gives up
 * @param baseDelay   wait after the first failed attempt
 * @param multiplier  growth factor per further attempt
 * @param jitter      upper bound of the random extra wait, {@link Duration#ZERO} for none
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration jitter) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
        if (jitter == null) jitter = Duration.ZERO;
    }

    public static RetryPolicy of(int maxAttempts, EngineProperties.Retry retry) {
        return new RetryPolicy(maxAttempts, retry.baseDelay(), retry.multiplier(), retry.jitter());
    }

    /**
     * @return {@code baseDelay * multiplier^(attempt - 1)}
     */
    public Duration backoffFor(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
        double nanos = baseDelay.toNanos() * Math.pow(multiplier, attempt - 1);
        return Duration.ofNanos((long) Math.min(nanos, Long.MAX_VALUE));
    }

    /**
     * Backoff plus a uniformly drawn jitter in {@code [0, jitter]}.
     */
    public Duration delayFor(int attempt, Random random) {
        Duration backoff = backoffFor(attempt);
        if (jitter.isZero()) {
            return backoff;
        }
        long extra = (long) (random.nextDouble() * jitter.toNanos());
        return backoff.plusNanos(extra);
    }

    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
