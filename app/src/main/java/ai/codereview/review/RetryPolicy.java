package ai.codereview.review;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry settings for agent invocations.
 *
 * @param maxAttempts total invocations allowed, the first one included
 * @param initialBackoff delay before the second attempt
 * @param maxBackoff upper bound for any single delay before jitter
 * @param jitterFactor relative spread applied to each delay, between 0.0 and 1.0
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitterFactor) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.3);
    }

    public static RetryPolicy noRetries() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0);
    }

    /**
     * Delay to wait after the given zero-based failed attempt: {@code initialBackoff * 2^attempt},
     * capped at {@code maxBackoff}, then spread by {@code 1 +/- jitterFactor}.
     */
    public Duration backoffFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be zero or greater");
        }
        long baseMillis = initialBackoff.toMillis();
        long factor = 1L << Math.min(attempt, 30);
        long exponential = baseMillis > Long.MAX_VALUE / factor ? Long.MAX_VALUE : baseMillis * factor;
        long capped = Math.min(exponential, maxBackoff.toMillis());
        double jitterMultiplier = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Duration.ofMillis(Math.max(0L, (long) (capped * jitterMultiplier)));
    }
}
