package fr.lapetina.consensus.orchestrator.infrastructure.execution;

import java.time.Duration;

/**
 * Retry policy for failed attempts.
 *
 * When disabled, exactly one attempt is made per call whatever the backend's
 * {@code maxRetries}. When enabled, a failed attempt is retried up to
 * {@code maxRetries} times with exponential backoff. Deadline misses are never retried.
 */
public record RetryPolicy(
        boolean enabled,
        Duration initialBackoff,
        Duration maxBackoff,
        double backoffMultiplier
) {
    public RetryPolicy {
        if (initialBackoff == null || initialBackoff.isNegative()) {
            initialBackoff = Duration.ZERO;
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff;
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1, got " + backoffMultiplier);
        }
    }

    public static RetryPolicy disabled() {
        return new RetryPolicy(false, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public static RetryPolicy exponential(Duration initialBackoff, Duration maxBackoff, double multiplier) {
        return new RetryPolicy(true, initialBackoff, maxBackoff, multiplier);
    }

    /**
     * Number of retries allowed for a backend configured with {@code maxRetries}.
     */
    public int retriesFor(int maxRetries) {
        return enabled ? Math.max(0, maxRetries) : 0;
    }

    /**
     * Backoff before the given retry, 1-based.
     */
    public Duration backoffBefore(int retry) {
        double millis = initialBackoff.toMillis() * Math.pow(backoffMultiplier, Math.max(0, retry - 1));
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
