package fr.lapetina.consensus.orchestrator.infrastructure.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Counter-based circuit breaker for one backend.
 *
 * States are derived from the counters:
 * - CLOSED: failureCount below threshold, requests pass through
 * - OPEN: threshold reached and the cooldown since the last failure has not elapsed
 * - HALF_OPEN: threshold reached but the cooldown has elapsed; the next
 *   admission check resets the failure count and lets the backend back in
 *
 * Successes decrement the failure count by one, floored at zero.
 * Thread-safe: every method holds this instance's monitor.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(60);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String backendId;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private int failureCount;
    private Instant lastFailureTime = Instant.EPOCH;

    public CircuitBreaker(String backendId, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1, got " + failureThreshold);
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown must be non-negative, got " + cooldown);
        }
        this.backendId = backendId;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public CircuitBreaker(String backendId) {
        this(backendId, DEFAULT_FAILURE_THRESHOLD, DEFAULT_COOLDOWN, Clock.systemUTC());
    }

    /**
     * Admission check.
     *
     * <p>Returns true while the circuit is open. Once the cooldown has elapsed
     * the first call resets the failure count and returns false.
     */
    public synchronized boolean isOpen() {
        if (failureCount < failureThreshold) {
            return false;
        }
        if (cooldownElapsed()) {
            failureCount = 0;
            log.info("Circuit breaker reset after cooldown: backendId={}", backendId);
            return false;
        }
        return true;
    }

    /**
     * Records a failed attempt.
     *
     * @return true if this failure opened the circuit
     */
    public synchronized boolean recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (failureCount == failureThreshold) {
            log.warn("Circuit breaker OPENED: backendId={}, failures={}", backendId, failureCount);
            return true;
        }
        return false;
    }

    /**
     * Records a successful attempt.
     */
    public synchronized void recordSuccess() {
        if (failureCount > 0) {
            failureCount--;
        }
    }

    /**
     * Derived state. Unlike {@link #isOpen()} this never mutates the counters.
     */
    public synchronized State getState() {
        if (failureCount < failureThreshold) {
            return State.CLOSED;
        }
        return cooldownElapsed() ? State.HALF_OPEN : State.OPEN;
    }

    private boolean cooldownElapsed() {
        return Duration.between(lastFailureTime, clock.instant()).compareTo(cooldown) >= 0;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getBackendId() {
        return backendId;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{" +
                "backendId='" + backendId + '\'' +
                ", failures=" + failureCount +
                "/" + failureThreshold +
                '}';
    }
}
