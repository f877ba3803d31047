package fr.lapetina.consensus.orchestrator.infrastructure.execution.exception;

import java.time.Duration;

/**
 * Failure of a single deadline-bounded attempt.
 *
 * Always carries the time spent before the attempt ended, so callers can
 * report an execution time for failed attempts too.
 */
public abstract class AttemptException extends RuntimeException {

    private final Duration elapsed;

    protected AttemptException(String message, Duration elapsed, Throwable cause) {
        super(message, cause);
        this.elapsed = elapsed;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
