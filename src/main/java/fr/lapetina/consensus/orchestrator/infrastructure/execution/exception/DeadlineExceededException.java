package fr.lapetina.consensus.orchestrator.infrastructure.execution.exception;

import java.time.Duration;

/**
 * Thrown when an attempt did not complete before its deadline.
 */
public final class DeadlineExceededException extends AttemptException {

    private final Duration deadline;

    public DeadlineExceededException(Duration deadline, Duration elapsed) {
        super("Deadline of " + deadline.toMillis() + "ms exceeded after " + elapsed.toMillis() + "ms",
                elapsed, null);
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
