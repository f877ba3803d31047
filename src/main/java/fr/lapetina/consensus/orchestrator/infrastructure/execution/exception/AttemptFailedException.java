package fr.lapetina.consensus.orchestrator.infrastructure.execution.exception;

import java.time.Duration;

/**
 * Thrown when the unit of work itself failed before its deadline.
 * The original failure is available as the cause.
 */
public final class AttemptFailedException extends AttemptException {

    public AttemptFailedException(Duration elapsed, Throwable cause) {
        super(describe(cause), elapsed, cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "Attempt failed";
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
