package fr.lapetina.consensus.orchestrator.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Uniform result of one backend execution attempt.
 * Immutable and thread-safe.
 *
 * <p>{@code content} and {@code confidence} are present iff the status is
 * {@link ResponseStatus#SUCCESS}, and {@code errorMessage} is present iff the
 * status is {@link ResponseStatus#ERROR} or {@link ResponseStatus#DISABLED}.
 * The canonical constructor rejects any other combination; the named
 * constructors are the usual way in.
 */
public record ModelResponse(
        String backendId,
        ResponseStatus status,
        String content,
        Double confidence,
        String errorMessage,
        Duration executionTime,
        Instant timestamp
) {
    public ModelResponse {
        Objects.requireNonNull(backendId, "Backend ID is required");
        Objects.requireNonNull(status, "Status is required");
        if (status == ResponseStatus.SUCCESS) {
            Objects.requireNonNull(content, "Content is required for a successful response");
            Objects.requireNonNull(confidence, "Confidence is required for a successful response");
            if (confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("Confidence must be within [0, 1], got " + confidence);
            }
        } else if (content != null || confidence != null) {
            throw new IllegalArgumentException("Only successful responses carry content and confidence, got " + status);
        }
        boolean carriesMessage = status == ResponseStatus.ERROR || status == ResponseStatus.DISABLED;
        if (carriesMessage && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("Error message is required for status " + status);
        }
        if (!carriesMessage && errorMessage != null) {
            throw new IllegalArgumentException("Error message is not allowed for status " + status);
        }
        if (executionTime == null || executionTime.isNegative()) {
            executionTime = Duration.ZERO;
        }
        if (status == ResponseStatus.DISABLED) {
            executionTime = Duration.ZERO;
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * Creates a successful response.
     */
    public static ModelResponse success(
            String backendId,
            String content,
            double confidence,
            Duration executionTime
    ) {
        return new ModelResponse(backendId, ResponseStatus.SUCCESS, content, confidence,
                null, executionTime, null);
    }

    /**
     * Creates a timeout response.
     */
    public static ModelResponse timeout(String backendId, Duration executionTime) {
        return new ModelResponse(backendId, ResponseStatus.TIMEOUT, null, null,
                null, executionTime, null);
    }

    /**
     * Creates an error response.
     */
    public static ModelResponse error(String backendId, String errorMessage, Duration executionTime) {
        String message = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        return new ModelResponse(backendId, ResponseStatus.ERROR, null, null,
                message, executionTime, null);
    }

    /**
     * Creates a response for a backend that is switched off. Execution time is always zero.
     */
    public static ModelResponse disabled(String backendId, String reason) {
        String message = reason == null || reason.isBlank() ? "Model is disabled" : reason;
        return new ModelResponse(backendId, ResponseStatus.DISABLED, null, null,
                message, Duration.ZERO, null);
    }

    public boolean isSuccess() {
        return status == ResponseStatus.SUCCESS;
    }

    /**
     * Returns true if the response can take part in consensus.
     */
    public boolean isValid() {
        return isSuccess() && !content.isBlank();
    }

    /**
     * Execution time in fractional seconds.
     */
    public double executionSeconds() {
        return executionTime.toNanos() / 1_000_000_000.0;
    }
}
