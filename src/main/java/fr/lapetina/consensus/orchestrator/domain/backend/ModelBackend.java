package fr.lapetina.consensus.orchestrator.domain.backend;

import fr.lapetina.consensus.orchestrator.domain.model.QueryContext;

import java.util.concurrent.CompletableFuture;

/**
 * Contract every computation backend must satisfy.
 *
 * Implementations must be thread-safe: the orchestrator may dispatch several
 * queries to the same backend concurrently.
 */
public interface ModelBackend {

    /**
     * Returns the backend ID this instance was created for.
     */
    String getBackendId();

    /**
     * Produces raw content for the query.
     *
     * <p>The returned future may take arbitrarily long to complete. Deadline
     * enforcement belongs to the caller, which may cancel the future.
     *
     * @param query   The query text
     * @param context Optional side information, may be null
     * @return Future completing with the generated content
     */
    CompletableFuture<String> generateResponse(String query, QueryContext context);

    /**
     * Scores the backend's own confidence in a response.
     *
     * @return a value in [0, 1]
     */
    double getConfidence(String query, String response);

    /**
     * Checks whether the backend is able to answer.
     *
     * <p>The default sends a probe query and reports healthy iff the trimmed
     * answer is non-empty. Any failure reports unhealthy. Backends with a
     * cheaper probe should override this.
     */
    default CompletableFuture<Boolean> healthCheck() {
        CompletableFuture<String> probe;
        try {
            probe = generateResponse("test", null);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(false);
        }
        if (probe == null) {
            return CompletableFuture.completedFuture(false);
        }
        return probe
                .thenApply(response -> response != null && !response.trim().isEmpty())
                .exceptionally(ex -> false);
    }
}
