package fr.lapetina.consensus.orchestrator.infrastructure.execution;

import fr.lapetina.consensus.orchestrator.domain.backend.ModelBackend;
import fr.lapetina.consensus.orchestrator.domain.model.BackendConfig;
import fr.lapetina.consensus.orchestrator.domain.model.ModelResponse;
import fr.lapetina.consensus.orchestrator.domain.model.QueryContext;
import fr.lapetina.consensus.orchestrator.infrastructure.execution.exception.AttemptException;
import fr.lapetina.consensus.orchestrator.infrastructure.execution.exception.AttemptFailedException;
import fr.lapetina.consensus.orchestrator.infrastructure.execution.exception.DeadlineExceededException;
import fr.lapetina.consensus.orchestrator.infrastructure.isolation.IsolationScope;
import fr.lapetina.consensus.orchestrator.infrastructure.isolation.ResourceIsolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs one query against one backend and turns whatever happens into a
 * {@link ModelResponse}.
 *
 * The returned future never completes exceptionally. Per call:
 * disabled check, isolation entry, deadline-bounded generation, confidence
 * scoring, isolation exit.
 */
public final class BackendExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackendExecutor.class);

    static final String DISABLED_MESSAGE = "Model is disabled";

    private final BackendConfig config;
    private final ModelBackend backend;
    private final ResourceIsolation isolation;
    private final DeadlineRunner deadlineRunner;
    private final RetryPolicy retryPolicy;

    public BackendExecutor(
            BackendConfig config,
            ModelBackend backend,
            ResourceIsolation isolation,
            DeadlineRunner deadlineRunner,
            RetryPolicy retryPolicy
    ) {
        this.config = Objects.requireNonNull(config, "Config is required");
        this.backend = Objects.requireNonNull(backend, "Backend is required");
        this.isolation = Objects.requireNonNull(isolation, "Isolation is required");
        this.deadlineRunner = Objects.requireNonNull(deadlineRunner, "Deadline runner is required");
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.disabled();
    }

    /**
     * Executes the query.
     *
     * @param query   Query text
     * @param context Optional side information, passed unchanged to the backend
     * @param timeout Deadline for this call, or null for the backend's configured timeout
     * @return Future that always completes normally with a response
     */
    public CompletableFuture<ModelResponse> executeQuery(String query, QueryContext context, Duration timeout) {
        String backendId = config.backendId();

        if (!config.enabled()) {
            return CompletableFuture.completedFuture(ModelResponse.disabled(backendId, DISABLED_MESSAGE));
        }

        Duration effectiveTimeout = timeout != null && !timeout.isZero() && !timeout.isNegative()
                ? timeout
                : config.timeout();

        IsolationScope scope;
        try {
            scope = isolation.enter(backendId);
        } catch (RuntimeException e) {
            log.error("Failed to enter isolation scope: backendId={}", backendId, e);
            return CompletableFuture.completedFuture(
                    ModelResponse.error(backendId, "Isolation failure: " + describe(e), Duration.ZERO));
        }

        CompletableFuture<ModelResponse> outcome;
        try {
            outcome = attempt(query, context, effectiveTimeout, 0, Duration.ZERO);
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }

        return outcome
                .exceptionally(ex -> {
                    Throwable cause = DeadlineRunner.unwrap(ex);
                    log.error("Unexpected executor failure: backendId={}", backendId, cause);
                    return ModelResponse.error(backendId, describe(cause), Duration.ZERO);
                })
                .whenComplete((response, ex) -> closeQuietly(scope));
    }

    private CompletableFuture<ModelResponse> attempt(
            String query,
            QueryContext context,
            Duration timeout,
            int retry,
            Duration spent
    ) {
        return deadlineRunner.execute(() -> backend.generateResponse(query, context), timeout)
                .handle((timed, ex) -> {
                    if (ex == null) {
                        return CompletableFuture.completedFuture(score(query, timed, spent));
                    }

                    Throwable cause = DeadlineRunner.unwrap(ex);
                    Duration elapsed = cause instanceof AttemptException attemptException
                            ? attemptException.getElapsed()
                            : Duration.ZERO;
                    Duration total = spent.plus(elapsed);

                    if (cause instanceof DeadlineExceededException) {
                        log.warn("Backend timed out: backendId={}, timeoutMs={}, elapsedMs={}",
                                config.backendId(), timeout.toMillis(), total.toMillis());
                        return CompletableFuture.completedFuture(ModelResponse.timeout(config.backendId(), total));
                    }

                    Throwable failure = cause instanceof AttemptFailedException && cause.getCause() != null
                            ? cause.getCause()
                            : cause;

                    int allowedRetries = retryPolicy.retriesFor(config.maxRetries());
                    if (retry < allowedRetries) {
                        int nextRetry = retry + 1;
                        Duration backoff = retryPolicy.backoffBefore(nextRetry);
                        log.warn("Backend attempt failed, retrying: backendId={}, retry={}/{}, backoffMs={}, error={}",
                                config.backendId(), nextRetry, allowedRetries, backoff.toMillis(), describe(failure));
                        return CompletableFuture
                                .runAsync(() -> { },
                                        CompletableFuture.delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS))
                                .thenCompose(ignored -> attempt(query, context, timeout, nextRetry, total));
                    }

                    log.error("Backend failed: backendId={}, attempts={}, elapsedMs={}, error={}",
                            config.backendId(), retry + 1, total.toMillis(), describe(failure));
                    return CompletableFuture.completedFuture(
                            ModelResponse.error(config.backendId(), describe(failure), total));
                })
                .thenCompose(Function.identity());
    }

    private ModelResponse score(String query, Timed<String> timed, Duration spent) {
        Duration total = spent.plus(timed.elapsed());
        String content = timed.value();
        if (content == null) {
            log.error("Backend returned no content: backendId={}", config.backendId());
            return ModelResponse.error(config.backendId(), "Backend returned no content", total);
        }

        double confidence;
        try {
            confidence = backend.getConfidence(query, content);
        } catch (RuntimeException e) {
            log.error("Confidence scoring failed: backendId={}, error={}", config.backendId(), describe(e));
            return ModelResponse.error(config.backendId(), "Confidence scoring failed: " + describe(e), total);
        }

        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            log.error("Confidence out of range: backendId={}, confidence={}", config.backendId(), confidence);
            return ModelResponse.error(config.backendId(), "Confidence out of range: " + confidence, total);
        }

        log.debug("Backend succeeded: backendId={}, elapsedMs={}, confidence={}",
                config.backendId(), total.toMillis(), confidence);
        return ModelResponse.success(config.backendId(), content, confidence, total);
    }

    private void closeQuietly(IsolationScope scope) {
        try {
            scope.close();
        } catch (RuntimeException e) {
            log.warn("Failed to exit isolation scope: backendId={}", config.backendId(), e);
        }
    }

    static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null && !message.isBlank() ? message : throwable.getClass().getSimpleName();
    }

    public BackendConfig getConfig() {
        return config;
    }

    public ModelBackend getBackend() {
        return backend;
    }
}
