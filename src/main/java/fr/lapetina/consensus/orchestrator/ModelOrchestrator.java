package fr.lapetina.consensus.orchestrator;

import fr.lapetina.consensus.orchestrator.domain.backend.BackendFactory;
import fr.lapetina.consensus.orchestrator.domain.backend.DefaultBackendFactory;
import fr.lapetina.consensus.orchestrator.domain.backend.ModelBackend;
import fr.lapetina.consensus.orchestrator.domain.model.BackendConfig;
import fr.lapetina.consensus.orchestrator.domain.model.BackendInfo;
import fr.lapetina.consensus.orchestrator.domain.model.ModelResponse;
import fr.lapetina.consensus.orchestrator.domain.model.QueryContext;
import fr.lapetina.consensus.orchestrator.domain.model.ResponseStatus;
import fr.lapetina.consensus.orchestrator.infrastructure.circuit.CircuitBreaker;
import fr.lapetina.consensus.orchestrator.infrastructure.execution.BackendExecutor;
import fr.lapetina.consensus.orchestrator.infrastructure.execution.DeadlineRunner;
import fr.lapetina.consensus.orchestrator.infrastructure.execution.RetryPolicy;
import fr.lapetina.consensus.orchestrator.infrastructure.isolation.PassThroughIsolation;
import fr.lapetina.consensus.orchestrator.infrastructure.isolation.ResourceIsolation;
import fr.lapetina.consensus.orchestrator.infrastructure.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Dispatches one query to every eligible backend in parallel and collects one
 * {@link ModelResponse} per attempted backend.
 *
 * <p>Owns the backend registry, one {@link CircuitBreaker} per backend and the
 * deadline timer. Instances are independent of each other; nothing is global.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ModelOrchestrator orchestrator = ModelOrchestrator.builder().build()) {
 *     orchestrator.register(BackendConfig.builder().backendId("analyst").build());
 *     List<ModelResponse> responses = orchestrator.executeParallel("Explain the query plan", null, null).join();
 * }
 * }</pre>
 */
public final class ModelOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelOrchestrator.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final Map<String, Registration> registrationsById = new ConcurrentHashMap<>();

    private final BackendFactory backendFactory;
    private final ResourceIsolation isolation;
    private final RetryPolicy retryPolicy;
    private final OrchestratorMetrics metrics;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final ScheduledExecutorService timer;
    private final boolean ownsTimer;
    private final DeadlineRunner deadlineRunner;

    private ModelOrchestrator(Builder builder) {
        this.backendFactory = builder.backendFactory;
        this.isolation = builder.isolation;
        this.retryPolicy = builder.retryPolicy;
        this.metrics = builder.metrics;
        this.failureThreshold = builder.failureThreshold;
        this.cooldown = builder.cooldown;
        this.clock = builder.clock;
        if (builder.timer != null) {
            this.timer = builder.timer;
            this.ownsTimer = false;
        } else {
            this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "deadline-timer");
                t.setDaemon(true);
                return t;
            });
            this.ownsTimer = true;
        }
        this.deadlineRunner = new DeadlineRunner(timer);
        log.info("ModelOrchestrator created: failureThreshold={}, cooldownMs={}, retries={}",
                failureThreshold, cooldown.toMillis(), retryPolicy.enabled());
    }

    /**
     * Registers a backend: creates it through the factory, wires its executor
     * and starts its circuit breaker closed.
     *
     * @throws IllegalArgumentException if the ID is already registered or the
     *                                  factory rejects the configuration
     */
    public synchronized void register(BackendConfig config) {
        Objects.requireNonNull(config, "Backend config is required");
        if (registrationsById.containsKey(config.backendId())) {
            throw new IllegalArgumentException("Backend with ID '" + config.backendId() + "' already exists");
        }

        ModelBackend backend = backendFactory.create(config);
        BackendExecutor executor = new BackendExecutor(config, backend, isolation, deadlineRunner, retryPolicy);
        CircuitBreaker breaker = new CircuitBreaker(config.backendId(), failureThreshold, cooldown, clock);

        Registration registration = new Registration(config, backend, executor, breaker);
        registrations.add(registration);
        registrationsById.put(config.backendId(), registration);

        log.info("Registered backend: backendId={}, kind={}, enabled={}",
                config.backendId(), config.kind().getName(), config.enabled());
    }

    /**
     * Registers several backends in order.
     */
    public void registerAll(List<BackendConfig> configs) {
        configs.forEach(this::register);
    }

    /**
     * Admission check. Resets the failure count as a side effect once the
     * cooldown has elapsed. Unknown backends are reported closed.
     */
    public boolean isCircuitOpen(String backendId) {
        Registration registration = registrationsById.get(backendId);
        return registration != null && registration.breaker().isOpen();
    }

    /**
     * Counts a failure against the backend. Unknown backends are ignored.
     */
    public void recordFailure(String backendId) {
        Registration registration = registrationsById.get(backendId);
        if (registration != null && registration.breaker().recordFailure()) {
            metrics.recordCircuitOpened(backendId);
        }
    }

    /**
     * Forgives one failure of the backend. Unknown backends are ignored.
     */
    public void recordSuccess(String backendId) {
        Registration registration = registrationsById.get(backendId);
        if (registration != null) {
            registration.breaker().recordSuccess();
        }
    }

    /**
     * Executes the query on every enabled backend whose circuit is not open.
     *
     * <p>The returned future always completes normally. It holds one response per
     * attempted backend, in registration order, and is empty when no backend is
     * eligible. Backends skipped because of an open circuit have no entry.
     *
     * @param query   Query text
     * @param context Optional side information, may be null
     * @param timeout Deadline per backend, or null for each backend's own timeout
     */
    public CompletableFuture<List<ModelResponse>> executeParallel(String query, QueryContext context, Duration timeout) {
        List<Registration> candidates = new ArrayList<>();
        for (Registration registration : registrations) {
            if (registration.config().enabled() && !registration.breaker().isOpen()) {
                candidates.add(registration);
            }
        }
        metrics.setCandidatePoolSize(candidates.size());

        if (candidates.isEmpty()) {
            log.warn("No enabled backends available for query execution (circuit breakers may be open)");
            return CompletableFuture.completedFuture(List.of());
        }

        log.info("Executing query on {} backends: {}", candidates.size(),
                candidates.stream().map(r -> r.config().backendId()).toList());

        long start = System.nanoTime();
        List<CompletableFuture<ModelResponse>> tasks = new ArrayList<>(candidates.size());
        for (Registration candidate : candidates) {
            tasks.add(dispatch(candidate, query, context, timeout));
        }

        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, ex) -> collect(candidates, tasks, start));
    }

    private CompletableFuture<ModelResponse> dispatch(
            Registration registration,
            String query,
            QueryContext context,
            Duration timeout
    ) {
        try {
            CompletableFuture<ModelResponse> task = registration.executor().executeQuery(query, context, timeout);
            return task != null ? task : CompletableFuture.failedFuture(
                    new IllegalStateException("Executor returned no result"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private List<ModelResponse> collect(
            List<Registration> candidates,
            List<CompletableFuture<ModelResponse>> tasks,
            long startNanos
    ) {
        List<ModelResponse> responses = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            String backendId = candidates.get(i).config().backendId();
            ModelResponse response;
            try {
                response = tasks.get(i).join();
            } catch (CompletionException | CancellationException e) {
                Throwable cause = DeadlineRunner.unwrap(e);
                log.error("Task for backend raised instead of returning: backendId={}", backendId, cause);
                String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                response = ModelResponse.error(backendId, message, Duration.ofNanos(System.nanoTime() - startNanos));
            }
            if (response == null) {
                response = ModelResponse.error(backendId, "Executor returned no result",
                        Duration.ofNanos(System.nanoTime() - startNanos));
            }

            if (response.status() == ResponseStatus.ERROR) {
                recordFailure(backendId);
            } else if (response.status() == ResponseStatus.SUCCESS || response.status() == ResponseStatus.TIMEOUT) {
                recordSuccess(backendId);
            }
            metrics.recordResponse(response);
            responses.add(response);
        }

        log.info("Completed parallel execution: {} responses", responses.size());
        return Collections.unmodifiableList(responses);
    }

    /**
     * Runs every registered backend's health check. Failures, exceptions and
     * checks outliving the backend's timeout all count as unhealthy.
     *
     * @return Future of backend ID to health, in registration order
     */
    public CompletableFuture<Map<String, Boolean>> healthCheckAll() {
        Map<String, CompletableFuture<Boolean>> checks = new LinkedHashMap<>();
        for (Registration registration : registrations) {
            checks.put(registration.config().backendId(), healthCheck(registration));
        }

        return CompletableFuture.allOf(checks.values().toArray(new CompletableFuture<?>[0]))
                .handle((ignored, ex) -> {
                    Map<String, Boolean> results = new LinkedHashMap<>();
                    checks.forEach((backendId, check) -> {
                        boolean healthy = check.join();
                        log.debug("Backend health check: backendId={}, result={}", backendId, healthy ? "PASS" : "FAIL");
                        metrics.recordHealth(backendId, healthy);
                        results.put(backendId, healthy);
                    });
                    return Collections.unmodifiableMap(results);
                });
    }

    private CompletableFuture<Boolean> healthCheck(Registration registration) {
        String backendId = registration.config().backendId();
        CompletableFuture<Boolean> check;
        try {
            check = registration.backend().healthCheck();
        } catch (RuntimeException e) {
            log.error("Health check failed for backend: backendId={}", backendId, e);
            return CompletableFuture.completedFuture(false);
        }
        if (check == null) {
            return CompletableFuture.completedFuture(false);
        }
        return check
                .completeOnTimeout(false, registration.config().timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((healthy, ex) -> {
                    if (ex != null) {
                        log.error("Health check failed for backend: backendId={}, error={}",
                                backendId, DeadlineRunner.unwrap(ex).getMessage());
                        return false;
                    }
                    return Boolean.TRUE.equals(healthy);
                });
    }

    /**
     * Read-only snapshot of every registered backend, in registration order.
     */
    public Map<String, BackendInfo> describeBackends() {
        Map<String, BackendInfo> info = new LinkedHashMap<>();
        for (Registration registration : registrations) {
            info.put(registration.config().backendId(), BackendInfo.of(registration.config()));
        }
        return Collections.unmodifiableMap(info);
    }

    /**
     * IDs of enabled backends, regardless of circuit state.
     */
    public List<String> enabledBackendIds() {
        return registrations.stream()
                .filter(r -> r.config().enabled())
                .map(r -> r.config().backendId())
                .toList();
    }

    /**
     * Current failure count of a backend, or 0 for unknown IDs.
     */
    public int failureCount(String backendId) {
        Registration registration = registrationsById.get(backendId);
        return registration != null ? registration.breaker().getFailureCount() : 0;
    }

    /**
     * Derived circuit state of a backend, without side effects.
     */
    public CircuitBreaker.State circuitState(String backendId) {
        Registration registration = registrationsById.get(backendId);
        return registration != null ? registration.breaker().getState() : CircuitBreaker.State.CLOSED;
    }

    public int size() {
        return registrations.size();
    }

    public OrchestratorMetrics getMetrics() {
        return metrics;
    }

    @Override
    public void close() {
        if (ownsTimer) {
            timer.shutdownNow();
        }
        log.info("ModelOrchestrator closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    private record Registration(
            BackendConfig config,
            ModelBackend backend,
            BackendExecutor executor,
            CircuitBreaker breaker
    ) {
    }

    public static final class Builder {
        private BackendFactory backendFactory = new DefaultBackendFactory();
        private ResourceIsolation isolation = new PassThroughIsolation();
        private RetryPolicy retryPolicy = RetryPolicy.disabled();
        private OrchestratorMetrics metrics;
        private int failureThreshold = CircuitBreaker.DEFAULT_FAILURE_THRESHOLD;
        private Duration cooldown = CircuitBreaker.DEFAULT_COOLDOWN;
        private Clock clock = Clock.systemUTC();
        private ScheduledExecutorService timer;

        public Builder backendFactory(BackendFactory backendFactory) {
            this.backendFactory = backendFactory;
            return this;
        }

        public Builder isolation(ResourceIsolation isolation) {
            this.isolation = isolation;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder metrics(OrchestratorMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = cooldown;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Timer used for deadlines. When set, the caller keeps ownership and
         * the orchestrator does not shut it down.
         */
        public Builder timer(ScheduledExecutorService timer) {
            this.timer = timer;
            return this;
        }

        public ModelOrchestrator build() {
            Objects.requireNonNull(backendFactory, "Backend factory is required");
            Objects.requireNonNull(isolation, "Isolation is required");
            Objects.requireNonNull(clock, "Clock is required");
            if (retryPolicy == null) {
                retryPolicy = RetryPolicy.disabled();
            }
            if (metrics == null) {
                metrics = OrchestratorMetrics.inMemory();
            }
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("Failure threshold must be at least 1, got " + failureThreshold);
            }
            if (cooldown == null || cooldown.isNegative()) {
                throw new IllegalArgumentException("Cooldown must be non-negative, got " + cooldown);
            }
            return new ModelOrchestrator(this);
        }
    }
}
