package fr.lapetina.consensus.orchestrator.infrastructure.metrics;

import fr.lapetina.consensus.orchestrator.domain.model.ModelResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrator metrics using Micrometer.
 *
 * Provides:
 * - Response counters per backend and status
 * - Execution latency per backend
 * - Circuit opening counters
 * - Candidate pool size and backend health gauges
 * - Prometheus exposition when backed by a Prometheus registry
 */
public final class OrchestratorMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorMetrics.class);

    public static final String DEFAULT_PREFIX = "model_orchestrator";

    private final MeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> responseCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> circuitOpenedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> healthGauges = new ConcurrentHashMap<>();

    private final AtomicInteger candidatePoolSize = new AtomicInteger(0);

    public OrchestratorMetrics(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;

        Gauge.builder(prefix + "_candidate_pool_size", candidatePoolSize, AtomicInteger::get)
                .description("Backends eligible for dispatch on the last call")
                .register(registry);

        log.info("OrchestratorMetrics initialized with prefix: {}", prefix);
    }

    /**
     * Creates metrics exported through Prometheus, with JVM and system metrics bound.
     */
    public static OrchestratorMetrics prometheus(String prefix) {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        return new OrchestratorMetrics(registry, prefix);
    }

    /**
     * Creates in-memory metrics, not exported anywhere.
     */
    public static OrchestratorMetrics inMemory() {
        return new OrchestratorMetrics(new SimpleMeterRegistry(), DEFAULT_PREFIX);
    }

    /**
     * Records one backend response: status counter and latency.
     */
    public void recordResponse(ModelResponse response) {
        String backendId = response.backendId();
        String status = response.status().name();
        String key = backendId + ":" + status;
        responseCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_responses_total")
                        .description("Backend responses by status")
                        .tag("backend", backendId)
                        .tag("status", status)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(backendId, k ->
                Timer.builder(prefix + "_execution_latency")
                        .description("Backend execution latency")
                        .tag("backend", backendId)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(response.executionTime());
    }

    /**
     * Counts a circuit opening.
     */
    public void recordCircuitOpened(String backendId) {
        circuitOpenedCounters.computeIfAbsent(backendId, k ->
                Counter.builder(prefix + "_circuit_opened_total")
                        .description("Number of times the circuit opened")
                        .tag("backend", backendId)
                        .register(registry)
        ).increment();
    }

    /**
     * Updates the health gauge of a backend (1 healthy, 0 unhealthy).
     */
    public void recordHealth(String backendId, boolean healthy) {
        healthGauges.computeIfAbsent(backendId, k -> {
            AtomicInteger value = new AtomicInteger(0);
            Gauge.builder(prefix + "_backend_healthy", value, AtomicInteger::get)
                    .description("Backend health (1=healthy, 0=unhealthy)")
                    .tag("backend", backendId)
                    .register(registry);
            return value;
        }).set(healthy ? 1 : 0);
    }

    public void setCandidatePoolSize(int size) {
        candidatePoolSize.set(size);
    }

    /**
     * Returns the Prometheus scrape output, or an empty string when the
     * underlying registry is not a Prometheus one.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public boolean isClosed() {
        return registry.isClosed();
    }

    @Override
    public void close() {
        registry.close();
    }
}
