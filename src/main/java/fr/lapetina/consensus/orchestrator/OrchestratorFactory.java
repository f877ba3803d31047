package fr.lapetina.consensus.orchestrator;

import fr.lapetina.consensus.orchestrator.domain.backend.BackendFactory;
import fr.lapetina.consensus.orchestrator.domain.backend.BackendKind;
import fr.lapetina.consensus.orchestrator.domain.backend.DefaultBackendFactory;
import fr.lapetina.consensus.orchestrator.domain.backend.ReferenceBackend;
import fr.lapetina.consensus.orchestrator.domain.model.BackendConfig;
import fr.lapetina.consensus.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.consensus.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.consensus.orchestrator.infrastructure.health.BackendHealthMonitor;
import fr.lapetina.consensus.orchestrator.infrastructure.execution.RetryPolicy;
import fr.lapetina.consensus.orchestrator.infrastructure.isolation.PassThroughIsolation;
import fr.lapetina.consensus.orchestrator.infrastructure.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Factory for creating a fully-wired orchestrator from configuration.
 * This is the primary entry point when backends are described in YAML.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("orchestrator.yaml").start()) {
 *     ModelOrchestrator orchestrator = factory.getOrchestrator();
 *     // use orchestrator...
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final OrchestratorConfig config;
    private final OrchestratorMetrics metrics;
    private final ModelOrchestrator orchestrator;
    private final BackendHealthMonitor healthMonitor;

    protected OrchestratorFactory(OrchestratorConfig config, BackendFactory backendFactoryOverride) {
        this(config, backendFactoryOverride, null);
    }

    /**
     * @param metricsOverride metrics to use instead of the configured ones; closed with the factory
     */
    protected OrchestratorFactory(
            OrchestratorConfig config,
            BackendFactory backendFactoryOverride,
            OrchestratorMetrics metricsOverride
    ) {
        this.config = config;

        if (metricsOverride != null) {
            this.metrics = metricsOverride;
        } else {
            this.metrics = config.getMetrics().isEnabled()
                    ? OrchestratorMetrics.prometheus(config.getMetrics().getPrefix())
                    : OrchestratorMetrics.inMemory();
        }

        OrchestratorConfig.RetryConfig retry = config.getRetry();
        RetryPolicy retryPolicy = retry.isEnabled()
                ? RetryPolicy.exponential(
                        Duration.ofMillis(retry.getInitialBackoffMs()),
                        Duration.ofMillis(retry.getMaxBackoffMs()),
                        retry.getBackoffMultiplier())
                : RetryPolicy.disabled();

        this.orchestrator = ModelOrchestrator.builder()
                .backendFactory(backendFactoryOverride != null ? backendFactoryOverride : new DefaultBackendFactory())
                .isolation(new PassThroughIsolation(
                        config.getIsolation().getMemoryLimitMb(),
                        config.getIsolation().getCpuLimitPercent()))
                .retryPolicy(retryPolicy)
                .metrics(metrics)
                .failureThreshold(config.getCircuitBreaker().getFailureThreshold())
                .cooldown(Duration.ofMillis(config.getCircuitBreaker().getCooldownMs()))
                .build();

        try {
            loadBackends();
        } catch (RuntimeException e) {
            log.error("Failed to register configured backends, releasing resources", e);
            orchestrator.close();
            metrics.close();
            throw e;
        }

        this.healthMonitor = new BackendHealthMonitor(
                orchestrator,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs())
        );

        log.info("OrchestratorFactory initialized with {} backends", orchestrator.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);
        return new OrchestratorFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static OrchestratorFactory create(OrchestratorConfig config) {
        return new OrchestratorFactory(config, null);
    }

    /**
     * Creates a factory from the default configuration (orchestrator.yaml).
     */
    public static OrchestratorFactory create() {
        return create("orchestrator.yaml");
    }

    private void loadBackends() {
        List<BackendConfig> backends = config.getBackends() == null || config.getBackends().isEmpty()
                ? defaultBackends()
                : config.getBackends().stream().map(OrchestratorConfig.BackendSettings::toBackendConfig).toList();
        orchestrator.registerAll(backends);
    }

    /**
     * Three reference backends with distinct answer styles, used when no backend is configured.
     */
    public static List<BackendConfig> defaultBackends() {
        log.info("No backends configured, installing default reference backends");
        return List.of(
                defaultBackend("mock_model_1", 1.0, "analytical"),
                defaultBackend("mock_model_2", 1.0, "creative"),
                defaultBackend("mock_model_3", 0.8, "conservative")
        );
    }

    private static BackendConfig defaultBackend(String backendId, double weight, String pattern) {
        return BackendConfig.builder()
                .backendId(backendId)
                .kind(BackendKind.REFERENCE)
                .weight(weight)
                .param(ReferenceBackend.PARAM_RESPONSE_PATTERN, pattern)
                .build();
    }

    /**
     * Starts background health monitoring when enabled in configuration.
     */
    public OrchestratorFactory start() {
        if (config.getHealthCheck().isEnabled()) {
            healthMonitor.start();
        }
        log.info("Orchestrator started");
        return this;
    }

    public ModelOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public OrchestratorMetrics getMetrics() {
        return metrics;
    }

    public BackendHealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    @Override
    public void close() {
        log.info("Shutting down orchestrator...");
        healthMonitor.close();
        orchestrator.close();
        metrics.close();
        log.info("Orchestrator shutdown complete");
    }
}
