package fr.lapetina.consensus.orchestrator.infrastructure.config;

import fr.lapetina.consensus.orchestrator.domain.model.BackendConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the orchestrator.
 * Designed to be populated from YAML.
 */
public class OrchestratorConfig {

    private List<BackendSettings> backends = new ArrayList<>();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private IsolationConfig isolation = new IsolationConfig();
    private RetryConfig retry = new RetryConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<BackendSettings> getBackends() { return backends; }
    public void setBackends(List<BackendSettings> backends) { this.backends = backends; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public IsolationConfig getIsolation() { return isolation; }
    public void setIsolation(IsolationConfig isolation) { this.isolation = isolation; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Individual backend configuration.
     */
    public static class BackendSettings {
        private String id;
        private String kind = "reference";
        private double weight = 1.0;
        private long timeoutMs = 30000;
        private int maxRetries = 2;
        private boolean enabled = true;
        private Map<String, Object> params = new LinkedHashMap<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }

        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Map<String, Object> getParams() { return params; }
        public void setParams(Map<String, Object> params) { this.params = params; }

        /**
         * Converts to the validated domain configuration.
         *
         * @throws IllegalArgumentException if a value is out of range or the kind is unknown
         */
        public BackendConfig toBackendConfig() {
            return BackendConfig.builder()
                    .backendId(id)
                    .kind(kind)
                    .weight(weight)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .maxRetries(maxRetries)
                    .enabled(enabled)
                    .params(params)
                    .build();
        }
    }

    /**
     * Circuit breaker configuration.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long cooldownMs = 60000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }
    }

    /**
     * Resource isolation limits applied around each backend call.
     */
    public static class IsolationConfig {
        private int memoryLimitMb = 500;
        private int cpuLimitPercent = 70;

        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }

        public int getCpuLimitPercent() { return cpuLimitPercent; }
        public void setCpuLimitPercent(int cpuLimitPercent) { this.cpuLimitPercent = cpuLimitPercent; }
    }

    /**
     * Retry configuration. Per-backend retry counts come from {@code maxRetries}.
     */
    public static class RetryConfig {
        private boolean enabled = false;
        private long initialBackoffMs = 100;
        private long maxBackoffMs = 2000;
        private double backoffMultiplier = 2.0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Background health check configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = false;
        private long intervalMs = 30000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "model_orchestrator";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
