package fr.lapetina.consensus.orchestrator.domain.model;

import fr.lapetina.consensus.orchestrator.domain.backend.BackendKind;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of a single backend.
 *
 * <p>{@code weight} is carried for the downstream consensus layer and is not used
 * by the orchestrator itself. {@code params} holds kind-specific settings
 * (the reference backend reads its response pattern, base confidence and
 * simulated latency from there).
 */
public record BackendConfig(
        String backendId,
        BackendKind kind,
        double weight,
        Duration timeout,
        int maxRetries,
        boolean enabled,
        Map<String, Object> params
) {
    public static final double MAX_WEIGHT = 10.0;

    public BackendConfig {
        Objects.requireNonNull(backendId, "Backend ID is required");
        Objects.requireNonNull(kind, "Backend kind is required");
        Objects.requireNonNull(timeout, "Timeout is required");
        if (backendId.isBlank()) {
            throw new IllegalArgumentException("Backend ID must not be blank");
        }
        if (weight < 0 || weight > MAX_WEIGHT) {
            throw new IllegalArgumentException("Backend weight must be between 0 and 10, got " + weight);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Backend timeout must be positive, got " + timeout);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must be non-negative, got " + maxRetries);
        }
        params = params != null ? Map.copyOf(params) : Map.of();
    }

    public String stringParam(String key, String defaultValue) {
        Object value = params.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public double doubleParam(String key, double defaultValue) {
        Object value = params.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Parameter '" + key + "' of backend " + backendId + " is not a number: " + value, e);
            }
        }
        return defaultValue;
    }

    public long longParam(String key, long defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        return Math.round(doubleParam(key, defaultValue));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String backendId;
        private BackendKind kind = BackendKind.REFERENCE;
        private double weight = 1.0;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 2;
        private boolean enabled = true;
        private final Map<String, Object> params = new HashMap<>();

        public Builder backendId(String backendId) {
            this.backendId = backendId;
            return this;
        }

        public Builder kind(BackendKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = BackendKind.fromName(kind);
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder param(String key, Object value) {
            this.params.put(key, value);
            return this;
        }

        public Builder params(Map<String, Object> params) {
            if (params != null) {
                this.params.putAll(params);
            }
            return this;
        }

        public BackendConfig build() {
            return new BackendConfig(backendId, kind, weight, timeout, maxRetries, enabled, params);
        }
    }
}
