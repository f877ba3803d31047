package fr.lapetina.consensus.orchestrator.domain.model;

import fr.lapetina.consensus.orchestrator.domain.backend.BackendKind;

import java.time.Duration;

/**
 * Read-only snapshot of one registered backend's configuration.
 */
public record BackendInfo(
        BackendKind kind,
        double weight,
        Duration timeout,
        boolean enabled,
        int maxRetries
) {
    public static BackendInfo of(BackendConfig config) {
        return new BackendInfo(
                config.kind(),
                config.weight(),
                config.timeout(),
                config.enabled(),
                config.maxRetries()
        );
    }
}
