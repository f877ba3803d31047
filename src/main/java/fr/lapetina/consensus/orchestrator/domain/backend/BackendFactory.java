package fr.lapetina.consensus.orchestrator.domain.backend;

import fr.lapetina.consensus.orchestrator.domain.model.BackendConfig;

/**
 * Creates the concrete backend for a configuration.
 */
@FunctionalInterface
public interface BackendFactory {

    /**
     * @throws IllegalArgumentException if the configuration cannot be turned into a backend
     */
    ModelBackend create(BackendConfig config);
}
