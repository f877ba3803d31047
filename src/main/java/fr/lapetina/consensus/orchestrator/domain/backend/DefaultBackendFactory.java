package fr.lapetina.consensus.orchestrator.domain.backend;

import fr.lapetina.consensus.orchestrator.domain.model.BackendConfig;

/**
 * Factory dispatching on {@link BackendKind}.
 */
public final class DefaultBackendFactory implements BackendFactory {

    @Override
    public ModelBackend create(BackendConfig config) {
        return switch (config.kind()) {
            case REFERENCE -> new ReferenceBackend(config);
        };
    }
}
