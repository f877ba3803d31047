package fr.lapetina.consensus.orchestrator.domain.model;

import java.util.Map;

/**
 * Caller-supplied side information passed unchanged to every backend.
 *
 * <p>The orchestrator never interprets the context. Backends may look at
 * {@link #queryType()}, {@link #modelPreferences()} or free-form
 * {@link #metadata()} (schema hints and the like).
 */
public record QueryContext(
        String queryType,
        int priority,
        Map<String, Double> modelPreferences,
        Map<String, Object> metadata
) {
    public QueryContext {
        modelPreferences = modelPreferences != null ? Map.copyOf(modelPreferences) : Map.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static QueryContext empty() {
        return new QueryContext(null, 0, null, null);
    }

    public static QueryContext ofMetadata(Map<String, Object> metadata) {
        return new QueryContext(null, 0, null, metadata);
    }
}
