package fr.lapetina.consensus.orchestrator.domain.backend;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of backend kinds known to the factory.
 *
 * Adding a kind means adding a constant here and one branch in
 * {@link DefaultBackendFactory}; the switch there fails to compile until
 * the new constant is handled.
 */
public enum BackendKind {
    /** Deterministic test double, also accepted under its legacy name "mock" */
    REFERENCE("reference", "mock");

    private final List<String> names;

    BackendKind(String... names) {
        this.names = List.of(names);
    }

    public String getName() {
        return names.get(0);
    }

    /**
     * Resolves a configuration discriminator to a kind.
     *
     * @throws IllegalArgumentException if no kind matches
     */
    public static BackendKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Backend kind is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.names.contains(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported backend kind: " + name));
    }
}
