package fr.lapetina.consensus.orchestrator.domain.backend;

import java.util.Locale;

/**
 * Canned answer styles of the {@link ReferenceBackend}.
 *
 * Each pattern has a template for database questions, one for data questions
 * and a generic one. {@code %s} receives the query.
 */
public enum ResponsePattern {
    ANALYTICAL(
            "Based on analytical assessment: %s. I recommend using proper indexing and query optimization techniques.",
            "From an analytical perspective: %s. Consider data validation and statistical significance.",
            "Analytical response to: %s. This requires systematic evaluation of the available information."
    ),
    CREATIVE(
            "Creative approach to: %s. Consider using innovative query patterns and modern database features.",
            "Creative insight on: %s. Explore unconventional data visualization and analysis methods.",
            "Creative perspective on: %s. Think outside the box and consider alternative approaches."
    ),
    CONSERVATIVE(
            "Conservative recommendation for: %s. Stick to well-tested SQL patterns and established best practices.",
            "Conservative analysis of: %s. Use proven statistical methods and validated data sources.",
            "Conservative response to: %s. Follow established procedures and industry standards."
    ),
    DEFAULT(null, null, null);

    private final String databaseTemplate;
    private final String dataTemplate;
    private final String genericTemplate;

    ResponsePattern(String databaseTemplate, String dataTemplate, String genericTemplate) {
        this.databaseTemplate = databaseTemplate;
        this.dataTemplate = dataTemplate;
        this.genericTemplate = genericTemplate;
    }

    /**
     * Renders the answer for a query.
     *
     * @param query     The query text
     * @param backendId Signature used by the {@link #DEFAULT} pattern
     */
    public String render(String query, String backendId) {
        if (this == DEFAULT) {
            return String.format("Standard response to: %s. This is a general-purpose answer from %s.",
                    query, backendId);
        }
        String lower = query.toLowerCase(Locale.ROOT);
        if (lower.contains("sql") || lower.contains("database")) {
            return String.format(databaseTemplate, query);
        }
        if (lower.contains("data")) {
            return String.format(dataTemplate, query);
        }
        return String.format(genericTemplate, query);
    }

    /**
     * Resolves a pattern name, falling back to {@link #DEFAULT} for unknown names.
     */
    public static ResponsePattern fromName(String name) {
        if (name == null) {
            return DEFAULT;
        }
        for (ResponsePattern pattern : values()) {
            if (pattern.name().equalsIgnoreCase(name.trim())) {
                return pattern;
            }
        }
        return DEFAULT;
    }
}
