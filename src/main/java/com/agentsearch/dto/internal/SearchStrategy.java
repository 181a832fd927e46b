package com.agentsearch.dto.internal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Decomposition mode of a pipeline run.
 * - BLIND     → decompose the query as-is (also accepted as "direct")
 * - INFORMED  → run one retrieval for the full query first and decompose
 *               into follow-ups that target what it did not cover
 * - SINGLE    → no decomposition: one retrieval for the whole query, whose
 *               answer is the final answer (also accepted as "standard")
 */
public enum SearchStrategy {

    BLIND("blind"),
    INFORMED("informed"),
    SINGLE("single");

    private final String value;

    SearchStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SearchStrategy from(String value) {
        if (value == null || value.isBlank()) {
            return BLIND;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("informed")) {
            return INFORMED;
        }
        if (v.equals("blind") || v.equals("direct")) {
            return BLIND;
        }
        if (v.equals("single") || v.equals("standard")) {
            return SINGLE;
        }
        throw new IllegalArgumentException("Unknown strategy: " + value);
    }
}
