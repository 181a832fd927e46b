package com.agentsearch.dto.internal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChunkingStrategy {

    SENTENCE("sentence"),
    PARAGRAPH("paragraph"),
    FIXED("fixed");

    private final String value;

    ChunkingStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Unknown or missing names fall back to sentence chunking.
     */
    @JsonCreator
    public static ChunkingStrategy from(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (ChunkingStrategy s : values()) {
                if (s.value.equals(v)) {
                    return s;
                }
            }
        }
        return SENTENCE;
    }
}
