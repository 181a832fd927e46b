package com.agentsearch.dto.internal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BackendType {

    DOCUMENT("document", SourceType.DOCUMENT),
    WEB("web", SourceType.WEB),
    DEEP_WEB("deep_web", SourceType.DEEP_WEB);

    private final String value;
    private final SourceType sourceType;

    BackendType(String value, SourceType sourceType) {
        this.value = value;
        this.sourceType = sourceType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    /**
     * Web backends get keyword-style prompts and URL citations.
     */
    public boolean isWebOriented() {
        return this != DOCUMENT;
    }

    @JsonCreator
    public static BackendType from(String value) {
        if (value == null || value.isBlank()) {
            return DOCUMENT;
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (BackendType type : values()) {
            if (type.value.equals(v)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + value);
    }
}
