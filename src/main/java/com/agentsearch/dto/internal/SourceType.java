package com.agentsearch.dto.internal;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceType {

    DOCUMENT("document"),
    WEB("web"),
    DEEP_WEB("deep_web");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
