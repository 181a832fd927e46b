package com.agentsearch.dto.internal;

public record ModelInfo(String provider, String model) {
}
