package com.agentsearch.dto.internal;

/**
 * One narrower question produced by decomposition, tagged with the strategy
 * that produced it.
 */
public record Subquery(String text, SearchStrategy origin) {

    public Subquery {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Subquery text must not be blank");
        }
        text = text.trim();
    }
}
