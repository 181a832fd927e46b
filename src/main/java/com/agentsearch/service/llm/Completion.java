package com.agentsearch.service.llm;

/**
 * Text returned by a completion call. When {@code failed} is set the text is a
 * human-readable diagnostic rather than model output.
 */
public record Completion(String text, boolean failed) {

    public static Completion of(String text) {
        return new Completion(text != null ? text : "", false);
    }

    public static Completion failure(String diagnostic) {
        return new Completion(diagnostic, true);
    }

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
