package com.agentsearch.dto.internal;

import lombok.Builder;
import lombok.Value;

/**
 * A bounded text segment. Offsets index into the whitespace-normalized text
 * the segmenter worked on: {@code text == normalized.substring(start, end)}.
 */
@Value
@Builder
public class Chunk {

    int index;

    String text;

    int start;

    int end;

    boolean overlapsPrevious;

    public int length() {
        return end - start;
    }
}
