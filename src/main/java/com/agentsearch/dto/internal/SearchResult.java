package com.agentsearch.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw hit from an external search service (vector index or web search engine).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {

    private Integer index;
    private String sourceId;
    private String title;
    private String url;
    private String text;
    private Double score;
    private String source;  // qdrant, or the web engine name
}
