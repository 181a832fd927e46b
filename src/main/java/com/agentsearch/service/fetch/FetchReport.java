package com.agentsearch.service.fetch;

import com.agentsearch.dto.internal.PageContent;

import java.util.List;

/**
 * Outcome of fetching a batch of URLs: usable pages in URL order, and the URLs
 * that were dropped.
 */
public record FetchReport(List<PageContent> pages, List<String> droppedUrls) {

    public static FetchReport empty() {
        return new FetchReport(List.of(), List.of());
    }
}
