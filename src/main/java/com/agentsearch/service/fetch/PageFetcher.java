package com.agentsearch.service.fetch;

import com.agentsearch.dto.internal.PageContent;

/**
 * Fetches and parses a single web page for the deep web backend.
 */
public interface PageFetcher {

    /**
     * @return the parsed page, a page with {@code success=false} for content that
     *         cannot be used (non-HTML), or {@code null} when the fetch failed
     */
    PageContent fetch(String url);
}
