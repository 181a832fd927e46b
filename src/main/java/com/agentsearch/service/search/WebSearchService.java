package com.agentsearch.service.search;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.SearchResult;
import com.agentsearch.exception.AgentSearchException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Web search through a SearXNG instance's JSON API.
 */
@Slf4j
@Service
public class WebSearchService {

    static final double DEFAULT_SCORE = 0.95;

    private final WebClient searxngWebClient;
    private final AgentSearchProperties properties;

    public WebSearchService(@Qualifier("searxngWebClient") WebClient searxngWebClient,
                            AgentSearchProperties properties) {
        this.searxngWebClient = searxngWebClient;
        this.properties = properties;
    }

    @CircuitBreaker(name = "searxng")
    @Retry(name = "searxng")
    public List<SearchResult> search(String query, int numResults) {
        AgentSearchProperties.Searxng searxng = properties.getSearxng();
        int requested = Math.min(numResults, searxng.getMaxResults());

        log.info("Performing SearXNG search for: {}", query);

        JsonNode response;
        try {
            response = searxngWebClient.get()
                    .uri(uri -> uri.path("/search")
                            .queryParam("q", query)
                            .queryParam("format", "json")
                            .queryParam("categories", "general")
                            .queryParam("results", requested)
                            .queryParam("language", searxng.getLanguage())
                            .build())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(searxng.getTimeoutSeconds()));

        } catch (Exception e) {
            log.error("SearXNG search failed: {}", e.getMessage());
            throw new AgentSearchException("Web search failed", e);
        }

        List<SearchResult> results = toResults(response, requested);
        log.info("Retrieved {} results from SearXNG", results.size());
        return results;
    }

    private List<SearchResult> toResults(JsonNode response, int limit) {
        if (response == null || !response.has("results")) {
            return List.of();
        }

        List<SearchResult> results = new ArrayList<>();

        for (JsonNode hit : response.get("results")) {
            // Skip results without URLs or titles
            if (!hit.hasNonNull("url") || !hit.hasNonNull("title")) {
                continue;
            }
            if (results.size() >= limit) {
                break;
            }

            String url = hit.get("url").asText();
            results.add(SearchResult.builder()
                    .index(results.size())
                    .sourceId("web_" + Integer.toHexString(url.hashCode()))
                    .title(hit.get("title").asText())
                    .url(url)
                    .text(hit.path("content").asText(""))
                    .score(hit.path("score").asDouble(DEFAULT_SCORE))
                    .source(hit.path("engine").asText("web"))
                    .build());
        }

        return results;
    }
}
