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
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Similarity search over a Qdrant collection through its REST API.
 */
@Slf4j
@Service
public class DocumentSearchService {

    private final WebClient qdrantWebClient;
    private final QueryEmbeddingService embeddingService;
    private final AgentSearchProperties properties;

    public DocumentSearchService(@Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                                 QueryEmbeddingService embeddingService,
                                 AgentSearchProperties properties) {
        this.qdrantWebClient = qdrantWebClient;
        this.embeddingService = embeddingService;
        this.properties = properties;
    }

    /**
     * @return hits in descending similarity order; empty when the collection does not exist
     */
    @CircuitBreaker(name = "qdrant")
    @Retry(name = "qdrant")
    public List<SearchResult> search(String collectionId, String query, int limit) {
        float[] vector = embeddingService.embed(query);

        JsonNode response;
        try {
            response = qdrantWebClient.post()
                    .uri("/collections/{collection}/points/search", collectionId)
                    .bodyValue(Map.of(
                            "vector", vector,
                            "limit", limit,
                            "with_payload", true
                    ))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(properties.getQdrant().getTimeoutSeconds()));

        } catch (WebClientResponseException.NotFound e) {
            log.warn("Collection does not exist: {}", collectionId);
            return List.of();
        } catch (Exception e) {
            log.error("Qdrant search failed for collection {}: {}", collectionId, e.getMessage());
            throw new AgentSearchException("Document search failed", e);
        }

        return toResults(response);
    }

    private List<SearchResult> toResults(JsonNode response) {
        if (response == null || !response.has("result")) {
            return List.of();
        }

        List<SearchResult> results = new ArrayList<>();
        int rank = 0;

        for (JsonNode hit : response.get("result")) {
            JsonNode payload = hit.path("payload");

            results.add(SearchResult.builder()
                    .index(rank++)
                    .sourceId(payload.path("document_id").asText(hit.path("id").asText()))
                    .title(payload.path("document_title").asText("Unknown"))
                    .text(payload.path("content").asText(""))
                    .score(hit.path("score").asDouble(0.0))
                    .source("qdrant")
                    .build());
        }

        log.debug("Qdrant returned {} hits", results.size());
        return results;
    }
}
