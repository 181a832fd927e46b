package com.agentsearch.service.search;

import com.agentsearch.exception.AgentSearchException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class QueryEmbeddingService {

    private final EmbeddingModel embeddingModel;

    /**
     * Embed a search query. Subqueries repeat across informed runs, so vectors are cached.
     */
    @Cacheable(value = "query-embeddings", key = "#text")
    @Retry(name = "ollama")
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new AgentSearchException("Cannot embed blank text");
        }

        try {
            float[] vector = embeddingModel.embed(text);
            if (vector == null || vector.length == 0) {
                throw new AgentSearchException("Empty embedding returned");
            }
            log.debug("Embedded query into {} dimensions", vector.length);
            return vector;

        } catch (AgentSearchException e) {
            throw e;
        } catch (Exception e) {
            log.error("Embedding failed: {}", e.getMessage());
            throw new AgentSearchException("Failed to embed query", e);
        }
    }
}
