package com.agentsearch.service.retrieval;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.exception.BackendConfigurationException;
import com.agentsearch.service.fetch.PageFetchPool;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.service.search.DocumentSearchService;
import com.agentsearch.service.search.WebSearchService;
import com.agentsearch.util.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the backend for a pipeline run. Misconfiguration is reported here,
 * once, as a {@link BackendConfigurationException}; a constructed backend never
 * fails a run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalBackendFactory {

    private final DocumentSearchService documentSearch;
    private final WebSearchService webSearch;
    private final PageFetchPool fetchPool;
    private final CompletionProvider completionProvider;
    private final PromptBuilder promptBuilder;
    private final AgentSearchProperties properties;

    public RetrievalBackend create(BackendType type, String collectionId) {
        BackendType resolved = type != null ? type : BackendType.DOCUMENT;
        int answerTokens = properties.getAnswer().getMaxTokens();

        switch (resolved) {
            case DOCUMENT:
                if (collectionId == null || collectionId.isBlank()) {
                    throw new BackendConfigurationException("Document search requires a collection id");
                }
                log.debug("Document backend for collection {}", collectionId);
                return new DocumentRetrievalBackend(
                    documentSearch, completionProvider, promptBuilder, collectionId.trim(), answerTokens);

            case WEB:
                requireSearxng();
                return new WebRetrievalBackend(webSearch, completionProvider, promptBuilder, answerTokens);

            case DEEP_WEB:
                requireSearxng();
                if (properties.getMaxUrls() < 1) {
                    throw new BackendConfigurationException(
                        "agent-search.deep-search.max-urls must be at least 1, got " + properties.getMaxUrls());
                }
                return new DeepWebRetrievalBackend(webSearch, fetchPool, completionProvider, promptBuilder, properties);

            default:
                throw new BackendConfigurationException("Unsupported backend: " + resolved);
        }
    }

    /**
     * Results per subquery when the request does not say
     */
    public int defaultMaxResults(BackendType type) {
        return type != null && type.isWebOriented()
            ? properties.getWebMaxResults()
            : properties.getMaxResults();
    }

    private void requireSearxng() {
        String baseUrl = properties.getSearxng().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new BackendConfigurationException("agent-search.searxng.base-url is not configured");
        }
    }
}
