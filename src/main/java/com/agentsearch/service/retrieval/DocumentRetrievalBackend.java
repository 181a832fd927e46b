package com.agentsearch.service.retrieval;

import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.RetrievalResult;
import com.agentsearch.dto.internal.SearchResult;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.service.search.DocumentSearchService;
import com.agentsearch.util.PromptBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Similarity search over one document collection, answered from the hits.
 * Bound to its collection at construction.
 */
@Slf4j
public class DocumentRetrievalBackend extends AbstractRetrievalBackend {

    private final DocumentSearchService documentSearch;
    private final String collectionId;
    private final int answerMaxTokens;

    public DocumentRetrievalBackend(DocumentSearchService documentSearch,
                                    CompletionProvider completionProvider,
                                    PromptBuilder promptBuilder,
                                    String collectionId,
                                    int answerMaxTokens) {
        super(completionProvider, promptBuilder);
        this.documentSearch = documentSearch;
        this.collectionId = collectionId;
        this.answerMaxTokens = answerMaxTokens;
    }

    @Override
    public RetrievalResult retrieve(String subquery, int maxResults) {
        List<SearchResult> hits;
        try {
            hits = documentSearch.search(collectionId, subquery, maxResults);
        } catch (RuntimeException e) {
            log.warn("Document search failed for '{}': {}", subquery, e.getMessage());
            return RetrievalResult.failed("Error retrieving documents for '" + subquery + "': " + describe(e));
        }

        if (hits == null || hits.isEmpty()) {
            log.info("No documents found for '{}' in {}", subquery, collectionId);
            return RetrievalResult.empty("No relevant documents found for '" + subquery + "'.");
        }

        List<Context> contexts = toContexts(hits);
        String answer = complete(promptBuilder.buildDocumentAnswerPrompt(subquery, hits), answerMaxTokens).text();

        log.info("Document retrieval for '{}': {} contexts", subquery, contexts.size());
        return RetrievalResult.builder()
            .answer(answer)
            .contexts(contexts)
            .build();
    }

    @Override
    public BackendType type() {
        return BackendType.DOCUMENT;
    }

    public String getCollectionId() {
        return collectionId;
    }
}
