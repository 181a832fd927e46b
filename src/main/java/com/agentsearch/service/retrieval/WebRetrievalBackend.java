package com.agentsearch.service.retrieval;

import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.RetrievalResult;
import com.agentsearch.dto.internal.SearchResult;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.service.search.WebSearchService;
import com.agentsearch.util.PromptBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Web search where the engine's result snippets are the evidence.
 */
@Slf4j
public class WebRetrievalBackend extends AbstractRetrievalBackend {

    private final WebSearchService webSearch;
    private final int answerMaxTokens;

    public WebRetrievalBackend(WebSearchService webSearch,
                               CompletionProvider completionProvider,
                               PromptBuilder promptBuilder,
                               int answerMaxTokens) {
        super(completionProvider, promptBuilder);
        this.webSearch = webSearch;
        this.answerMaxTokens = answerMaxTokens;
    }

    @Override
    public RetrievalResult retrieve(String subquery, int maxResults) {
        List<SearchResult> hits;
        try {
            hits = webSearch.search(subquery, maxResults);
        } catch (RuntimeException e) {
            log.warn("Web search failed for '{}': {}", subquery, e.getMessage());
            return RetrievalResult.failed("Error performing web search for '" + subquery + "': " + describe(e));
        }

        if (hits == null || hits.isEmpty()) {
            return RetrievalResult.empty("No web results found for '" + subquery + "'.");
        }

        List<Context> contexts = toContexts(hits);
        String answer = complete(promptBuilder.buildWebAnswerPrompt(subquery, hits), answerMaxTokens).text();

        return RetrievalResult.builder()
            .answer(answer)
            .contexts(contexts)
            .build();
    }

    @Override
    public BackendType type() {
        return BackendType.WEB;
    }
}
