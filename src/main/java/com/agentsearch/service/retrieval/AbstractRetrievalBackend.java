package com.agentsearch.service.retrieval;

import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.SearchResult;
import com.agentsearch.service.llm.Completion;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.util.PromptBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Shared plumbing for the backends: hit-to-context mapping and completion calls
 * that never throw.
 */
@Slf4j
abstract class AbstractRetrievalBackend implements RetrievalBackend {

    protected final CompletionProvider completionProvider;
    protected final PromptBuilder promptBuilder;

    protected AbstractRetrievalBackend(CompletionProvider completionProvider, PromptBuilder promptBuilder) {
        this.completionProvider = completionProvider;
        this.promptBuilder = promptBuilder;
    }

    protected List<Context> toContexts(List<SearchResult> hits) {
        BackendType type = type();
        return hits.stream()
            .map(hit -> Context.builder()
                .sourceId(hit.getSourceId())
                .title(hit.getTitle())
                .content(hit.getText())
                .relevanceScore(hit.getScore())
                .sourceType(type.getSourceType())
                .url(hit.getUrl())
                .build())
            .toList();
    }

    /**
     * Completion that degrades to a failed result when the provider throws
     * (for instance when called outside the resilience proxy).
     */
    protected Completion complete(String prompt, int maxTokens) {
        try {
            Completion completion = completionProvider.generate(prompt, maxTokens);
            return completion != null ? completion : Completion.failure("Error generating response: empty completion");
        } catch (RuntimeException e) {
            log.warn("Completion failed in {} backend: {}", type().getValue(), e.getMessage());
            return Completion.failure("Error generating response: " + e.getMessage());
        }
    }

    protected static String describe(Exception e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
