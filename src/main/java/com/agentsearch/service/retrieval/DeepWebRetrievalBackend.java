package com.agentsearch.service.retrieval;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.PageContent;
import com.agentsearch.dto.internal.RetrievalResult;
import com.agentsearch.dto.internal.SearchResult;
import com.agentsearch.service.fetch.FetchReport;
import com.agentsearch.service.fetch.PageFetchPool;
import com.agentsearch.service.llm.Completion;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.service.search.WebSearchService;
import com.agentsearch.util.PromptBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Web search that reads the pages behind the top results.
 * <p>
 * For each subquery: search, fetch the top URLs through the shared fetch pool,
 * summarize every page with respect to that subquery, then answer the subquery
 * from the summaries. Pages that fail to fetch or summarize are dropped.
 */
@Slf4j
public class DeepWebRetrievalBackend extends AbstractRetrievalBackend {

    static final double SUMMARY_SCORE = 0.98;

    private final WebSearchService webSearch;
    private final PageFetchPool fetchPool;
    private final AgentSearchProperties properties;

    public DeepWebRetrievalBackend(WebSearchService webSearch,
                                   PageFetchPool fetchPool,
                                   CompletionProvider completionProvider,
                                   PromptBuilder promptBuilder,
                                   AgentSearchProperties properties) {
        super(completionProvider, promptBuilder);
        this.webSearch = webSearch;
        this.fetchPool = fetchPool;
        this.properties = properties;
    }

    @Override
    public RetrievalResult retrieve(String subquery, int maxResults) {
        List<SearchResult> hits;
        try {
            hits = webSearch.search(subquery, maxResults);
        } catch (RuntimeException e) {
            log.warn("Deep search failed for '{}': {}", subquery, e.getMessage());
            return RetrievalResult.failed("Error performing deep web search for '" + subquery + "': " + describe(e));
        }

        List<String> urls = topUrls(hits, properties.getMaxUrls());
        if (urls.isEmpty()) {
            log.warn("No URLs to analyze for '{}'", subquery);
            return RetrievalResult.empty(placeholder(subquery));
        }

        log.info("Deep search '{}': fetching {} pages", subquery, urls.size());
        FetchReport report = fetchPool.fetchAll(urls);

        List<Context> contexts = summarizePages(subquery, report.pages());
        if (contexts.isEmpty()) {
            return RetrievalResult.empty(placeholder(subquery));
        }

        String answer = analyzeSubquery(subquery, contexts);
        log.info("Deep search '{}': {} of {} pages analyzed", subquery, contexts.size(), urls.size());

        return RetrievalResult.builder()
            .answer(answer)
            .contexts(contexts)
            .build();
    }

    @Override
    public BackendType type() {
        return BackendType.DEEP_WEB;
    }

    /* ============================================================
       STEPS
       ============================================================ */

    static List<String> topUrls(List<SearchResult> hits, int limit) {
        if (hits == null) {
            return List.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        for (SearchResult hit : hits) {
            if (urls.size() >= limit) {
                break;
            }
            if (hit.getUrl() != null && !hit.getUrl().isBlank()) {
                urls.add(hit.getUrl());
            }
        }
        return new ArrayList<>(urls);
    }

    private List<Context> summarizePages(String subquery, List<PageContent> pages) {
        int summaryTokens = properties.getDeepSearch().getSummaryMaxTokens();
        List<Context> contexts = new ArrayList<>();

        for (PageContent page : pages) {
            Completion summary = complete(promptBuilder.buildPageAnalysisPrompt(subquery, page), summaryTokens);
            if (summary.failed() || summary.isBlank()) {
                log.warn("Dropping page without usable summary: {}", page.getUrl());
                continue;
            }

            contexts.add(Context.builder()
                .sourceId("deep_web_" + Integer.toHexString(page.getUrl().hashCode()))
                .title(page.getTitle())
                .content(summary.text())
                .relevanceScore(SUMMARY_SCORE)
                .sourceType(type().getSourceType())
                .url(page.getUrl())
                .build());
        }

        return contexts;
    }

    private String analyzeSubquery(String subquery, List<Context> contexts) {
        StringBuilder sources = new StringBuilder();
        for (int i = 0; i < contexts.size(); i++) {
            Context c = contexts.get(i);
            sources.append("Source [").append(i + 1).append("]: ").append(c.getTitle()).append("\n");
            sources.append("URL: ").append(c.getUrl()).append("\n");
            sources.append("Analysis: ").append(c.getContent()).append("\n\n");
        }

        int tokens = properties.getDeepSearch().getSubqueryMaxTokens();
        return complete(promptBuilder.buildSubqueryAnalysisPrompt(subquery, sources.toString()), tokens).text();
    }

    static String placeholder(String subquery) {
        return "No detailed information found for '" + subquery + "'";
    }
}
