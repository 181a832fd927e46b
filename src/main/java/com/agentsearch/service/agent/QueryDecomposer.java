package com.agentsearch.service.agent;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.RetrievalResult;
import com.agentsearch.dto.internal.SearchStrategy;
import com.agentsearch.dto.internal.Subquery;
import com.agentsearch.service.llm.Completion;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.util.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits a query into narrower subqueries with the completion provider.
 * <p>
 * Always returns at least one subquery: when the model output yields nothing
 * usable, blind decomposition falls back to the query itself and informed
 * decomposition to two templated follow-ups.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryDecomposer {

    static final int MAX_BLIND = 4;
    static final int MAX_INFORMED = 3;
    static final int PRIOR_CONTEXTS = 3;

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•]+|\\d+[.)])\\s*");

    private final CompletionProvider completionProvider;
    private final PromptBuilder promptBuilder;
    private final ContextAggregator contextAggregator;
    private final AgentSearchProperties properties;

    public Decomposition decompose(String query, boolean webOriented) {
        String prompt = promptBuilder.buildDecompositionPrompt(query, webOriented);
        List<String> parsed = parse(generate(prompt), MAX_BLIND);

        if (parsed.isEmpty()) {
            log.warn("No subqueries parsed, using the original query");
            return new Decomposition(List.of(new Subquery(query, SearchStrategy.BLIND)), true);
        }

        log.info("Decomposed query into {} subqueries", parsed.size());
        return new Decomposition(tag(parsed, SearchStrategy.BLIND), false);
    }

    /**
     * Follow-up subqueries aimed at what the initial retrieval did not cover
     */
    public Decomposition decomposeInformed(String query, RetrievalResult initial, boolean webOriented) {
        List<Context> prior = initial != null && initial.getContexts() != null ? initial.getContexts() : List.of();
        String answer = initial != null ? initial.getAnswer() : null;

        String formatted = contextAggregator.format(
            contextAggregator.truncateContents(prior, PRIOR_CONTEXTS, properties.getDecomposition().getContextChars()),
            properties.getInformedBudget());

        String prompt = promptBuilder.buildInformedDecompositionPrompt(query, answer, formatted, webOriented);
        List<String> parsed = parse(generate(prompt), MAX_INFORMED);

        if (parsed.isEmpty()) {
            log.warn("No follow-up subqueries parsed, using templated follow-ups");
            return new Decomposition(tag(fallbackFollowUps(query, webOriented), SearchStrategy.INFORMED), true);
        }

        log.info("Informed decomposition produced {} follow-up subqueries", parsed.size());
        return new Decomposition(tag(parsed, SearchStrategy.INFORMED), false);
    }

    /**
     * Non-empty lines of the model output with list markers removed,
     * de-duplicated in order and capped at {@code max}
     */
    static List<String> parse(String output, int max) {
        if (output == null || output.isBlank()) {
            return List.of();
        }

        Set<String> unique = new LinkedHashSet<>();
        for (String line : LINE_BREAK.split(output)) {
            String candidate = LIST_MARKER.matcher(line.trim()).replaceFirst("").trim();
            if (candidate.isEmpty()) {
                continue;
            }
            unique.add(candidate);
            if (unique.size() >= max) {
                break;
            }
        }
        return new ArrayList<>(unique);
    }

    static List<String> fallbackFollowUps(String query, boolean webOriented) {
        if (webOriented) {
            return List.of(query + " latest information", query + " alternative perspectives");
        }
        return List.of(
            "What additional details can be found about " + query + "?",
            "Are there any alternative perspectives on " + query + "?");
    }

    private String generate(String prompt) {
        try {
            Completion completion = completionProvider.generate(prompt, properties.getDecomposition().getMaxTokens());
            if (completion == null || completion.failed()) {
                log.warn("Decomposition completion failed: {}", completion != null ? completion.text() : "no result");
                return null;
            }
            log.debug("Raw decomposition output: {}", completion.text());
            return completion.text();
        } catch (RuntimeException e) {
            log.warn("Decomposition completion failed: {}", e.getMessage());
            return null;
        }
    }

    private static List<Subquery> tag(List<String> texts, SearchStrategy origin) {
        return texts.stream().map(t -> new Subquery(t, origin)).toList();
    }

    /**
     * @param fallback true when the subqueries came from a fallback rather than the model
     */
    public record Decomposition(List<Subquery> subqueries, boolean fallback) {

        public List<String> texts() {
            return subqueries.stream().map(Subquery::text).toList();
        }
    }
}
