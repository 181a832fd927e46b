package com.agentsearch.service.agent;

import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.IntermediateResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Two views of the same contexts: the caller-facing list in processing order,
 * and a ranked, character-budgeted text block for prompts.
 */
@Component
public class ContextAggregator {

    public static final String TRUNCATION_MARKER = "[... additional context truncated]";

    /**
     * Contexts of all results, concatenated in order. Not de-duplicated.
     */
    public List<Context> flatten(List<IntermediateResult> results) {
        List<Context> all = new ArrayList<>();
        for (IntermediateResult r : results) {
            if (r.getContexts() != null) {
                all.addAll(r.getContexts());
            }
        }
        return all;
    }

    /**
     * Formats contexts by descending relevance until the next entry would push
     * the text past {@code budget}; then appends {@link #TRUNCATION_MARKER} and
     * stops. Entries are never cut. The input list is not reordered.
     */
    public String format(List<Context> contexts, int budget) {
        if (contexts == null || contexts.isEmpty()) {
            return "";
        }

        List<Context> ranked = new ArrayList<>(contexts);
        ranked.sort(Comparator.comparingDouble(Context::getRelevanceScore).reversed());

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ranked.size(); i++) {
            String entry = entry(i + 1, ranked.get(i));
            if (sb.length() + entry.length() > budget) {
                sb.append(TRUNCATION_MARKER);
                break;
            }
            sb.append(entry);
        }
        return sb.toString();
    }

    /**
     * Same contexts with each content cut to {@code maxChars}
     */
    public List<Context> truncateContents(List<Context> contexts, int limit, int maxChars) {
        return contexts.stream()
            .limit(limit)
            .map(c -> c.getContent().length() <= maxChars
                ? c
                : c.toBuilder().content(c.getContent().substring(0, maxChars) + "...").build())
            .toList();
    }

    private String entry(int rank, Context c) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(rank).append("] ").append(c.getTitle());
        if (c.getUrl() != null && !c.getUrl().isBlank()) {
            sb.append(" (").append(c.getUrl()).append(")");
        }
        sb.append("\n").append(c.getContent()).append("\n\n");
        return sb.toString();
    }
}
