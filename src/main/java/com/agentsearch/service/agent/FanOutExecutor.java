package com.agentsearch.service.agent;

import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.FailureKind;
import com.agentsearch.dto.internal.IntermediateResult;
import com.agentsearch.dto.internal.PipelineStage;
import com.agentsearch.dto.internal.RetrievalResult;
import com.agentsearch.dto.internal.StageFailure;
import com.agentsearch.dto.internal.Subquery;
import com.agentsearch.service.retrieval.RetrievalBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the backend once per subquery, one subquery at a time, in order.
 * The only parallelism is inside the deep web backend's page fetches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FanOutExecutor {

    static final String INITIAL_PREFIX = "Initial query: ";

    private final ContextAggregator contextAggregator;

    /**
     * @param initial the informed strategy's first-pass entry, placed first; null for blind runs
     */
    public FanOutResult execute(RetrievalBackend backend,
                                List<Subquery> subqueries,
                                int maxResults,
                                IntermediateResult initial) {

        List<IntermediateResult> results = new ArrayList<>();
        List<StageFailure> failures = new ArrayList<>();

        if (initial != null) {
            results.add(initial);
        }

        for (int i = 0; i < subqueries.size(); i++) {
            String text = subqueries.get(i).text();
            log.info("Processing subquery {}/{}: {}", i + 1, subqueries.size(), text);

            RetrievalResult result = retrieve(backend, text, maxResults);
            if (result.isDegraded()) {
                failures.add(new StageFailure(FailureKind.RETRIEVAL, PipelineStage.FAN_OUT, result.getAnswer()));
            }
            results.add(toIntermediate(text, result, false));
        }

        return new FanOutResult(results, contextAggregator.flatten(results), failures);
    }

    /**
     * One backend call that cannot throw. A backend that breaks its contract is
     * treated as a failed retrieval.
     */
    public RetrievalResult retrieve(RetrievalBackend backend, String subquery, int maxResults) {
        try {
            RetrievalResult result = backend.retrieve(subquery, maxResults);
            if (result == null) {
                return RetrievalResult.failed("No result returned for '" + subquery + "'.");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Retrieval failed for '{}'", subquery, e);
            return RetrievalResult.failed("Error retrieving information for '" + subquery + "': " + e.getMessage());
        }
    }

    /**
     * Synthetic entry for the informed strategy's first pass
     */
    public IntermediateResult initialEntry(String query, RetrievalResult result) {
        return toIntermediate(INITIAL_PREFIX + query, result, true);
    }

    private IntermediateResult toIntermediate(String subquery, RetrievalResult result, boolean initial) {
        List<Context> tagged = result.getContexts().stream()
            .map(c -> c.toBuilder().subquery(subquery).build())
            .toList();

        return IntermediateResult.builder()
            .subquery(subquery)
            .answer(result.getAnswer() != null ? result.getAnswer() : "")
            .contexts(tagged)
            .initial(initial)
            .build();
    }

    /**
     * @param contexts all contexts, concatenated in processing order
     */
    public record FanOutResult(List<IntermediateResult> results,
                               List<Context> contexts,
                               List<StageFailure> failures) {

        /**
         * Reported subqueries; the synthetic initial entry is left out
         */
        public List<String> subqueries() {
            return results.stream()
                .filter(r -> !r.isInitial())
                .map(IntermediateResult::getSubquery)
                .toList();
        }
    }
}
