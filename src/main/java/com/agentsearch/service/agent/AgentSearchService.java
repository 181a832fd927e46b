package com.agentsearch.service.agent;

import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.ConversationTurn;
import com.agentsearch.dto.internal.FailureKind;
import com.agentsearch.dto.internal.IntermediateResult;
import com.agentsearch.dto.internal.ModelInfo;
import com.agentsearch.dto.internal.PipelineStage;
import com.agentsearch.dto.internal.RetrievalResult;
import com.agentsearch.dto.internal.SearchStrategy;
import com.agentsearch.dto.internal.StageFailure;
import com.agentsearch.dto.internal.Subquery;
import com.agentsearch.dto.request.AgentSearchRequest;
import com.agentsearch.dto.response.PipelineResult;
import com.agentsearch.service.agent.FanOutExecutor.FanOutResult;
import com.agentsearch.service.agent.QueryDecomposer.Decomposition;
import com.agentsearch.service.llm.Completion;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.service.monitoring.PerformanceMonitorService;
import com.agentsearch.service.monitoring.QueryTimerService;
import com.agentsearch.service.retrieval.RetrievalBackend;
import com.agentsearch.service.retrieval.RetrievalBackendFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * One pipeline run per query:
 * INIT → [INITIAL_RETRIEVAL] → DECOMPOSE → FAN_OUT → AGGREGATE → SYNTHESIZE → DONE.
 * <p>
 * INITIAL_RETRIEVAL only runs for the informed strategy. The single strategy skips
 * DECOMPOSE and SYNTHESIZE and returns the one retrieval's answer. Every run reaches DONE:
 * a failing stage is recorded as a {@link StageFailure} and replaced by its
 * fallback. Each run keeps its own state, so concurrent runs share nothing
 * mutable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentSearchService {

    private final ConversationFormatter conversationFormatter;
    private final QueryDecomposer queryDecomposer;
    private final FanOutExecutor fanOutExecutor;
    private final AnswerSynthesizer answerSynthesizer;
    private final CompletionProvider completionProvider;
    private final RetrievalBackendFactory backendFactory;
    private final PerformanceMonitorService performanceMonitor;

    /**
     * Builds the backend for the request, then runs the pipeline. Backend
     * misconfiguration is thrown before any stage starts.
     */
    public PipelineResult search(AgentSearchRequest request) {
        RetrievalBackend backend = backendFactory.create(request.getBackend(), request.getCollectionId());
        int maxResults = request.getMaxResults() != null
            ? request.getMaxResults()
            : backendFactory.defaultMaxResults(backend.type());

        return run(request.getQuery(), request.getHistory(), backend, request.getStrategy(), maxResults);
    }

    public PipelineResult run(String query,
                              List<ConversationTurn> history,
                              RetrievalBackend backend,
                              SearchStrategy strategy,
                              int maxResults) {

        Run run = new Run(query, strategy != null ? strategy : SearchStrategy.BLIND, backend.type());
        run.timer.start();

        log.info("Agent search ({}, {}): {}", run.strategy.getValue(), run.backend.getValue(), truncate(query, 80));

        String effectiveQuery = query;
        try {
            /* =========================
               INIT
               ========================= */
            effectiveQuery = conversationFormatter.format(query, history);
            run.enter(PipelineStage.INIT);

            if (run.strategy == SearchStrategy.SINGLE) {
                runSingle(run, backend, effectiveQuery, maxResults);
            } else {
                runAgent(run, backend, effectiveQuery, maxResults);
            }

        } catch (RuntimeException e) {
            log.error("Agent search run failed", e);
            PipelineStage failed = run.failingStage();
            run.fail(failureKindFor(failed), failed, e.getMessage());
            if (run.answer == null) {
                run.answer = "An error occurred while processing the query: " + e.getMessage();
            }
            if (run.subqueries.isEmpty()) {
                run.subqueries = List.of(effectiveQuery != null ? effectiveQuery : "");
            }
        }

        run.enter(PipelineStage.DONE);
        run.timer.end();

        PipelineResult result = run.toResult(describeModel());
        performanceMonitor.record(result);

        log.info("Agent search done in {}s: {} subqueries, {} contexts, {} failures",
            result.getTiming().getTotalTime(), result.getSubqueries().size(),
            result.getContexts().size(), result.getFailures().size());
        return result;
    }

    /* ============================================================
       STAGES
       ============================================================ */

    private void runAgent(Run run, RetrievalBackend backend, String query, int maxResults) {
        /* =========================
           INITIAL RETRIEVAL (informed only)
           ========================= */
        RetrievalResult initialResult = null;
        IntermediateResult initialEntry = null;
        if (run.strategy == SearchStrategy.INFORMED) {
            initialResult = fanOutExecutor.retrieve(backend, query, maxResults);
            if (initialResult.isDegraded()) {
                run.fail(FailureKind.RETRIEVAL, PipelineStage.INITIAL_RETRIEVAL, initialResult.getAnswer());
            }
            initialEntry = fanOutExecutor.initialEntry(query, initialResult);
            run.enter(PipelineStage.INITIAL_RETRIEVAL);
            log.info("Initial retrieval: {} contexts", initialResult.getContexts().size());
        }

        /* =========================
           DECOMPOSE
           ========================= */
        List<Subquery> subqueries = decompose(run, query, initialResult);
        run.enter(PipelineStage.DECOMPOSE);
        log.info("Subqueries: {}", subqueries.stream().map(Subquery::text).toList());

        /* =========================
           FAN OUT
           ========================= */
        FanOutResult fanOut = fanOut(run, backend, subqueries, maxResults, initialEntry);
        run.failures.addAll(fanOut.failures());
        run.enter(PipelineStage.FAN_OUT);

        /* =========================
           AGGREGATE
           ========================= */
        run.results = fanOut.results();
        run.subqueries = fanOut.subqueries();
        run.contexts = fanOut.contexts();
        run.enter(PipelineStage.AGGREGATE);

        /* =========================
           SYNTHESIZE
           ========================= */
        Completion answer = answerSynthesizer.synthesize(query, run.results, run.backend.isWebOriented());
        if (answer.failed()) {
            run.fail(FailureKind.SYNTHESIS, PipelineStage.SYNTHESIZE, answer.text());
        }
        run.answer = answer.text();
        run.enter(PipelineStage.SYNTHESIZE);
    }

    /**
     * No decomposition and no synthesis: the whole query goes to the backend
     * once and its answer is the final answer.
     */
    private void runSingle(Run run, RetrievalBackend backend, String query, int maxResults) {
        FanOutResult fanOut = fanOut(run, backend, List.of(new Subquery(query, SearchStrategy.SINGLE)), maxResults, null);
        run.failures.addAll(fanOut.failures());
        run.enter(PipelineStage.FAN_OUT);

        run.results = fanOut.results();
        run.subqueries = fanOut.subqueries();
        run.contexts = fanOut.contexts();
        run.enter(PipelineStage.AGGREGATE);

        run.answer = run.results.isEmpty() ? null : run.results.get(0).getAnswer();
    }

    private List<Subquery> decompose(Run run, String query, RetrievalResult initialResult) {
        boolean web = run.backend.isWebOriented();
        try {
            Decomposition decomposition = run.strategy == SearchStrategy.INFORMED
                ? queryDecomposer.decomposeInformed(query, initialResult, web)
                : queryDecomposer.decompose(query, web);

            if (decomposition.fallback()) {
                run.fail(FailureKind.DECOMPOSITION, PipelineStage.DECOMPOSE, "No subqueries parsed; using fallback");
            }
            return decomposition.subqueries();

        } catch (RuntimeException e) {
            log.warn("Decomposition failed, using the original query: {}", e.getMessage());
            run.fail(FailureKind.DECOMPOSITION, PipelineStage.DECOMPOSE, e.getMessage());
            return List.of(new Subquery(query, run.strategy));
        }
    }

    private FanOutResult fanOut(Run run,
                                RetrievalBackend backend,
                                List<Subquery> subqueries,
                                int maxResults,
                                IntermediateResult initialEntry) {
        try {
            return fanOutExecutor.execute(backend, subqueries, maxResults, initialEntry);
        } catch (RuntimeException e) {
            log.error("Fan-out failed", e);
            run.fail(FailureKind.RETRIEVAL, PipelineStage.FAN_OUT, e.getMessage());

            List<IntermediateResult> results = new ArrayList<>();
            if (initialEntry != null) {
                results.add(initialEntry);
            }
            for (Subquery subquery : subqueries) {
                results.add(IntermediateResult.builder()
                    .subquery(subquery.text())
                    .answer("Error retrieving information for '" + subquery.text() + "': " + e.getMessage())
                    .contexts(List.of())
                    .build());
            }
            List<Context> contexts = initialEntry != null ? initialEntry.getContexts() : List.of();
            return new FanOutResult(results, contexts, List.of());
        }
    }

    private ModelInfo describeModel() {
        try {
            return completionProvider.describe();
        } catch (RuntimeException e) {
            log.warn("Could not describe the completion model: {}", e.getMessage());
            return new ModelInfo("unknown", "unknown");
        }
    }

    private static FailureKind failureKindFor(PipelineStage stage) {
        switch (stage) {
            case INIT:
            case DECOMPOSE:
                return FailureKind.DECOMPOSITION;
            case SYNTHESIZE:
                return FailureKind.SYNTHESIS;
            default:
                return FailureKind.RETRIEVAL;
        }
    }

    private static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }

    /* ============================================================
       PER-RUN STATE
       ============================================================ */

    private static final class Run {

        final String query;
        final SearchStrategy strategy;
        final BackendType backend;
        final QueryTimerService timer = new QueryTimerService();
        final List<PipelineStage> stages = new ArrayList<>();
        final List<StageFailure> failures = new ArrayList<>();

        List<IntermediateResult> results = List.of();
        List<String> subqueries = List.of();
        List<Context> contexts = List.of();
        String answer;

        Run(String query, SearchStrategy strategy, BackendType backend) {
            this.query = query;
            this.strategy = strategy;
            this.backend = backend;
        }

        void enter(PipelineStage stage) {
            stages.add(stage);
            timer.mark(stage);
        }

        /**
         * The stage that was running when an unexpected error escaped
         */
        PipelineStage failingStage() {
            if (stages.isEmpty()) {
                return PipelineStage.INIT;
            }
            switch (stages.get(stages.size() - 1)) {
                case INIT:
                    if (strategy == SearchStrategy.SINGLE) {
                        return PipelineStage.FAN_OUT;
                    }
                    return strategy == SearchStrategy.INFORMED ? PipelineStage.INITIAL_RETRIEVAL : PipelineStage.DECOMPOSE;
                case INITIAL_RETRIEVAL:
                    return PipelineStage.DECOMPOSE;
                case DECOMPOSE:
                    return PipelineStage.FAN_OUT;
                case FAN_OUT:
                    return PipelineStage.AGGREGATE;
                default:
                    return PipelineStage.SYNTHESIZE;
            }
        }

        void fail(FailureKind kind, PipelineStage stage, String detail) {
            log.warn("{} failure at {}: {}", kind, stage, detail);
            failures.add(new StageFailure(kind, stage, detail));
        }

        PipelineResult toResult(ModelInfo modelInfo) {
            return PipelineResult.builder()
                .query(query)
                .answer(answer != null && !answer.isBlank() ? answer : "No answer could be generated.")
                .subqueries(subqueries)
                .intermediateResults(results)
                .contexts(contexts)
                .strategy(strategy)
                .backend(backend)
                .modelInfo(modelInfo)
                .failures(List.copyOf(failures))
                .stages(List.copyOf(stages))
                .timing(timer.toTimingInfo())
                .build();
        }
    }
}
