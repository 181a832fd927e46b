package com.agentsearch.dto.response;

import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.IntermediateResult;
import com.agentsearch.dto.internal.ModelInfo;
import com.agentsearch.dto.internal.PipelineStage;
import com.agentsearch.dto.internal.SearchStrategy;
import com.agentsearch.dto.internal.StageFailure;
import com.agentsearch.dto.internal.TimingInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResult {

    // ================= CORE RESPONSE =================
    /**
     * The query as asked, before prior conversation turns are folded in
     */
    private String query;

    private String answer;

    // ================= DECOMPOSITION DETAILS =================
    /**
     * Subqueries in processing order (the informed strategy's initial entry is not listed)
     */
    private List<String> subqueries;

    /**
     * One entry per processed subquery, plus the initial entry under the informed strategy
     */
    private List<IntermediateResult> intermediateResults;

    /**
     * All contexts in processing order, not de-duplicated
     */
    private List<Context> contexts;

    // ================= EXECUTION MODE =================
    private SearchStrategy strategy;

    private BackendType backend;

    private ModelInfo modelInfo;

    // ================= DIAGNOSTICS =================
    /**
     * Steps that degraded to a fallback. Empty for a clean run.
     */
    private List<StageFailure> failures;

    private List<PipelineStage> stages;

    private TimingInfo timing;
}
