package com.agentsearch.dto.internal;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IntermediateResult {

    String subquery;

    String answer;

    List<Context> contexts;

    /**
     * Synthetic entry holding the informed strategy's first-pass retrieval.
     * Feeds aggregation and synthesis but is not reported as a subquery.
     */
    boolean initial;
}
