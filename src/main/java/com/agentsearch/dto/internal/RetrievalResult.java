package com.agentsearch.dto.internal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a retrieval backend returns for one subquery. A non-null failure means
 * the backend degraded: contexts are empty and the answer explains why.
 */
@Value
@Builder
public class RetrievalResult {

    String answer;

    @Singular
    List<Context> contexts;

    FailureKind failure;

    public boolean isDegraded() {
        return failure != null;
    }

    public static RetrievalResult empty(String answer) {
        return RetrievalResult.builder().answer(answer).build();
    }

    public static RetrievalResult failed(String answer) {
        return RetrievalResult.builder()
            .answer(answer)
            .failure(FailureKind.RETRIEVAL)
            .build();
    }
}
