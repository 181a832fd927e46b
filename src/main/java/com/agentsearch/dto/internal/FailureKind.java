package com.agentsearch.dto.internal;

public enum FailureKind {
    /** No parsable subqueries; a fallback list was used. */
    DECOMPOSITION,
    /** A backend call errored; the subquery got an empty-context placeholder. */
    RETRIEVAL,
    /** A single page could not be fetched or summarized and was dropped. */
    FETCH,
    /** The final completion call errored; the answer is a diagnostic string. */
    SYNTHESIS
}
