package com.agentsearch.dto.internal;

/**
 * States of one pipeline run, in the order they are entered.
 * INITIAL_RETRIEVAL is only visited by the informed strategy; the single strategy skips
 * DECOMPOSE and SYNTHESIZE. DONE is always reached.
 */
public enum PipelineStage {
    INIT,
    INITIAL_RETRIEVAL,
    DECOMPOSE,
    FAN_OUT,
    AGGREGATE,
    SYNTHESIZE,
    DONE
}
