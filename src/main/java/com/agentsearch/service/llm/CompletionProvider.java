package com.agentsearch.service.llm;

import com.agentsearch.dto.internal.ModelInfo;

/**
 * Language-model completion capability used by decomposition, per-subquery
 * answers, page summaries and synthesis.
 * <p>
 * Implementations catch their own failures: {@link #generate} returns a failed
 * {@link Completion} carrying a diagnostic string instead of throwing.
 */
public interface CompletionProvider {

    Completion generate(String prompt, int maxTokens);

    ModelInfo describe();
}
