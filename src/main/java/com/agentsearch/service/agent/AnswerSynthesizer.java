package com.agentsearch.service.agent;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.IntermediateResult;
import com.agentsearch.service.llm.Completion;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.util.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Combines every subquery answer, plus the ranked evidence, into one final answer.
 * Never throws: a failed or empty completion becomes a diagnostic answer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerSynthesizer {

    private final CompletionProvider completionProvider;
    private final PromptBuilder promptBuilder;
    private final ContextAggregator contextAggregator;
    private final AgentSearchProperties properties;

    public Completion synthesize(String originalQuery, List<IntermediateResult> results, boolean webOriented) {
        try {
            String evidence = contextAggregator.format(contextAggregator.flatten(results), properties.getSynthesisBudget());
            String prompt = promptBuilder.buildSynthesisPrompt(originalQuery, results, evidence, webOriented);

            Completion completion = completionProvider.generate(prompt, properties.getSynthesis().getMaxTokens());
            if (completion == null || completion.isBlank()) {
                log.warn("Synthesis returned no text");
                return Completion.failure("Error generating response: the model returned an empty answer");
            }
            if (completion.failed()) {
                log.warn("Synthesis failed: {}", completion.text());
            }
            return completion;

        } catch (RuntimeException e) {
            log.error("Synthesis failed", e);
            return Completion.failure("Error generating response: "
                + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }
}
