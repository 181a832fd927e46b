package com.agentsearch.service.llm;

import com.agentsearch.dto.internal.ModelInfo;
import com.agentsearch.exception.CompletionException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class OllamaCompletionProvider implements CompletionProvider {

    static final String SYSTEM_PROMPT = "You are a helpful assistant.";

    private final ChatModel chatModel;
    private final OllamaOptions defaultOptions;

    /**
     * Single-turn completion capped at {@code maxTokens} output tokens
     */
    @Override
    @CircuitBreaker(name = "ollama", fallbackMethod = "fallbackGenerate")
    @Retry(name = "ollama")
    public Completion generate(String prompt, int maxTokens) {
        try {
            log.debug("Generating completion ({} max tokens)", maxTokens);

            OllamaOptions options = OllamaOptions.fromOptions(defaultOptions);
            options.setNumPredict(maxTokens);

            Prompt request = new Prompt(
                List.of(new SystemMessage(SYSTEM_PROMPT), new UserMessage(prompt)),
                options
            );
            ChatResponse response = chatModel.call(request);

            if (response == null || response.getResult() == null) {
                throw new CompletionException("Empty response from model");
            }

            String content = response.getResult().getOutput().getText();
            log.debug("Completion generated ({} chars)", content != null ? content.length() : 0);
            return Completion.of(content);

        } catch (CompletionException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error generating completion: {}", e.getMessage());
            throw new CompletionException("Failed to generate completion", e);
        }
    }

    @Override
    public ModelInfo describe() {
        return new ModelInfo("Ollama", defaultOptions.getModel());
    }

    /**
     * Fallback once retries are exhausted or the circuit is open
     */
    private Completion fallbackGenerate(String prompt, int maxTokens, Exception e) {
        log.warn("Using fallback for completion: {}", e.getMessage());
        return Completion.failure("Error generating response: " + rootMessage(e));
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
