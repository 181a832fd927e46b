package com.agentsearch.config;

import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class OllamaConfig {

    @Value("${spring.ai.ollama.base-url}")
    private String baseUrl;

    @Value("${spring.ai.ollama.chat.options.model}")
    private String model;

    @Value("${spring.ai.ollama.embedding.options.model}")
    private String embeddingModel;

    @Value("${spring.ai.ollama.chat.options.temperature:0.3}")
    private Double temperature;

    @Value("${spring.ai.ollama.chat.options.num-predict:1000}")
    private Integer numPredict;

    @Value("${spring.ai.ollama.chat.options.top-k:40}")
    private Integer topK;

    @Value("${spring.ai.ollama.chat.options.top-p:0.9}")
    private Double topP;

    @Value("${spring.ai.ollama.chat.options.repeat-penalty:1.1}")
    private Double repeatPenalty;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Initializing Ollama API with base URL: {}", baseUrl);
        return OllamaApi.builder()
                .baseUrl(baseUrl)
                .build();
    }

    @Bean
    public OllamaOptions defaultOllamaOptions() {
        return OllamaOptions.builder()
                .model(model)
                .temperature(temperature)
                .numPredict(numPredict) // overridden per call with the caller's token budget
                .topK(topK)
                .topP(topP)
                .repeatPenalty(repeatPenalty)
                .build();
    }

    @Bean
    public ModelManagementOptions modelManagementOptions() {
        return ModelManagementOptions.builder().build();
    }

    @Bean
    public OllamaChatModel ollamaChatModel(
            OllamaApi ollamaApi,
            OllamaOptions defaultOllamaOptions,
            ObjectProvider<ObservationRegistry> observationRegistry,
            ModelManagementOptions modelManagementOptions) {

        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(defaultOllamaOptions)
                .observationRegistry(observationRegistry.getIfUnique(() -> ObservationRegistry.NOOP))
                .modelManagementOptions(modelManagementOptions)
                .build();
    }

    @Bean
    public OllamaEmbeddingModel ollamaEmbeddingModel(
            OllamaApi ollamaApi,
            ObjectProvider<ObservationRegistry> observationRegistry,
            ModelManagementOptions modelManagementOptions) {

        log.info("Query embeddings with Ollama model: {}", embeddingModel);
        return OllamaEmbeddingModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(OllamaOptions.builder().model(embeddingModel).build())
                .observationRegistry(observationRegistry.getIfUnique(() -> ObservationRegistry.NOOP))
                .modelManagementOptions(modelManagementOptions)
                .build();
    }
}
