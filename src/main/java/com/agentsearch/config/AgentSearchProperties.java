package com.agentsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Pipeline configuration, bound from {@code agent-search.*} and injected into
 * each component that needs it. Every nested group starts from its defaults,
 * so a bare {@code new AgentSearchProperties()} is a complete configuration.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "agent-search")
public class AgentSearchProperties {

    private Retrieval retrieval = new Retrieval();
    private Decomposition decomposition = new Decomposition();
    private Synthesis synthesis = new Synthesis();
    private Answer answer = new Answer();
    private DeepSearch deepSearch = new DeepSearch();
    private Fetch fetch = new Fetch();
    private Searxng searxng = new Searxng();
    private Qdrant qdrant = new Qdrant();
    private Segmentation segmentation = new Segmentation();
    private Monitoring monitoring = new Monitoring();

    // ============================================================
    // Retrieval
    // ============================================================
    @Data
    public static class Retrieval {
        private Integer maxResults = 3;      // document backend, per subquery
        private Integer webMaxResults = 5;   // web backends, per subquery
    }

    @Data
    public static class Decomposition {
        private Integer maxTokens = 500;
        private Integer contextChars = 500;  // per prior context in the informed prompt
    }

    @Data
    public static class Synthesis {
        private Integer maxTokens = 1000;
        private Integer contextBudget = 4000;
        private Integer informedContextBudget = 2000;
    }

    /**
     * Per-subquery answers produced inside the backends
     */
    @Data
    public static class Answer {
        private Integer maxTokens = 1000;
    }

    // ============================================================
    // Deep web search / page fetching
    // ============================================================
    @Data
    public static class DeepSearch {
        private Integer maxUrls = 5;
        private Boolean parallel = true;
        private Integer maxWorkers = 3;
        private Integer summaryMaxTokens = 500;
        private Integer subqueryMaxTokens = 600;
    }

    @Data
    public static class Fetch {
        private Integer timeoutSeconds = 10;
        private Long rateLimitMillis = 1000L;
        private Integer maxContentLength = 100_000;
        private String userAgent = "AgentSearch/1.0";
    }

    // ============================================================
    // External services
    // ============================================================
    @Data
    public static class Searxng {
        private String baseUrl = "http://localhost:8080";
        private Integer timeoutSeconds = 10;
        private Integer maxResults = 25;
        private String language = "en";
    }

    @Data
    public static class Qdrant {
        private String baseUrl = "http://localhost:6333";
        private Integer timeoutSeconds = 10;
    }

    // ============================================================
    // Segmentation / Monitoring
    // ============================================================
    @Data
    public static class Segmentation {
        private Integer chunkSize = 1000;
        private Integer overlap = 200;
        private String strategy = "sentence";
    }

    @Data
    public static class Monitoring {
        private Integer maxRunHistory = 100;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public int getMaxResults() {
        return orDefault(retrieval.getMaxResults(), 3);
    }

    public int getWebMaxResults() {
        return orDefault(retrieval.getWebMaxResults(), 5);
    }

    public int getSynthesisBudget() {
        return orDefault(synthesis.getContextBudget(), 4000);
    }

    public int getInformedBudget() {
        return orDefault(synthesis.getInformedContextBudget(), 2000);
    }

    public int getMaxUrls() {
        return orDefault(deepSearch.getMaxUrls(), 5);
    }

    public int getMaxWorkers() {
        return orDefault(deepSearch.getMaxWorkers(), 3);
    }

    public boolean isParallelFetch() {
        return deepSearch.getParallel() == null || deepSearch.getParallel();
    }

    public int getFetchTimeoutSeconds() {
        return orDefault(fetch.getTimeoutSeconds(), 10);
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    // ============================================================
    // Initialization & Logging
    // ============================================================

    @PostConstruct
    public void init() {
        log.info("=".repeat(70));
        log.info("AGENT SEARCH CONFIGURATION");
        log.info("=".repeat(70));
        log.info("  Max results (doc / web)   : {} / {}", getMaxResults(), getWebMaxResults());
        log.info("  Synthesis budget          : {} chars (informed: {})", getSynthesisBudget(), getInformedBudget());
        log.info("  Deep search URLs          : {}", getMaxUrls());
        log.info("  Parallel fetch            : {} ({} workers)", isParallelFetch(), getMaxWorkers());
        log.info("  Fetch timeout             : {}s", getFetchTimeoutSeconds());
        log.info("  SearXNG                   : {}", searxng.getBaseUrl());
        log.info("  Qdrant                    : {}", qdrant.getBaseUrl());
        log.info("=".repeat(70));
    }
}
