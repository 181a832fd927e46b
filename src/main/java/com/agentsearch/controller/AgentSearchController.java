package com.agentsearch.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.Chunk;
import com.agentsearch.dto.internal.ChunkingStrategy;
import com.agentsearch.dto.request.AgentSearchRequest;
import com.agentsearch.dto.request.ChunkRequest;
import com.agentsearch.dto.response.ChunkResponse;
import com.agentsearch.dto.response.PipelineResult;
import com.agentsearch.exception.BackendConfigurationException;
import com.agentsearch.service.agent.AgentSearchService;
import com.agentsearch.service.monitoring.PerformanceMonitorService;
import com.agentsearch.util.TextSegmenter;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AgentSearchController {

    private final AgentSearchService agentSearchService;
    private final TextSegmenter textSegmenter;
    private final PerformanceMonitorService performanceMonitor;
    private final AgentSearchProperties properties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "Agent Search API");
        health.put("parallelFetch", properties.isParallelFetch());
        health.put("fetchWorkers", properties.getMaxWorkers());
        return ResponseEntity.ok(health);
    }

    @PostMapping("/agent-search")
    public ResponseEntity<PipelineResult> agentSearch(@Valid @RequestBody AgentSearchRequest request) {
        log.info("Agent search request: backend={}, strategy={}", request.getBackend(), request.getStrategy());
        return ResponseEntity.ok(agentSearchService.search(request));
    }

    @PostMapping("/chunk")
    public ResponseEntity<ChunkResponse> chunk(@Valid @RequestBody ChunkRequest request) {
        AgentSearchProperties.Segmentation defaults = properties.getSegmentation();

        int size = request.getChunkSize() != null ? request.getChunkSize() : defaults.getChunkSize();
        int overlap = request.getOverlap() != null ? request.getOverlap() : defaults.getOverlap();
        ChunkingStrategy strategy = ChunkingStrategy.from(
            request.getStrategy() != null ? request.getStrategy() : defaults.getStrategy());

        List<Chunk> chunks = textSegmenter.chunk(request.getText(), size, overlap, strategy);
        log.info("Chunked {} chars into {} chunks ({})", request.getText().length(), chunks.size(), strategy.getValue());

        return ResponseEntity.ok(ChunkResponse.builder()
            .strategy(strategy)
            .chunkSize(size)
            .overlap(Math.max(0, Math.min(overlap, Math.max(1, size) - 1)))
            .totalChunks(chunks.size())
            .chunks(chunks)
            .build());
    }

    // ===== PERFORMANCE MONITORING =====

    @GetMapping("/performance/stats")
    public ResponseEntity<?> performanceStats() {
        log.debug("Performance stats requested");
        return ResponseEntity.ok(performanceMonitor.getStatistics());
    }

    @GetMapping("/performance/history")
    public ResponseEntity<?> performanceHistory() {
        var history = performanceMonitor.getRunHistory();
        return ResponseEntity.ok(Map.of("totalRuns", history.size(), "history", history));
    }

    // ===== ERRORS =====

    @ExceptionHandler(BackendConfigurationException.class)
    public ResponseEntity<Map<String, Object>> misconfigured(BackendConfigurationException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(f -> f.getField() + ": " + f.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request");
        return ResponseEntity.badRequest().body(error(HttpStatus.BAD_REQUEST, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        return ResponseEntity.badRequest().body(error(HttpStatus.BAD_REQUEST, cause.getMessage()));
    }

    private static Map<String, Object> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", message != null ? message : status.getReasonPhrase());
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
