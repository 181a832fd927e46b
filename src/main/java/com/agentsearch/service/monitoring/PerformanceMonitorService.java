package com.agentsearch.service.monitoring;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.response.PipelineResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Bounded history of completed pipeline runs and timing statistics over it.
 * Safe for concurrent runs.
 */
@Slf4j
@Service
public class PerformanceMonitorService {

    private final int maxRunHistory;

    private final ConcurrentLinkedDeque<RunRecord> runHistory = new ConcurrentLinkedDeque<>();

    public PerformanceMonitorService(AgentSearchProperties properties) {
        Integer configured = properties.getMonitoring().getMaxRunHistory();
        this.maxRunHistory = configured != null && configured > 0 ? configured : 100;
    }

    public void record(PipelineResult result) {
        if (result == null || result.getTiming() == null) {
            return;
        }

        String query = result.getQuery() != null ? result.getQuery() : "";
        RunRecord record = new RunRecord(
            Instant.now().toString(),
            query.length() > 100 ? query.substring(0, 100) + "..." : query,
            result.getStrategy() != null ? result.getStrategy().getValue() : null,
            result.getBackend() != null ? result.getBackend().getValue() : null,
            result.getFailures() != null ? result.getFailures().size() : 0,
            result.getTiming().getTotalTime() != null ? result.getTiming().getTotalTime() : 0.0,
            result.getTiming().getStepDurations() != null
                ? new LinkedHashMap<>(result.getTiming().getStepDurations())
                : Map.of()
        );

        runHistory.addLast(record);

        // keep the most recent runs only
        while (runHistory.size() > maxRunHistory) {
            runHistory.pollFirst();
        }
        log.debug("Recorded run ({}s, {} failures)", record.totalTime(), record.failureCount());
    }

    public List<RunRecord> getRunHistory() {
        return List.copyOf(runHistory);
    }

    public Map<String, Object> getStatistics() {
        List<RunRecord> runs = getRunHistory();
        if (runs.isEmpty()) {
            return Map.of("message", "No runs recorded yet");
        }

        List<Double> totalTimes = runs.stream().map(RunRecord::totalTime).toList();

        Map<String, List<Double>> perStage = new LinkedHashMap<>();
        Map<String, Integer> perStrategy = new HashMap<>();
        Map<String, Integer> perBackend = new HashMap<>();
        for (RunRecord run : runs) {
            run.stepDurations().forEach((stage, seconds) ->
                perStage.computeIfAbsent(stage, k -> new ArrayList<>()).add(seconds));
            if (run.strategy() != null) {
                perStrategy.merge(run.strategy(), 1, Integer::sum);
            }
            if (run.backend() != null) {
                perBackend.merge(run.backend(), 1, Integer::sum);
            }
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalRuns", runs.size());
        stats.putAll(summary("TotalTime", totalTimes));
        stats.put("runsByStrategy", perStrategy);
        stats.put("runsByBackend", perBackend);
        stats.put("degradedRuns", runs.stream().filter(r -> r.failureCount() > 0).count());

        Map<String, Map<String, Double>> stageStats = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : perStage.entrySet()) {
            List<Double> times = entry.getValue();
            Map<String, Double> s = new LinkedHashMap<>();
            s.put("avg", average(times));
            s.put("median", median(times));
            s.put("min", Collections.min(times));
            s.put("max", Collections.max(times));
            stageStats.put(entry.getKey(), s);
        }
        stats.put("stageStatistics", stageStats);

        return stats;
    }

    private Map<String, Double> summary(String suffix, List<Double> values) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("avg" + suffix, average(values));
        m.put("median" + suffix, median(values));
        m.put("min" + suffix, Collections.min(values));
        m.put("max" + suffix, Collections.max(values));
        return m;
    }

    static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int size = sorted.size();
        return size % 2 == 0
            ? (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0
            : sorted.get(size / 2);
    }

    public record RunRecord(
        String timestamp,
        String query,
        String strategy,
        String backend,
        int failureCount,
        double totalTime,
        Map<String, Double> stepDurations
    ) {
    }
}
