package com.agentsearch.service.monitoring;

import com.agentsearch.dto.internal.PipelineStage;
import com.agentsearch.dto.internal.TimingInfo;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage timer for one pipeline run. Not shared: each run creates its own.
 */
public class QueryTimerService {

    @Getter
    private Long startTime;

    @Getter
    private Long endTime;

    private final Map<String, Long> marks = new LinkedHashMap<>();

    public void start() {
        this.startTime = System.currentTimeMillis();
        this.endTime = null;
        this.marks.clear();
    }

    /**
     * Records the end of {@code stage}; its duration runs from the previous mark
     */
    public void mark(PipelineStage stage) {
        if (startTime == null) {
            start();
        }
        marks.put(stage.name(), System.currentTimeMillis() - startTime);
    }

    public void end() {
        this.endTime = System.currentTimeMillis();
    }

    public double getTotalTime() {
        if (startTime == null || endTime == null) {
            return 0.0;
        }
        return (endTime - startTime) / 1000.0;
    }

    public Map<String, Double> getStepDurations() {
        Map<String, Double> durations = new LinkedHashMap<>();

        long previous = 0L;
        for (Map.Entry<String, Long> entry : marks.entrySet()) {
            durations.put(entry.getKey(), (entry.getValue() - previous) / 1000.0);
            previous = entry.getValue();
        }

        return durations;
    }

    public TimingInfo toTimingInfo() {
        return TimingInfo.builder()
            .totalTime(getTotalTime())
            .stepDurations(getStepDurations())
            .timestamp(Instant.now().toString())
            .build();
    }

    public String formatDisplay() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Processing time: %.2fs%n", getTotalTime()));
        for (Map.Entry<String, Double> entry : getStepDurations().entrySet()) {
            sb.append(String.format("  - %s: %.2fs%n", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }
}
