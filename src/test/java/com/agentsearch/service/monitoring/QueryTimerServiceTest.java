package com.agentsearch.service.monitoring;

import com.agentsearch.dto.internal.PipelineStage;
import com.agentsearch.dto.internal.TimingInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTimerServiceTest {

    @Test
    @DisplayName("Stage durations are recorded in mark order")
    void stageOrder() {
        // Given
        QueryTimerService timer = new QueryTimerService();
        timer.start();

        // When
        timer.mark(PipelineStage.DECOMPOSE);
        timer.mark(PipelineStage.FAN_OUT);
        timer.mark(PipelineStage.SYNTHESIZE);
        timer.end();

        // Then
        assertThat(timer.getStepDurations()).containsOnlyKeys("DECOMPOSE", "FAN_OUT", "SYNTHESIZE");
        assertThat(timer.getStepDurations().keySet()).containsExactly("DECOMPOSE", "FAN_OUT", "SYNTHESIZE");
        assertThat(timer.getStepDurations().values()).allSatisfy(d -> assertThat(d).isGreaterThanOrEqualTo(0.0));
        assertThat(timer.getTotalTime()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("Total time is zero until the timer ends")
    void notEnded() {
        QueryTimerService timer = new QueryTimerService();
        timer.start();

        assertThat(timer.getTotalTime()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("The timing snapshot and display carry every stage")
    void snapshot() {
        QueryTimerService timer = new QueryTimerService();
        timer.start();
        timer.mark(PipelineStage.DECOMPOSE);
        timer.end();

        TimingInfo timing = timer.toTimingInfo();

        assertThat(timing.getStepDurations()).containsKey("DECOMPOSE");
        assertThat(timing.getTimestamp()).isNotBlank();
        assertThat(timer.formatDisplay()).startsWith("Processing time:").contains("DECOMPOSE");
    }
}
