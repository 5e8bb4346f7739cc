package com.peoplescourt.service.monitoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.dto.internal.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PerformanceMonitorServiceTest {

    private CourtProperties properties;
    private PerformanceMonitorService monitor;

    @BeforeEach
    void setUp() {
        properties = new CourtProperties();
        CourtProperties.Monitoring monitoring = new CourtProperties.Monitoring();
        monitoring.setMaxQueryHistory(3);
        properties.setMonitoring(monitoring);
        monitor = new PerformanceMonitorService(properties);
    }

    private static AdjudicationTimer timer(long retrievalMillis, long deliberationMillis) {
        AdjudicationTimer timer = new AdjudicationTimer();
        timer.start();
        timer.record("retrieval", retrievalMillis);
        timer.record("deliberation", deliberationMillis);
        timer.end();
        return timer;
    }

    @Test
    void reportsWhenEmpty() {
        assertThat(monitor.getStatistics()).containsEntry("message", "No adjudications recorded yet");
    }

    @Test
    void keepsOnlyMostRecentHistory() {
        for (int i = 0; i < 5; i++) {
            monitor.addAdjudication("scenario " + i, Verdict.NTA, timer(100, 200));
        }

        assertThat(monitor.getHistory()).hasSize(3);
        assertThat(monitor.getHistory().get(0).scenario()).isEqualTo("scenario 2");
    }

    @Test
    @SuppressWarnings("unchecked")
    void aggregatesStepStatistics() {
        monitor.addAdjudication("a", Verdict.NTA, timer(100, 1000));
        monitor.addAdjudication("b", Verdict.YTA, timer(300, 2000));
        monitor.addAdjudication("c", Verdict.NTA, timer(200, 6000));

        Map<String, Object> stats = monitor.getStatistics();
        Map<String, Map<String, Double>> steps = (Map<String, Map<String, Double>>) stats.get("step_statistics");

        assertThat(stats).containsEntry("total_adjudications", 3);
        assertThat(steps.get("retrieval").get("median")).isCloseTo(0.2, within(1e-9));
        assertThat(steps.get("deliberation").get("avg")).isCloseTo(3.0, within(1e-9));
        assertThat(steps.get("deliberation").get("max")).isCloseTo(6.0, within(1e-9));
        assertThat((Map<Verdict, Integer>) stats.get("verdicts"))
                .containsEntry(Verdict.NTA, 2)
                .containsEntry(Verdict.YTA, 1);
    }

    @Test
    void statisticsUseSnakeCaseKeys() {
        monitor.addAdjudication("a", Verdict.NTA, timer(100, 1000));

        assertThat(monitor.getStatistics()).containsOnlyKeys(
                "total_adjudications", "avg_total_time", "median_total_time",
                "min_total_time", "max_total_time", "step_statistics", "verdicts");
    }

    @Test
    void historyRecordsSerializeInSnakeCase() {
        monitor.addAdjudication("a", Verdict.ESH, timer(100, 1000));

        JsonNode json = new ObjectMapper().valueToTree(monitor.getHistory().get(0));

        assertThat(json.has("total_time")).isTrue();
        assertThat(json.at("/step_durations/deliberation").asDouble()).isEqualTo(1.0);
        assertThat(json.get("verdict").asText()).isEqualTo("ESH");
    }

    @Test
    void truncatesLongScenarios() {
        monitor.addAdjudication("x".repeat(150), Verdict.ESH, timer(1, 1));

        assertThat(monitor.getHistory().get(0).scenario()).hasSize(103).endsWith("...");
    }
}
