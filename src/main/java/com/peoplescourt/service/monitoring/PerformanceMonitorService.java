package com.peoplescourt.service.monitoring;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.dto.internal.Verdict;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentLinkedDeque;

@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceMonitorService {

    private static final int MAX_SCENARIO_PREVIEW = 100;

    private final CourtProperties properties;

    private final Deque<AdjudicationRecord> history = new ConcurrentLinkedDeque<>();

    public void addAdjudication(String scenario, Verdict verdict, AdjudicationTimer timer) {
        AdjudicationRecord record = AdjudicationRecord.builder()
                .timestamp(Instant.now().toString())
                .scenario(preview(scenario))
                .verdict(verdict)
                .totalTime(timer.getTotalTime())
                .stepDurations(timer.getStepDurations())
                .build();

        history.addLast(record);

        // Keep only recent N adjudications
        while (history.size() > properties.getMaxQueryHistory()) {
            history.pollFirst();
        }
        log.debug("Recorded adjudication in {}s", record.totalTime());
    }

    public List<AdjudicationRecord> getHistory() {
        return List.copyOf(history);
    }

    public Map<String, Object> getStatistics() {
        List<AdjudicationRecord> records = getHistory();
        if (records.isEmpty()) {
            return Map.of("message", "No adjudications recorded yet");
        }

        List<Double> totalTimes = records.stream()
                .map(AdjudicationRecord::totalTime)
                .toList();

        Map<String, List<Double>> allSteps = new LinkedHashMap<>();
        Map<Verdict, Integer> verdicts = new EnumMap<>(Verdict.class);
        for (AdjudicationRecord record : records) {
            record.stepDurations().forEach((step, seconds) ->
                    allSteps.computeIfAbsent(step, k -> new ArrayList<>()).add(seconds));
            if (record.verdict() != null) {
                verdicts.merge(record.verdict(), 1, Integer::sum);
            }
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_adjudications", records.size());
        stats.put("avg_total_time", average(totalTimes));
        stats.put("median_total_time", median(totalTimes));
        stats.put("min_total_time", Collections.min(totalTimes));
        stats.put("max_total_time", Collections.max(totalTimes));

        Map<String, Map<String, Double>> stepStats = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : allSteps.entrySet()) {
            List<Double> times = entry.getValue();
            Map<String, Double> stepStat = new LinkedHashMap<>();
            stepStat.put("avg", average(times));
            stepStat.put("median", median(times));
            stepStat.put("min", Collections.min(times));
            stepStat.put("max", Collections.max(times));
            stepStats.put(entry.getKey(), stepStat);
        }
        stats.put("step_statistics", stepStats);
        stats.put("verdicts", verdicts);

        return stats;
    }

    private String preview(String scenario) {
        if (scenario == null) {
            return "";
        }
        return scenario.length() > MAX_SCENARIO_PREVIEW
                ? scenario.substring(0, MAX_SCENARIO_PREVIEW) + "..."
                : scenario;
    }

    private double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int size = sorted.size();
        if (size % 2 == 0) {
            return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
        }
        return sorted.get(size / 2);
    }

    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record AdjudicationRecord(
            String timestamp,
            String scenario,
            Verdict verdict,
            Double totalTime,
            Map<String, Double> stepDurations
    ) {
    }
}
