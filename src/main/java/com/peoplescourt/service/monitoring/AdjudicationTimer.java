package com.peoplescourt.service.monitoring;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage timings for one adjudication. Retrieval and jury polling run
 * concurrently, so stages are recorded as their own elapsed spans rather than
 * as marks on a single timeline.
 */
public class AdjudicationTimer {

    private Long startTime;
    private Long endTime;

    private final Map<String, Long> durations = new LinkedHashMap<>();

    public synchronized void start() {
        this.startTime = System.currentTimeMillis();
        this.endTime = null;
        this.durations.clear();
    }

    public synchronized void end() {
        this.endTime = System.currentTimeMillis();
    }

    public synchronized void record(String stepName, long elapsedMillis) {
        durations.put(stepName, elapsedMillis);
    }

    public <T> Mono<T> timed(String stepName, Mono<T> step) {
        return Mono.defer(() -> {
            long begin = System.currentTimeMillis();
            return step.doOnSuccess(value -> record(stepName, System.currentTimeMillis() - begin));
        });
    }

    public <T> Flux<T> timed(String stepName, Flux<T> step) {
        return Flux.defer(() -> {
            long begin = System.currentTimeMillis();
            return step.doOnComplete(() -> record(stepName, System.currentTimeMillis() - begin));
        });
    }

    public synchronized double getTotalTime() {
        if (startTime == null || endTime == null) {
            return 0.0;
        }
        return (endTime - startTime) / 1000.0;
    }

    public synchronized Map<String, Double> getStepDurations() {
        Map<String, Double> seconds = new LinkedHashMap<>();
        durations.forEach((step, millis) -> seconds.put(step, millis / 1000.0));
        return seconds;
    }
}
