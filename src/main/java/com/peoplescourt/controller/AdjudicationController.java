package com.peoplescourt.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.dto.request.AdjudicateRequest;
import com.peoplescourt.dto.response.AdjudicationEvent;
import com.peoplescourt.dto.response.EventType;
import com.peoplescourt.service.adjudication.AdjudicationService;
import com.peoplescourt.service.llm.JudgeLlmService;
import com.peoplescourt.service.monitoring.PerformanceMonitorService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AdjudicationController {

    static final String NO_FINAL_RESULT = "Adjudication complete but no final result generated";

    private final AdjudicationService adjudicationService;
    private final JudgeLlmService judgeLlmService;
    private final PerformanceMonitorService performanceMonitor;
    private final CourtProperties properties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "People's Court API");
        health.put("judge_configured", judgeLlmService.hasCredential());
        return ResponseEntity.ok(health);
    }

    /**
     * Blocks until the run ends and returns only the final result. Status and
     * token events are discarded.
     */
    @PostMapping("/adjudicate")
    public Mono<ResponseEntity<Object>> adjudicate(@Valid @RequestBody AdjudicateRequest request) {
        log.info("Received adjudication request");

        return adjudicationService.adjudicate(request.getScenario(), precedentsFor(request))
                .filter(AdjudicationEvent::isTerminal)
                .next()
                .<ResponseEntity<Object>>map(event -> event.getEvent() == EventType.FINAL_RESULT
                        ? ResponseEntity.ok(event.getData())
                        : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(event.getData()))
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("message", NO_FINAL_RESULT)));
    }

    @PostMapping(value = "/adjudicate/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<AdjudicationEvent>> adjudicateStream(@Valid @RequestBody AdjudicateRequest request) {
        log.info("Received streaming adjudication request");

        return adjudicationService.adjudicate(request.getScenario(), precedentsFor(request))
                .map(event -> ServerSentEvent.<AdjudicationEvent>builder()
                        .event(event.getEvent().getWireName())
                        .data(event)
                        .build());
    }

    // ===== PERFORMANCE MONITORING =====

    @GetMapping("/performance/stats")
    public ResponseEntity<Map<String, Object>> performanceStats() {
        log.debug("Performance stats requested");
        return ResponseEntity.ok(performanceMonitor.getStatistics());
    }

    @GetMapping("/performance/history")
    public ResponseEntity<Map<String, Object>> performanceHistory() {
        List<PerformanceMonitorService.AdjudicationRecord> history = performanceMonitor.getHistory();
        return ResponseEntity.ok(Map.of("total_adjudications", history.size(), "history", history));
    }

    private int precedentsFor(AdjudicateRequest request) {
        return request.getKPrecedents() != null
                ? request.getKPrecedents()
                : properties.getDefaultPrecedents();
    }
}
