package com.peoplescourt.service.adjudication;

import com.peoplescourt.dto.internal.ConsensusDistribution;
import com.peoplescourt.dto.internal.RetrievalResult;
import com.peoplescourt.dto.response.AdjudicationEvent;
import com.peoplescourt.dto.response.AdjudicationResult;
import com.peoplescourt.dto.response.ErrorPayload;
import com.peoplescourt.exception.ConfigurationException;
import com.peoplescourt.exception.CourtException;
import com.peoplescourt.service.embedding.ScenarioEmbeddingService;
import com.peoplescourt.service.jury.JuryClassifierService;
import com.peoplescourt.service.llm.JudgeLlmService;
import com.peoplescourt.service.monitoring.AdjudicationTimer;
import com.peoplescourt.service.monitoring.PerformanceMonitorService;
import com.peoplescourt.service.retrieval.RetrievalService;
import com.peoplescourt.util.CaseContextBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs one adjudication as an ordered event stream.
 *
 * <p>Retrieval (embedding, then the corpus queries) and jury polling run
 * concurrently. When both have completed the case context is rendered and the
 * Judge's ruling is streamed back fragment by fragment, then parsed and joined
 * with the hydrated precedents. Every failure ends the stream with a single
 * error event; a final result is only ever emitted last.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdjudicationService {

    static final String STATUS_SEARCHING = "Searching for precedents...";
    static final String STATUS_POLLING = "Polling the jury...";
    static final String STATUS_DELIBERATING = "The Judge is deliberating...";
    static final String MISSING_CREDENTIAL = "Judge API key is not configured (set JUDGE_API_KEY)";

    private static final int MAX_LOGGED_SCENARIO = 50;

    private final ScenarioEmbeddingService embeddingService;
    private final RetrievalService retrievalService;
    private final JuryClassifierService juryClassifierService;
    private final JudgeLlmService judgeLlmService;
    private final CaseContextBuilder caseContextBuilder;
    private final VerdictEnricher verdictEnricher;
    private final PerformanceMonitorService performanceMonitor;

    public Flux<AdjudicationEvent> adjudicate(String scenario, int kPrecedents) {
        return Flux.defer(() -> {
            if (!judgeLlmService.hasCredential()) {
                return Flux.<AdjudicationEvent>error(new ConfigurationException(MISSING_CREDENTIAL));
            }

            log.info("Adjudicating: {}", preview(scenario));
            AdjudicationTimer timer = new AdjudicationTimer();
            timer.start();

            Mono<RetrievalResult> retrieval = timer.timed("retrieval", embeddingService.encode(scenario)
                    .flatMap(vector -> Mono.fromCallable(() -> retrievalService.retrieve(vector, scenario, kPrecedents))
                            .subscribeOn(Schedulers.boundedElastic())));
            Mono<ConsensusDistribution> consensus = timer.timed("jury", juryClassifierService.predict(scenario));

            Flux<AdjudicationEvent> ruling = Mono.zip(retrieval, consensus)
                    .flatMapMany(both -> deliberate(scenario, both.getT1(), both.getT2(), timer));

            return Flux.concat(
                    Flux.just(AdjudicationEvent.status(STATUS_SEARCHING), AdjudicationEvent.status(STATUS_POLLING)),
                    ruling);
        })
                .onErrorResume(e -> Flux.just(toErrorEvent(e)))
                .doOnCancel(() -> log.info("Adjudication cancelled by caller"));
    }

    private Flux<AdjudicationEvent> deliberate(String scenario, RetrievalResult retrieval,
                                               ConsensusDistribution consensus, AdjudicationTimer timer) {
        if (!retrieval.hasPrecedents()) {
            log.info("No precedents found; skipping deliberation");
            return Flux.just(AdjudicationEvent.error(
                    ErrorPayload.noPrecedents(consensus, retrieval.getDiagnostics())));
        }

        String caseContext = caseContextBuilder.build(scenario, consensus, retrieval.getPrecedents());
        StringBuilder rawRuling = new StringBuilder();

        Flux<AdjudicationEvent> tokens = timer.timed("deliberation", judgeLlmService.deliberate(caseContext))
                .doOnNext(rawRuling::append)
                .map(AdjudicationEvent::token);

        Mono<AdjudicationEvent> verdict = Mono.fromCallable(() -> {
            AdjudicationResult result = verdictEnricher.enrich(rawRuling.toString(), retrieval, consensus);
            timer.end();
            performanceMonitor.addAdjudication(scenario, result.getVerdict(), timer);
            log.info("Verdict {} reached in {}s citing {} precedents",
                    result.getVerdict(), timer.getTotalTime(), result.getPrecedents().size());
            return AdjudicationEvent.finalResult(result);
        });

        return Flux.concat(Mono.just(AdjudicationEvent.status(STATUS_DELIBERATING)), tokens, verdict);
    }

    private AdjudicationEvent toErrorEvent(Throwable e) {
        if (e instanceof CourtException) {
            log.error("Adjudication failed: {}", e.getMessage());
            return AdjudicationEvent.error(ErrorPayload.of(e.getMessage()));
        }
        log.error("Adjudication failed unexpectedly", e);
        return AdjudicationEvent.error(ErrorPayload.of("Adjudication failed: " + e.getMessage()));
    }

    private String preview(String scenario) {
        return scenario.length() > MAX_LOGGED_SCENARIO
                ? scenario.substring(0, MAX_LOGGED_SCENARIO) + "..."
                : scenario;
    }
}
