package com.peoplescourt.service.jury;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.dto.internal.ConsensusDistribution;
import com.peoplescourt.dto.internal.Verdict;
import com.peoplescourt.exception.UpstreamServiceException;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Polls the jury: a fine-tuned classifier served over HTTP that returns one
 * probability per verdict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JuryClassifierService {

    private static final ParameterizedTypeReference<Map<String, Double>> PREDICT_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final CourtProperties properties;
    private final WebClient juryWebClient;

    @CircuitBreaker(name = "jury")
    public Mono<ConsensusDistribution> predict(String scenario) {
        int timeout = properties.getJuryTimeoutSeconds();

        return juryWebClient.post()
                .uri("/predict")
                .bodyValue(Map.of("text", scenario))
                .retrieve()
                .bodyToMono(PREDICT_RESPONSE)
                .timeout(Duration.ofSeconds(timeout))
                .map(this::toDistribution)
                .switchIfEmpty(Mono.error(new UpstreamServiceException("Empty response from jury classifier")))
                .doOnNext(consensus -> log.debug("Jury consensus: {}", consensus))
                .onErrorMap(e -> !(e instanceof UpstreamServiceException), e -> e instanceof TimeoutException
                        ? new UpstreamServiceException("Jury classifier timed out after " + timeout + "s", e)
                        : new UpstreamServiceException("Jury classifier failed: " + e.getMessage(), e));
    }

    private ConsensusDistribution toDistribution(Map<String, Double> probabilities) {
        if (probabilities.isEmpty()) {
            throw new UpstreamServiceException("Jury classifier returned no probabilities");
        }

        Map<Verdict, Double> byVerdict = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : probabilities.entrySet()) {
            if (entry.getValue() == null) {
                throw new UpstreamServiceException("Jury classifier returned no probability for " + entry.getKey());
            }
            try {
                byVerdict.put(Verdict.fromLabel(entry.getKey()), entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new UpstreamServiceException("Jury classifier returned an unknown label: " + entry.getKey(), e);
            }
        }
        return ConsensusDistribution.of(byVerdict);
    }
}
