package com.peoplescourt.service.jury;

import com.peoplescourt.config.CourtProperties;
import com.peoplescourt.dto.internal.ConsensusDistribution;
import com.peoplescourt.dto.internal.Verdict;
import com.peoplescourt.exception.UpstreamServiceException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class JuryClassifierServiceTest {

    private JuryClassifierService serviceReplying(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://jury")
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
        return new JuryClassifierService(new CourtProperties(), webClient);
    }

    @Test
    void mapsLabelsToVerdictsKeepingOrder() {
        JuryClassifierService service = serviceReplying(HttpStatus.OK,
                "{\"NTA\": 0.61, \"YTA\": 0.2, \"ESH\": 0.1, \"NAH\": 0.09}");

        StepVerifier.create(service.predict("scenario"))
                .assertNext(consensus -> {
                    assertThat(consensus.asMap().keySet())
                            .containsExactly(Verdict.NTA, Verdict.YTA, Verdict.ESH, Verdict.NAH);
                    assertThat(consensus.asMap().get(Verdict.NTA)).isCloseTo(0.61, within(1e-9));
                })
                .verifyComplete();
    }

    @Test
    void probabilitiesAreNotNormalized() {
        JuryClassifierService service = serviceReplying(HttpStatus.OK, "{\"NTA\": 0.7, \"YTA\": 0.7}");

        ConsensusDistribution consensus = service.predict("scenario").block();

        assertThat(consensus.asMap().get(Verdict.NTA) + consensus.asMap().get(Verdict.YTA))
                .isCloseTo(1.4, within(1e-9));
    }

    @Test
    void unknownLabelIsAnUpstreamError() {
        JuryClassifierService service = serviceReplying(HttpStatus.OK, "{\"INFO\": 1.0}");

        StepVerifier.create(service.predict("scenario"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UpstreamServiceException.class)
                        .hasMessageContaining("INFO"))
                .verify();
    }

    @Test
    void nullProbabilityIsAnUpstreamError() {
        JuryClassifierService service = serviceReplying(HttpStatus.OK, "{\"NTA\": null, \"YTA\": 0.4}");

        StepVerifier.create(service.predict("scenario"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UpstreamServiceException.class)
                        .hasMessage("Jury classifier returned no probability for NTA"))
                .verify();
    }

    @Test
    void emptyDistributionIsAnUpstreamError() {
        StepVerifier.create(serviceReplying(HttpStatus.OK, "{}").predict("scenario"))
                .expectErrorMessage("Jury classifier returned no probabilities")
                .verify();
    }

    @Test
    void serverErrorIsAnUpstreamError() {
        StepVerifier.create(serviceReplying(HttpStatus.INTERNAL_SERVER_ERROR, "{}").predict("scenario"))
                .expectError(UpstreamServiceException.class)
                .verify();
    }
}
