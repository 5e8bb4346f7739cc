package com.peoplescourt.dto.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.peoplescourt.dto.internal.ConsensusDistribution;
import com.peoplescourt.dto.internal.RankedHit;
import com.peoplescourt.dto.internal.RetrievalDiagnostics;
import com.peoplescourt.dto.internal.Verdict;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AdjudicationEventTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void statusAndTokenSerializeAsEventAndData() throws Exception {
        assertThat(objectMapper.writeValueAsString(AdjudicationEvent.status("Polling the jury...")))
                .isEqualTo("{\"event\":\"status\",\"data\":\"Polling the jury...\"}");
        assertThat(objectMapper.writeValueAsString(AdjudicationEvent.token("NTA")))
                .isEqualTo("{\"event\":\"token\",\"data\":\"NTA\"}");
    }

    @Test
    void noPrecedentsErrorCarriesConsensusAndDiagnostics() {
        ErrorPayload payload = ErrorPayload.noPrecedents(
                ConsensusDistribution.of(Map.of(Verdict.YTA, 0.55)),
                new RetrievalDiagnostics(List.of(RankedHit.of("v", 0.3)), List.of(), List.of()));

        JsonNode json = objectMapper.valueToTree(AdjudicationEvent.error(payload));

        assertThat(json.get("event").asText()).isEqualTo("error");
        assertThat(json.at("/data/message").asText()).isEqualTo("No relevant precedents found");
        assertThat(json.at("/data/consensus/YTA").asDouble()).isEqualTo(0.55);
        assertThat(json.at("/data/diagnostics/vector/0/0").asText()).isEqualTo("v");
        assertThat(json.at("/data/diagnostics/vector/0/1").asDouble()).isEqualTo(0.3);
        assertThat(json.at("/data/diagnostics/hybrid").isArray()).isTrue();
    }

    @Test
    void plainErrorOmitsAbsentFields() throws Exception {
        assertThat(objectMapper.writeValueAsString(AdjudicationEvent.error(ErrorPayload.of("boom"))))
                .isEqualTo("{\"event\":\"error\",\"data\":{\"message\":\"boom\"}}");
    }

    @Test
    void onlyFinalResultAndErrorAreTerminal() {
        assertThat(AdjudicationEvent.status("s").isTerminal()).isFalse();
        assertThat(AdjudicationEvent.token("t").isTerminal()).isFalse();
        assertThat(AdjudicationEvent.error(ErrorPayload.of("e")).isTerminal()).isTrue();
        assertThat(AdjudicationEvent.finalResult(AdjudicationResult.builder().build()).isTerminal()).isTrue();
    }
}
