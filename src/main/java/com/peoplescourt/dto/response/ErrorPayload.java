package com.peoplescourt.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.peoplescourt.dto.internal.ConsensusDistribution;
import com.peoplescourt.dto.internal.RetrievalDiagnostics;
import lombok.Builder;
import lombok.Value;

/**
 * Body of a terminal error event. Consensus and diagnostics are present only
 * when the run got far enough to compute them.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorPayload {

    public static final String NO_PRECEDENTS = "No relevant precedents found";

    String message;
    ConsensusDistribution consensus;
    RetrievalDiagnostics diagnostics;

    public static ErrorPayload of(String message) {
        return ErrorPayload.builder().message(message).build();
    }

    public static ErrorPayload noPrecedents(ConsensusDistribution consensus,
                                            RetrievalDiagnostics diagnostics) {
        return ErrorPayload.builder()
                .message(NO_PRECEDENTS)
                .consensus(consensus)
                .diagnostics(diagnostics)
                .build();
    }
}
