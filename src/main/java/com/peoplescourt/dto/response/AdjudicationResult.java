package com.peoplescourt.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.peoplescourt.dto.internal.ConsensusDistribution;
import com.peoplescourt.dto.internal.RetrievalDiagnostics;
import com.peoplescourt.dto.internal.Verdict;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AdjudicationResult {

    // ================= RULING =================
    Verdict verdict;

    String openingStatement;

    String facts;

    List<CitedPrecedent> precedents;

    String deliberation;

    // ================= SUPPORTING EVIDENCE =================
    ConsensusDistribution consensus;

    /**
     * Raw rank lists behind the precedents: vector, keyword and hybrid.
     */
    RetrievalDiagnostics diagnostics;
}
