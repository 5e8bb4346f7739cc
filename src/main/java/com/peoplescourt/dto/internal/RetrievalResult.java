package com.peoplescourt.dto.internal;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RetrievalResult {

    List<Precedent> precedents;
    List<RankedHit> vectorHits;
    List<RankedHit> keywordHits;
    List<RankedHit> fusedRanking;

    public boolean hasPrecedents() {
        return precedents != null && !precedents.isEmpty();
    }

    public RetrievalDiagnostics getDiagnostics() {
        return new RetrievalDiagnostics(vectorHits, keywordHits, fusedRanking);
    }

    public static RetrievalResult empty(List<RankedHit> vectorHits,
                                        List<RankedHit> keywordHits,
                                        List<RankedHit> fusedRanking) {
        return RetrievalResult.builder()
                .precedents(List.of())
                .vectorHits(vectorHits)
                .keywordHits(keywordHits)
                .fusedRanking(fusedRanking)
                .build();
    }
}
