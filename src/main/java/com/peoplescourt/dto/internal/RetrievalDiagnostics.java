package com.peoplescourt.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor
public class RetrievalDiagnostics {

    List<RankedHit> vector;
    List<RankedHit> keyword;
    List<RankedHit> hybrid;
}
