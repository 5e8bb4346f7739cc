package com.peoplescourt.dto.internal;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only corpus record. Comments are attached during hydration and hold
 * at most three entries, highest score first.
 */
@Value
@Builder(toBuilder = true)
public class CaseDocument {

    String id;
    String title;
    String text;
    Verdict verdict;
    Integer score;

    @Builder.Default
    List<TopComment> comments = List.of();
}
