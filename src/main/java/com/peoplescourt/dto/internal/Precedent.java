package com.peoplescourt.dto.internal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A hydrated case enriched with its fused rank score. Lives only for the
 * duration of one adjudication.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Precedent {

    String id;
    String title;
    String text;
    Verdict verdict;
    Integer score;
    double relevanceScore;
    List<TopComment> comments;

    public static Precedent from(CaseDocument document, double relevanceScore) {
        return Precedent.builder()
                .id(document.getId())
                .title(document.getTitle())
                .text(document.getText())
                .verdict(document.getVerdict())
                .score(document.getScore())
                .relevanceScore(relevanceScore)
                .comments(document.getComments())
                .build();
    }
}
