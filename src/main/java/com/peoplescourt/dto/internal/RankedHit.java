package com.peoplescourt.dto.internal;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A document id and its score within one ranking. Scores from different
 * rankings (cosine, BM25, fused) are not comparable. Serialized as
 * {@code [id, score]}.
 */
@Value
@AllArgsConstructor(staticName = "of")
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"id", "score"})
public class RankedHit {

    String id;
    double score;
}
