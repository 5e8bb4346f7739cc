package com.peoplescourt.dto.internal;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probability per verdict as reported by the jury classifier, in the order
 * the classifier reported them. Normalization is the classifier's concern;
 * values are kept as received.
 */
@ToString
@EqualsAndHashCode
public final class ConsensusDistribution {

    private final Map<Verdict, Double> probabilities;

    private ConsensusDistribution(Map<Verdict, Double> probabilities) {
        this.probabilities = Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
    }

    public static ConsensusDistribution of(Map<Verdict, Double> probabilities) {
        return new ConsensusDistribution(probabilities);
    }

    @JsonValue
    public Map<Verdict, Double> asMap() {
        return probabilities;
    }

    public boolean isEmpty() {
        return probabilities.isEmpty();
    }
}
