package com.peoplescourt.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A citation whose case id is not among the hydrated precedents. Rendered
 * exactly as the Judge produced it.
 */
@Value
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UnresolvedCitation implements CitedPrecedent {

    String caseId;
    String comparison;

    @Override
    @JsonIgnore
    public boolean isHydrated() {
        return false;
    }
}
