package com.peoplescourt.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.peoplescourt.dto.internal.Precedent;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HydratedCitation implements CitedPrecedent {

    @JsonUnwrapped
    Precedent precedent;

    String comparison;

    @Override
    public String getCaseId() {
        return precedent.getId();
    }

    @Override
    @JsonIgnore
    public boolean isHydrated() {
        return true;
    }
}
