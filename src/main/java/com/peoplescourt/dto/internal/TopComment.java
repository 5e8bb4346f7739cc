package com.peoplescourt.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class TopComment {

    String author;
    String body;
    Integer score;
}
