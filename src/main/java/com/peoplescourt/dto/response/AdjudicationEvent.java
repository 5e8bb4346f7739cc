package com.peoplescourt.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One entry of the adjudication event stream, serialized as
 * {@code {"event": ..., "data": ...}}. A stream carries any number of status
 * and token events followed by exactly one final_result or error.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AdjudicationEvent {

    EventType event;
    Object data;

    public static AdjudicationEvent status(String message) {
        return new AdjudicationEvent(EventType.STATUS, message);
    }

    public static AdjudicationEvent token(String fragment) {
        return new AdjudicationEvent(EventType.TOKEN, fragment);
    }

    public static AdjudicationEvent finalResult(AdjudicationResult result) {
        return new AdjudicationEvent(EventType.FINAL_RESULT, result);
    }

    public static AdjudicationEvent error(ErrorPayload payload) {
        return new AdjudicationEvent(EventType.ERROR, payload);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return event.isTerminal();
    }
}
