package com.peoplescourt.dto.response;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {

    STATUS("status"),
    TOKEN("token"),
    FINAL_RESULT("final_result"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == FINAL_RESULT || this == ERROR;
    }
}
