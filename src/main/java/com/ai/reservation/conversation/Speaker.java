package com.ai.reservation.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Transcript speaker tag. USER is the restaurant staff on the other end, AGENT is the guest persona.
 */
public enum Speaker {
    USER("user"),
    AGENT("agent");

    private final String value;

    Speaker(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
