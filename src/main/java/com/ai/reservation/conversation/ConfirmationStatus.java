package com.ai.reservation.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * State of the staff's confirmation attempt.
 */
public enum ConfirmationStatus {
    PENDING("pending"),
    CONFIRMED_BY_STAFF("confirmed_by_staff"),
    NEEDS_CLARIFICATION("needs_clarification");

    private final String value;

    ConfirmationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConfirmationStatus fromValue(String raw) {
        return WireValues.parse(ConfirmationStatus.class, raw, ConfirmationStatus::getValue, PENDING);
    }
}
