package com.ai.reservation.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the restaurant answered the requested slot.
 */
public enum AvailabilityStatus {
    UNKNOWN("unknown"),
    WAITING_ON_STAFF("waiting_on_staff"),
    SLOT_ACCEPTED("slot_accepted"),
    ALTERNATIVES_OFFERED("alternatives_offered"),
    DECLINED("declined");

    private final String value;

    AvailabilityStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AvailabilityStatus fromValue(String raw) {
        return WireValues.parse(AvailabilityStatus.class, raw, AvailabilityStatus::getValue, UNKNOWN);
    }
}
