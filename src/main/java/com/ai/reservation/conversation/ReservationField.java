package com.ai.reservation.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Negotiable booking attributes that staff must explicitly acknowledge.
 */
public enum ReservationField {
    DATE("date"),
    TIME("time"),
    PARTY_SIZE("party_size"),
    OCCASION("occasion"),
    SPECIAL_REQUESTS("special_requests"),
    CONTACT_NAME("contact_name"),
    CONTACT_PHONE("contact_phone");

    /** Order in which the guest offers (and re-offers) details during the contact phase. */
    public static final List<ReservationField> ASK_ORDER = List.of(
            PARTY_SIZE, CONTACT_NAME, CONTACT_PHONE, OCCASION, SPECIAL_REQUESTS, DATE, TIME);

    /** Fields a staff confirmation must actually carry before the booking is considered final. */
    public static final List<ReservationField> FINAL_CHECK = List.of(
            DATE, TIME, PARTY_SIZE, SPECIAL_REQUESTS);

    private final String value;

    ReservationField(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ReservationField fromValue(String raw) {
        return WireValues.parse(ReservationField.class, raw, ReservationField::getValue, null);
    }
}
