package com.ai.reservation.memory;

import lombok.Value;

/**
 * Slot suggested by staff when the requested one is not available.
 */
@Value
public class AlternativeOption {
    String description;
    String notes;
    boolean accepted;

    public static AlternativeOption proposed(String description) {
        return new AlternativeOption(description, null, false);
    }

    public static AlternativeOption acceptedByGuest(String description) {
        return new AlternativeOption(description, "accepted by guest", true);
    }
}
