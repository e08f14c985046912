package com.ai.reservation.conversation;

import com.ai.reservation.dto.ActionResult;
import com.ai.reservation.dto.AlternativeResult;
import com.ai.reservation.dto.AvailabilityResult;
import com.ai.reservation.dto.ConfirmationResult;
import com.ai.reservation.dto.DetailsCollectionResult;
import com.ai.reservation.dto.ErrorRecoveryResult;
import com.ai.reservation.dto.GreetingResult;
import com.ai.reservation.dto.MenuDiscussionResult;
import com.ai.reservation.dto.SaveReservationResult;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Capabilities the coordinator can pick for a turn. Each one has a fixed result shape.
 */
public enum ActionKind {
    GREETING("greeting",
            "Greet the staff and state the intent to book a table.",
            GreetingResult.class),
    AVAILABILITY("availability",
            "Share desired slot details and interpret staff availability responses.",
            AvailabilityResult.class),
    DETAILS_COLLECTION("details",
            "Provide the guest's booking metadata and confirm next steps.",
            DetailsCollectionResult.class),
    MENU_DISCUSSION("menu",
            "Ask the staff follow-up questions about the menu.",
            MenuDiscussionResult.class),
    CONFIRMATION("confirmation",
            "Interpret the staff's final answer and react as the guest.",
            ConfirmationResult.class),
    ALTERNATIVE("alternative",
            "Evaluate and respond to alternative slots suggested by the staff.",
            AlternativeResult.class),
    ERROR_RECOVERY("error_recovery",
            "Recover from booking errors and restart the request if needed.",
            ErrorRecoveryResult.class),
    SAVE_RESERVATION("save_reservation",
            "Thank the staff, restate the booking and close once the details are stored.",
            SaveReservationResult.class);

    private final String value;
    private final String description;
    private final Class<? extends ActionResult> resultType;

    ActionKind(String value, String description, Class<? extends ActionResult> resultType) {
        this.value = value;
        this.description = description;
        this.resultType = resultType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public Class<? extends ActionResult> getResultType() {
        return resultType;
    }
}
