package com.ai.reservation.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stages of the reservation flow, seen from the guest's side of the call.
 * WRAP_UP and END are terminal.
 */
public enum WorkflowStage {
    INTRO("intro"),
    SHARE_PREFERENCES("share_preferences"),
    AWAIT_AVAILABILITY("await_availability"),
    REVIEW_ALTERNATIVES("review_alternatives"),
    PROVIDE_CONTACT("provide_contact"),
    MENU_DISCUSSION("menu_discussion"),
    AWAIT_CONFIRMATION("await_confirmation"),
    SAVE_DATA("save_data"),
    WRAP_UP("wrap_up"),
    END("end");

    private final String value;

    WorkflowStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == WRAP_UP || this == END;
    }

    @JsonCreator
    public static WorkflowStage fromValue(String raw) {
        return WireValues.parse(WorkflowStage.class, raw, WorkflowStage::getValue, null);
    }
}
