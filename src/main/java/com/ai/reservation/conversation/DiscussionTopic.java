package com.ai.reservation.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Current conversational focus. Always derived, see {@link TopicResolver}.
 */
public enum DiscussionTopic {
    GREETING("greeting"),
    CONFIRMING_AVAILABILITY("confirming availability"),
    CONFIRMING_DATE("confirming date"),
    CONFIRMING_TIME("confirming time"),
    CONFIRMING_PARTY_SIZE("confirming party size"),
    CONFIRMING_SPECIAL_REQUESTS("confirming special requests"),
    CONFIRMING_CONTACT_DETAILS("confirming contact details"),
    CONFIRMING_OCCASION("confirming occasion"),
    MENU_DISCUSSION("menu discussion"),
    CONFIRMATION("awaiting final confirmation"),
    CLOSING("closing the reservation"),
    ERROR_RECOVERY("resolving an issue"),
    NONE("no specific topic");

    private final String label;

    DiscussionTopic(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
