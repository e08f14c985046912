package com.ai.reservation.component;

import org.springframework.stereotype.Component;

@Component
public class ResponsePhrases {

    public String reservationAlreadyFinished() {
        return "The reservation has already been completed.";
    }

    public String consoleBanner(String restaurantName) {
        return "=== Guest booking a table at " + restaurantName + " ===";
    }

    public String consoleInstructions() {
        return "Reply as the restaurant staff. Type a message and press Enter (quit to finish).";
    }

    public String conversationFinished() {
        return "Conversation finished.";
    }

    public String goodbye() {
        return "Ending the conversation. See you!";
    }

    public String turnFailed(String reason) {
        return "The guest could not answer this time (" + reason + "). Try again.";
    }
}
