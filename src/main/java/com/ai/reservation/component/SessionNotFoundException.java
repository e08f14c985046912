package com.ai.reservation.component;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("No reservation session with id " + sessionId);
    }
}
