package com.ai.reservation.service;

import com.ai.reservation.conversation.ActionKind;

public class ActionExecutionException extends RuntimeException {

    private final ActionKind actionKind;

    public ActionExecutionException(ActionKind actionKind, String message, Throwable cause) {
        super(message, cause);
        this.actionKind = actionKind;
    }

    public ActionKind getActionKind() {
        return actionKind;
    }
}
