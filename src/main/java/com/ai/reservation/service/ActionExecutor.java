package com.ai.reservation.service;

import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.dto.ActionResult;
import com.ai.reservation.memory.SessionState;

/**
 * Runs one action for the guest and returns its structured outcome.
 * The returned result is always of {@link ActionKind#getResultType()} for the requested kind.
 *
 * @throws ActionExecutionException when no usable result could be produced
 */
public interface ActionExecutor {

    ActionResult execute(ActionKind kind, SessionState state, String lastUserMessage);
}
