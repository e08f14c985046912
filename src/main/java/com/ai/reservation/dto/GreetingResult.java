package com.ai.reservation.dto;

import com.ai.reservation.conversation.ActionKind;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Greeting needs no structure beyond the reply.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class GreetingResult extends ActionResult {

    @Override
    public ActionKind kind() {
        return ActionKind.GREETING;
    }
}
