package com.ai.reservation.dto;

import com.ai.reservation.conversation.ActionKind;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Guest's verdict on the alternative slots staff offered.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class AlternativeResult extends ActionResult {

    private boolean alternativeSelected;

    private String acceptedSlotDescription;

    private boolean shouldEndConversation;

    @Override
    public ActionKind kind() {
        return ActionKind.ALTERNATIVE;
    }
}
