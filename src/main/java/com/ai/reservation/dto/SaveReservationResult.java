package com.ai.reservation.dto;

import com.ai.reservation.conversation.ActionKind;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Closing acknowledgement before the booking is stored.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class SaveReservationResult extends ActionResult {

    private boolean followUpNeeded;

    @Override
    public ActionKind kind() {
        return ActionKind.SAVE_RESERVATION;
    }
}
