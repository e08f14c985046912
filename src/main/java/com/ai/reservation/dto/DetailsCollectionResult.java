package com.ai.reservation.dto;

import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.memory.ReservationDetails;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Booking details staff acknowledged in this turn.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class DetailsCollectionResult extends ActionResult {

    @Builder.Default
    private ReservationDetails reservationDetails = ReservationDetails.empty();

    private boolean needsMenuDialog;

    @Override
    public ActionKind kind() {
        return ActionKind.DETAILS_COLLECTION;
    }
}
