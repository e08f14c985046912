package com.ai.reservation.dto;

import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.conversation.ConfirmationStatus;
import com.ai.reservation.conversation.ReservationField;
import com.ai.reservation.memory.ReservationDetails;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of the staff's final confirmation.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class ConfirmationResult extends ActionResult {

    @Builder.Default
    private ConfirmationStatus confirmationStatus = ConfirmationStatus.PENDING;

    private String bookingReference;

    private String errorMessage;

    @Builder.Default
    private ReservationDetails confirmedReservation = ReservationDetails.empty();

    /**
     * Fields staff asked to clarify. When empty the reducer falls back to scanning
     * {@link #errorMessage} for field keywords.
     */
    @Builder.Default
    private List<ReservationField> fieldsNeedingClarification = new ArrayList<>();

    @Override
    public ActionKind kind() {
        return ActionKind.CONFIRMATION;
    }
}
