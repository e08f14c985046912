package com.ai.reservation.dto;

import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.conversation.AvailabilityStatus;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * How staff responded to the requested slot.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class AvailabilityResult extends ActionResult {

    @Builder.Default
    private AvailabilityStatus availabilityStatus = AvailabilityStatus.UNKNOWN;

    @Builder.Default
    private List<String> suggestedAlternatives = new ArrayList<>();

    private String selectedSlotNote;

    @Builder.Default
    private List<String> pendingQuestions = new ArrayList<>();

    /** Staff refused the special request outright; the booking cannot go ahead. */
    private boolean specialRequestRejected;

    @Override
    public ActionKind kind() {
        return ActionKind.AVAILABILITY;
    }
}
