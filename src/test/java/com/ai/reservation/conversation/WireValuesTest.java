package com.ai.reservation.conversation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WireValuesTest {

    @Test
    void fromValueShouldAcceptWireValueOrConstantName() {
        assertThat(AvailabilityStatus.fromValue("slot_accepted")).isEqualTo(AvailabilityStatus.SLOT_ACCEPTED);
        assertThat(AvailabilityStatus.fromValue("SLOT_ACCEPTED")).isEqualTo(AvailabilityStatus.SLOT_ACCEPTED);
        assertThat(AvailabilityStatus.fromValue("Waiting on staff")).isEqualTo(AvailabilityStatus.WAITING_ON_STAFF);
        assertThat(WorkflowStage.fromValue("await-confirmation")).isEqualTo(WorkflowStage.AWAIT_CONFIRMATION);
    }

    @Test
    void fromValueShouldFallBackForUnknownText() {
        assertThat(AvailabilityStatus.fromValue("maybe later")).isEqualTo(AvailabilityStatus.UNKNOWN);
        assertThat(ConfirmationStatus.fromValue("")).isEqualTo(ConfirmationStatus.PENDING);
        assertThat(ReservationField.fromValue("dessert")).isNull();
        assertThat(WorkflowStage.fromValue(null)).isNull();
    }
}
