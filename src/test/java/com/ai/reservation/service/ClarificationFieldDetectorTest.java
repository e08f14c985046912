package com.ai.reservation.service;

import com.ai.reservation.conversation.ReservationField;
import com.ai.reservation.dto.ConfirmationResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClarificationFieldDetectorTest {

    private final ClarificationFieldDetector detector = new ClarificationFieldDetector();

    @Test
    void mentionedInShouldMatchKeywordsIgnoringCase() {
        assertThat(detector.mentionedIn("Which DATE and TIME did you say?"))
                .containsExactlyInAnyOrder(ReservationField.DATE, ReservationField.TIME);
        assertThat(detector.mentionedIn("Can I get a telephone number under your name?"))
                .containsExactlyInAnyOrder(ReservationField.CONTACT_PHONE, ReservationField.CONTACT_NAME);
    }

    @Test
    void mentionedInShouldIgnoreOtherFields() {
        assertThat(detector.mentionedIn("How many people are coming?")).isEmpty();
        assertThat(detector.mentionedIn(null)).isEmpty();
        assertThat(detector.mentionedIn("  ")).isEmpty();
    }

    @Test
    void fieldsToReconfirmShouldPreferExplicitList() {
        ConfirmationResult result = ConfirmationResult.builder()
                .errorMessage("Sorry, what date was it?")
                .fieldsNeedingClarification(List.of(ReservationField.SPECIAL_REQUESTS))
                .build();

        assertThat(detector.fieldsToReconfirm(result)).containsExactly(ReservationField.SPECIAL_REQUESTS);
    }

    @Test
    void fieldsToReconfirmShouldFallBackToKeywordsWhenListHasNoKnownFields() {
        ConfirmationResult result = ConfirmationResult.builder()
                .errorMessage("Sorry, what date was it?")
                .fieldsNeedingClarification(Arrays.asList((ReservationField) null))
                .build();

        assertThat(detector.fieldsToReconfirm(result)).containsExactly(ReservationField.DATE);
    }
}
