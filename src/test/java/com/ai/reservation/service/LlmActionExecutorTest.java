package com.ai.reservation.service;

import com.ai.reservation.component.PromptRenderer;
import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.conversation.AvailabilityStatus;
import com.ai.reservation.conversation.ConfirmationStatus;
import com.ai.reservation.conversation.ReservationField;
import com.ai.reservation.dto.ActionResult;
import com.ai.reservation.dto.AvailabilityResult;
import com.ai.reservation.dto.ConfirmationResult;
import com.ai.reservation.dto.DetailsCollectionResult;
import com.ai.reservation.dto.GreetingResult;
import com.ai.reservation.memory.GoalFacts;
import com.ai.reservation.memory.SessionState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmActionExecutorTest {

    private final LlmService llmService = mock(LlmService.class);
    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final LlmActionExecutor executor = new LlmActionExecutor(new PromptRenderer(), llmService, mapper);
    private final SessionState state = SessionState.create(GoalFacts.builder().guestName("Sarah Mitchell").build());

    @Test
    void executeShouldBindGreeting() {
        when(llmService.completeJson(anyString())).thenReturn("{\"reply\": \"Hello, I'd like to book a table.\"}");

        ActionResult result = executor.execute(ActionKind.GREETING, state, "");

        assertThat(result).isInstanceOf(GreetingResult.class);
        assertThat(result.getReply()).isEqualTo("Hello, I'd like to book a table.");
        verify(llmService).completeJson(contains("TASK (greeting)"));
    }

    @Test
    void executeShouldAcceptLegacyReplyFieldAndLenientEnums() {
        when(llmService.completeJson(anyString())).thenReturn("{"
                + "\"ai_response\": \"Thank you!\","
                + "\"availability_status\": \"SLOT_ACCEPTED\","
                + "\"suggested_alternatives\": [],"
                + "\"unexpected\": 42"
                + "}");

        AvailabilityResult result = (AvailabilityResult) executor.execute(ActionKind.AVAILABILITY, state, "Yes, 19:00 is free.");

        assertThat(result.getReply()).isEqualTo("Thank you!");
        assertThat(result.getAvailabilityStatus()).isEqualTo(AvailabilityStatus.SLOT_ACCEPTED);
        assertThat(result.isSpecialRequestRejected()).isFalse();
    }

    @Test
    void executeShouldBindReservationDetails() {
        when(llmService.completeJson(anyString())).thenReturn("{"
                + "\"reply\": \"Saturday at seven for two.\","
                + "\"reservation_details\": {\"date\": \"2025-06-14\", \"time\": \"19:00\", \"party_size\": 2,"
                + " \"contact_name\": null},"
                + "\"needs_menu_dialog\": true"
                + "}");

        DetailsCollectionResult result = (DetailsCollectionResult) executor.execute(ActionKind.DETAILS_COLLECTION, state, "For when?");

        assertThat(result.getReservationDetails().getDate()).isEqualTo(LocalDate.of(2025, 6, 14));
        assertThat(result.getReservationDetails().getTime()).isEqualTo(LocalTime.of(19, 0));
        assertThat(result.getReservationDetails().getPartySize()).isEqualTo(2);
        assertThat(result.getReservationDetails().getContactName()).isNull();
        assertThat(result.isNeedsMenuDialog()).isTrue();
    }

    @Test
    void executeShouldDropPartySizeOutOfRange() {
        when(llmService.completeJson(anyString())).thenReturn("{"
                + "\"reply\": \"We are a big group.\","
                + "\"reservation_details\": {\"party_size\": 40, \"occasion\": \"team dinner\"}"
                + "}");

        DetailsCollectionResult result = (DetailsCollectionResult) executor.execute(ActionKind.DETAILS_COLLECTION, state, "");

        assertThat(result.getReservationDetails().getPartySize()).isNull();
        assertThat(result.getReservationDetails().getOccasion()).isEqualTo("team dinner");
    }

    @Test
    void executeShouldBindClarificationFields() {
        when(llmService.completeJson(anyString())).thenReturn("{"
                + "\"reply\": \"My number is 600 123 456.\","
                + "\"confirmation_status\": \"needs_clarification\","
                + "\"error_message\": \"Staff asked for the phone again\","
                + "\"fields_needing_clarification\": [\"contact_phone\", \"dessert\"]"
                + "}");

        ConfirmationResult result = (ConfirmationResult) executor.execute(ActionKind.CONFIRMATION, state, "Your number?");

        assertThat(result.getConfirmationStatus()).isEqualTo(ConfirmationStatus.NEEDS_CLARIFICATION);
        assertThat(result.getFieldsNeedingClarification()).contains(ReservationField.CONTACT_PHONE);
        assertThat(result.getConfirmedReservation()).isNotNull();
    }

    @Test
    void executeShouldWrapInvalidJson() {
        when(llmService.completeJson(anyString())).thenReturn("Sure! Here you go.");

        ActionExecutionException e = catchThrowableOfType(
                () -> executor.execute(ActionKind.GREETING, state, ""), ActionExecutionException.class);

        assertThat(e).isNotNull();
        assertThat(e.getActionKind()).isEqualTo(ActionKind.GREETING);
    }

    @Test
    void executeShouldWrapTransportFailure() {
        when(llmService.completeJson(anyString())).thenThrow(new ResourceAccessException("connection refused"));

        assertThatThrownBy(() -> executor.execute(ActionKind.CONFIRMATION, state, ""))
                .isInstanceOf(ActionExecutionException.class)
                .hasMessageContaining("connection refused")
                .hasCauseInstanceOf(ResourceAccessException.class);
    }
}
