package com.ai.reservation.dto;

import com.ai.reservation.conversation.AvailabilityStatus;
import com.ai.reservation.conversation.ConfirmationStatus;
import com.ai.reservation.conversation.Speaker;
import com.ai.reservation.conversation.WorkflowStage;
import com.ai.reservation.memory.GoalFacts;
import com.ai.reservation.memory.MenuPreferences;
import com.ai.reservation.memory.ReservationDetails;
import com.ai.reservation.memory.SessionState;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Persisted summary of a finished negotiation. Dates are ISO strings and times are cut to minutes.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"generated_at", "guest", "restaurant", "workflow", "goal_reservation",
        "confirmed_reservation", "menu_preferences", "conversation_summary"})
public class ReservationSnapshot {

    private static final DateTimeFormatter MINUTES = DateTimeFormatter.ofPattern("HH:mm");

    String generatedAt;
    Guest guest;
    String restaurant;
    Workflow workflow;
    Reservation goalReservation;
    Reservation confirmedReservation;
    MenuPreferences menuPreferences;
    ConversationSummary conversationSummary;

    public static ReservationSnapshot from(SessionState state, Instant generatedAt) {
        GoalFacts goal = state.getGoalFacts();
        return ReservationSnapshot.builder()
                .generatedAt(generatedAt.truncatedTo(ChronoUnit.SECONDS).toString())
                .guest(new Guest(goal.getGuestName(), goal.getGuestPhone()))
                .restaurant(goal.getRestaurantName())
                .workflow(new Workflow(
                        state.getWorkflow().getStage(),
                        state.getWorkflow().getAvailabilityStatus(),
                        state.getWorkflow().getConfirmationStatus(),
                        state.getWorkflow().getSelectedSlotNote()))
                .goalReservation(Reservation.of(state.getScratchpad().getGoalReservation()))
                .confirmedReservation(Reservation.of(state.getScratchpad().getConfirmedReservation()))
                .menuPreferences(state.getScratchpad().getMenuPreferences())
                .conversationSummary(new ConversationSummary(state.getScratchpad().getTurns().stream()
                        .map(turn -> new Turn(turn.getSpeaker(), turn.getMessage()))
                        .collect(Collectors.toUnmodifiableList())))
                .build();
    }

    @Value
    public static class Guest {
        String name;
        String phone;
    }

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Workflow {
        WorkflowStage stage;
        AvailabilityStatus availabilityStatus;
        ConfirmationStatus confirmationStatus;
        String selectedSlotNote;
    }

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Reservation {
        String date;
        String time;
        Integer partySize;
        String occasion;
        String specialRequests;
        String contactName;
        String contactPhone;

        static Reservation of(ReservationDetails details) {
            LocalTime time = details.getTime();
            return new Reservation(
                    details.getDate() != null ? details.getDate().toString() : null,
                    time != null ? time.format(MINUTES) : null,
                    details.getPartySize(),
                    details.getOccasion(),
                    details.getSpecialRequests(),
                    details.getContactName(),
                    details.getContactPhone());
        }
    }

    @Value
    public static class ConversationSummary {
        List<Turn> turns;
    }

    @Value
    public static class Turn {
        Speaker speaker;
        String message;
    }
}
