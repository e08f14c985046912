package com.ai.reservation.service;

import com.ai.reservation.component.ResponsePhrases;
import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.conversation.AvailabilityStatus;
import com.ai.reservation.conversation.ConfirmationStatus;
import com.ai.reservation.conversation.ReservationField;
import com.ai.reservation.conversation.Speaker;
import com.ai.reservation.conversation.WorkflowStage;
import com.ai.reservation.dto.ActionResult;
import com.ai.reservation.dto.AlternativeResult;
import com.ai.reservation.dto.AvailabilityResult;
import com.ai.reservation.dto.ConfirmationResult;
import com.ai.reservation.dto.DetailsCollectionResult;
import com.ai.reservation.dto.GreetingResult;
import com.ai.reservation.dto.RunResult;
import com.ai.reservation.dto.SaveReservationResult;
import com.ai.reservation.dto.StepResult;
import com.ai.reservation.memory.ConversationTurn;
import com.ai.reservation.memory.DesiredReservation;
import com.ai.reservation.memory.GoalFacts;
import com.ai.reservation.memory.ReservationDetails;
import com.ai.reservation.memory.SessionState;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReservationSessionTest {

    private static final GoalFacts GOAL = GoalFacts.builder()
            .restaurantName("Atut Bistro")
            .guestName("Sarah Mitchell")
            .guestPhone("+48 600 123 456")
            .desiredReservation(DesiredReservation.builder()
                    .date(LocalDate.of(2025, 6, 14))
                    .time(LocalTime.of(19, 0))
                    .partySize(2)
                    .occasion("anniversary")
                    .specialRequests("window table")
                    .build())
            .build();

    private final List<ActionKind> executed = new ArrayList<>();
    private final List<String> lastMessages = new ArrayList<>();
    private final List<SessionState> savedStates = new ArrayList<>();

    @Test
    void stepShouldRecordStaffMessageAndReturnReply() {
        ReservationSession session = newSession(this::happyPath);
        SessionState state = session.create(GOAL);

        StepResult greeting = session.step(state, null);
        StepResult availability = session.step(greeting.getState(), "Atut Bistro, how can I help?");

        assertThat(greeting.getReply()).isEqualTo("greeting reply");
        assertThat(availability.getState().getScratchpad().getTurns())
                .extracting(ConversationTurn::getSpeaker)
                .containsExactly(Speaker.AGENT, Speaker.USER, Speaker.AGENT);
        assertThat(lastMessages).containsExactly("", "Atut Bistro, how can I help?");
        assertThat(state.getScratchpad().getTurns()).isEmpty();
    }

    @Test
    void stepShouldIgnoreBlankMessages() {
        ReservationSession session = newSession(this::happyPath);

        StepResult step = session.step(session.create(GOAL), "   ");

        assertThat(step.getState().getScratchpad().getTurns()).hasSize(1);
        assertThat(step.getState().getScratchpad().getLastUserMessage()).isNull();
    }

    @Test
    void runUntilDoneShouldReachWrapUpAndSave() {
        ReservationSession session = newSession(this::happyPath);

        RunResult run = session.runUntilDone(session.create(GOAL), 20);

        assertThat(executed).containsExactly(
                ActionKind.GREETING,
                ActionKind.AVAILABILITY,
                ActionKind.DETAILS_COLLECTION,
                ActionKind.CONFIRMATION,
                ActionKind.SAVE_RESERVATION);
        assertThat(run.getReplies()).hasSize(5);
        assertThat(run.getState().getWorkflow().getStage()).isEqualTo(WorkflowStage.WRAP_UP);
        assertThat(run.getState().getWorkflow().getSavedFilePath()).isEqualTo("memory://1");
        assertThat(session.isComplete(run.getState())).isTrue();
        assertThat(savedStates).hasSize(1);
    }

    @Test
    void runUntilDoneShouldStopAtStepCap() {
        ReservationSession session = newSession(this::happyPath);

        RunResult run = session.runUntilDone(session.create(GOAL), 2);

        assertThat(run.getReplies()).hasSize(2);
        assertThat(run.getState().getWorkflow().getStage()).isEqualTo(WorkflowStage.PROVIDE_CONTACT);
        assertThat(session.isComplete(run.getState())).isFalse();
    }

    @Test
    void stepOnCompletedSessionShouldNotCallExecutor() {
        ReservationSession session = newSession(this::happyPath);
        SessionState done = session.runUntilDone(session.create(GOAL), 20).getState();
        executed.clear();

        StepResult step = session.step(done, "Anything else?");

        assertThat(executed).isEmpty();
        assertThat(step.getReply()).isEqualTo(new ResponsePhrases().reservationAlreadyFinished());
        assertThat(step.getState().getScratchpad().getLastUserMessage()).isEqualTo("Anything else?");
    }

    @Test
    void stepShouldPropagateExecutorFailure() {
        ReservationSession session = newSession((kind, state) -> {
            throw new ActionExecutionException(kind, "model unavailable", null);
        });
        SessionState state = session.create(GOAL);

        assertThatThrownBy(() -> session.step(state, "Hello"))
                .isInstanceOf(ActionExecutionException.class)
                .hasMessage("model unavailable");
        assertThat(state.getScratchpad().getTurns()).isEmpty();
    }

    @Test
    void stageShouldOnlyMoveBackThroughAlternativesAndClarification() {
        ReservationSession session = newSession(new DetourScript());
        List<SessionState> states = new ArrayList<>();
        SessionState state = session.create(GOAL);
        states.add(state);
        for (int turn = 0; turn < 20 && !session.isComplete(state); turn++) {
            state = session.step(state, "staff line " + turn).getState();
            states.add(state);
        }

        assertThat(executed).containsExactly(
                ActionKind.GREETING,
                ActionKind.AVAILABILITY,
                ActionKind.ALTERNATIVE,
                ActionKind.AVAILABILITY,
                ActionKind.DETAILS_COLLECTION,
                ActionKind.CONFIRMATION,
                ActionKind.DETAILS_COLLECTION,
                ActionKind.CONFIRMATION,
                ActionKind.SAVE_RESERVATION);
        assertThat(state.getWorkflow().getStage()).isEqualTo(WorkflowStage.WRAP_UP);
        assertThat(savedStates).hasSize(1);

        List<String> backwardMoves = new ArrayList<>();
        for (int i = 1; i < states.size(); i++) {
            WorkflowStage before = states.get(i - 1).getWorkflow().getStage();
            WorkflowStage after = states.get(i).getWorkflow().getStage();
            if (after.ordinal() < before.ordinal()) {
                backwardMoves.add(before.getValue() + "->" + after.getValue());
            }
            for (ReservationField field : ReservationField.values()) {
                boolean wasConfirmed = states.get(i - 1).getWorkflow().getConfirmedFields().isConfirmed(field);
                boolean isConfirmed = states.get(i).getWorkflow().getConfirmedFields().isConfirmed(field);
                if (wasConfirmed && !isConfirmed) {
                    assertThat(states.get(i).getWorkflow().getConfirmationStatus())
                            .as("%s unconfirmed at step %d", field, i)
                            .isEqualTo(ConfirmationStatus.NEEDS_CLARIFICATION);
                }
            }
        }
        assertThat(backwardMoves).containsExactly(
                "review_alternatives->await_availability",
                "await_confirmation->provide_contact");
    }

    private ActionResult happyPath(ActionKind kind, SessionState state) {
        switch (kind) {
            case GREETING:
                return GreetingResult.builder().reply("greeting reply").build();
            case AVAILABILITY:
                return AvailabilityResult.builder()
                        .reply("Saturday at seven works, thank you.")
                        .availabilityStatus(AvailabilityStatus.SLOT_ACCEPTED)
                        .build();
            case DETAILS_COLLECTION:
                return DetailsCollectionResult.builder()
                        .reply("We are two, it's our anniversary and we'd love a window table.")
                        .reservationDetails(ReservationDetails.builder()
                                .partySize(2)
                                .occasion("anniversary")
                                .specialRequests("window table")
                                .build())
                        .build();
            case CONFIRMATION:
                return ConfirmationResult.builder()
                        .reply("Perfect, thank you!")
                        .confirmationStatus(ConfirmationStatus.CONFIRMED_BY_STAFF)
                        .confirmedReservation(state.getScratchpad().getGoalReservation())
                        .build();
            case SAVE_RESERVATION:
                return SaveReservationResult.builder().reply("See you on Saturday!").build();
            default:
                throw new IllegalStateException("unexpected action " + kind);
        }
    }

    private ReservationSession newSession(Script script) {
        ActionExecutor executor = (kind, state, lastUserMessage) -> {
            executed.add(kind);
            lastMessages.add(lastUserMessage);
            return script.next(kind, state);
        };
        TransitionReducer reducer = new TransitionReducer(state -> {
            savedStates.add(state);
            return "memory://" + savedStates.size();
        }, new ClarificationFieldDetector());
        return new ReservationSession(new ReservationCoordinator(), executor, reducer, new ResponsePhrases());
    }

    private class DetourScript implements Script {
        private int availabilityCalls;
        private int confirmationCalls;

        @Override
        public ActionResult next(ActionKind kind, SessionState state) {
            switch (kind) {
                case AVAILABILITY:
                    if (availabilityCalls++ == 0) {
                        return AvailabilityResult.builder()
                                .reply("Could 20:30 or Sunday work instead?")
                                .availabilityStatus(AvailabilityStatus.ALTERNATIVES_OFFERED)
                                .suggestedAlternatives(List.of("Saturday 20:30", "Sunday 19:00"))
                                .build();
                    }
                    return happyPath(kind, state);
                case ALTERNATIVE:
                    return AlternativeResult.builder()
                            .reply("Those don't suit us, is anything closer to seven possible?")
                            .alternativeSelected(false)
                            .build();
                case CONFIRMATION:
                    if (confirmationCalls++ == 0) {
                        return ConfirmationResult.builder()
                                .reply("Of course, it's +48 600 123 456.")
                                .confirmationStatus(ConfirmationStatus.NEEDS_CLARIFICATION)
                                .errorMessage("Could you repeat your phone number?")
                                .build();
                    }
                    return happyPath(kind, state);
                default:
                    return happyPath(kind, state);
            }
        }
    }

    @FunctionalInterface
    private interface Script {
        ActionResult next(ActionKind kind, SessionState state);
    }
}
