package com.ai.reservation.memory;

import com.ai.reservation.conversation.Speaker;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the memory tree for one negotiation. Immutable: every transition returns a new
 * instance and earlier snapshots stay valid.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionState {

    @Builder.Default
    Identity identity = Identity.defaults();

    @Builder.Default
    GoalFacts goalFacts = GoalFacts.builder().build();

    @Builder.Default
    EpisodicLog episodicLog = EpisodicLog.empty();

    @Builder.Default
    WorkflowProgress workflow = WorkflowProgress.initial();

    @Builder.Default
    Scratchpad scratchpad = Scratchpad.builder().build();

    public static SessionState create(GoalFacts goalFacts) {
        return create(Identity.defaults(), goalFacts);
    }

    /**
     * Fresh session whose goal reservation is copied from the goal facts.
     */
    public static SessionState create(Identity identity, GoalFacts goalFacts) {
        DesiredReservation desired = goalFacts.getDesiredReservation();
        ReservationDetails goal = ReservationDetails.builder()
                .date(desired.getDate())
                .time(desired.getTime())
                .partySize(desired.getPartySize())
                .occasion(desired.getOccasion())
                .specialRequests(desired.getSpecialRequests())
                .contactName(goalFacts.getGuestName())
                .contactPhone(goalFacts.getGuestPhone())
                .build();
        return SessionState.builder()
                .identity(identity)
                .goalFacts(goalFacts)
                .scratchpad(Scratchpad.builder().goalReservation(goal).build())
                .build();
    }

    /**
     * Returns a new state with one more transcript entry. No deduplication.
     */
    public SessionState appendTurn(Speaker speaker, String message) {
        List<ConversationTurn> turns = new ArrayList<>(scratchpad.getTurns());
        turns.add(new ConversationTurn(speaker, message));
        Scratchpad.ScratchpadBuilder pad = scratchpad.toBuilder().turns(List.copyOf(turns));
        if (speaker == Speaker.USER) {
            pad.lastUserMessage(message);
        } else {
            pad.lastAgentMessage(message);
        }
        return toBuilder().scratchpad(pad.build()).build();
    }

    public SessionState recordEvent(String event) {
        return toBuilder().episodicLog(episodicLog.record(event)).build();
    }
}
