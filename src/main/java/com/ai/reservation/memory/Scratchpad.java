package com.ai.reservation.memory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Short-term working memory of the dialogue.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Scratchpad {

    @Builder.Default
    List<ConversationTurn> turns = List.of();

    String lastUserMessage;

    String lastAgentMessage;

    /** Goal facts as they were when the session started. */
    @Builder.Default
    ReservationDetails goalReservation = ReservationDetails.empty();

    /** What staff explicitly agreed to so far. */
    @Builder.Default
    ReservationDetails confirmedReservation = ReservationDetails.empty();

    @Builder.Default
    MenuPreferences menuPreferences = MenuPreferences.none();

    @Builder.Default
    List<AlternativeOption> proposedAlternatives = List.of();

    @Builder.Default
    List<String> pendingQuestions = List.of();
}
