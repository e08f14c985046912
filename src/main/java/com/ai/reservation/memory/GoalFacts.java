package com.ai.reservation.memory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Long-term knowledge the guest relies on. Set once when the session is created and
 * never touched by the reducer.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GoalFacts {

    @Builder.Default
    String restaurantName = "";

    @Builder.Default
    String guestName = "";

    @Builder.Default
    String guestPhone = "";

    @Builder.Default
    String celebrationReason = "";

    @Builder.Default
    List<String> favoriteDishes = List.of();

    @Builder.Default
    String dietaryNotes = "";

    @Builder.Default
    List<String> talkingPoints = List.of();

    @Builder.Default
    DesiredReservation desiredReservation = DesiredReservation.builder().build();

    @Builder.Default
    List<String> fallbackSlots = List.of();
}
