package com.ai.reservation.memory;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Booking parameters the guest would like to get.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DesiredReservation {

    @Builder.Default
    LocalDate date = LocalDate.now().plusDays(1);

    @Builder.Default
    LocalTime time = LocalTime.of(19, 0);

    @Builder.Default
    int partySize = 2;

    @Builder.Default
    String occasion = "";

    @Builder.Default
    String specialRequests = "";
}
