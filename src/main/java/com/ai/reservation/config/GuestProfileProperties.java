package com.ai.reservation.config;

import com.ai.reservation.memory.DesiredReservation;
import com.ai.reservation.memory.GoalFacts;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Default guest profile used when a session is started without explicit goal facts.
 * Date and time are ISO strings; a blank date means tomorrow.
 */
@Data
@ConfigurationProperties(prefix = "reservation.guest")
public class GuestProfileProperties {

    private String restaurantName = "";
    private String name = "";
    private String phone = "";
    private String celebrationReason = "";
    private List<String> favoriteDishes = new ArrayList<>();
    private String dietaryNotes = "";
    private List<String> talkingPoints = new ArrayList<>();
    private String desiredDate;
    private String desiredTime = "19:00";
    private int partySize = 2;
    private String occasion = "";
    private String specialRequests = "";
    private List<String> fallbackSlots = new ArrayList<>();

    public GoalFacts toGoalFacts() {
        DesiredReservation desired = DesiredReservation.builder()
                .date(StringUtils.isBlank(desiredDate) ? LocalDate.now().plusDays(1) : LocalDate.parse(desiredDate.trim()))
                .time(LocalTime.parse(StringUtils.defaultIfBlank(desiredTime, "19:00").trim()))
                .partySize(partySize)
                .occasion(StringUtils.defaultString(occasion))
                .specialRequests(StringUtils.defaultString(specialRequests))
                .build();
        return GoalFacts.builder()
                .restaurantName(StringUtils.defaultString(restaurantName))
                .guestName(StringUtils.defaultString(name))
                .guestPhone(StringUtils.defaultString(phone))
                .celebrationReason(StringUtils.defaultString(celebrationReason))
                .favoriteDishes(List.copyOf(favoriteDishes))
                .dietaryNotes(StringUtils.defaultString(dietaryNotes))
                .talkingPoints(List.copyOf(talkingPoints))
                .desiredReservation(desired)
                .fallbackSlots(List.copyOf(fallbackSlots))
                .build();
    }
}
