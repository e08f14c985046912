package com.ai.reservation.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of the optional menu detour.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class MenuPreferences {

    @JsonProperty("requested")
    boolean requested;

    @JsonProperty("highlights")
    @Builder.Default
    List<String> highlights = List.of();

    @JsonProperty("dietary_notes")
    String dietaryNotes;

    public static MenuPreferences none() {
        return MenuPreferences.builder().build();
    }
}
