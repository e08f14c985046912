package com.ai.reservation.dto;

import com.ai.reservation.conversation.ActionKind;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Structured outcome of one executed action. Every shape carries the reply the guest says
 * out loud; subclasses add the fields the transition reducer needs.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public abstract class ActionResult {

    @JsonAlias("ai_response")
    private String reply;

    public abstract ActionKind kind();
}
