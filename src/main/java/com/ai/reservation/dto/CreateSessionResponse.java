package com.ai.reservation.dto;

import com.ai.reservation.memory.SessionState;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateSessionResponse {
    String sessionId;
    SessionState state;
}
