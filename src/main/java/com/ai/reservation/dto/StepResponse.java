package com.ai.reservation.dto;

import com.ai.reservation.conversation.DiscussionTopic;
import com.ai.reservation.conversation.WorkflowStage;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * What the HTTP client sees after a turn.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StepResponse {
    String sessionId;
    String reply;
    WorkflowStage stage;
    DiscussionTopic topic;
    boolean complete;
    String savedFilePath;
}
