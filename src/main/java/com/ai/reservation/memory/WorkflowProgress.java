package com.ai.reservation.memory;

import com.ai.reservation.conversation.AvailabilityStatus;
import com.ai.reservation.conversation.ConfirmationStatus;
import com.ai.reservation.conversation.DiscussionTopic;
import com.ai.reservation.conversation.TopicResolver;
import com.ai.reservation.conversation.WorkflowStage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Cursor of the state machine. {@code stage} is only ever changed by the transition reducer.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowProgress {

    @Builder.Default
    WorkflowStage stage = WorkflowStage.INTRO;

    @Builder.Default
    AvailabilityStatus availabilityStatus = AvailabilityStatus.UNKNOWN;

    @Builder.Default
    ConfirmationStatus confirmationStatus = ConfirmationStatus.PENDING;

    @Builder.Default
    ConfirmedFields confirmedFields = ConfirmedFields.none();

    @Builder.Default
    List<String> missingExplicitConfirmations = List.of();

    /** Sticky error token; overrides routing until a handler clears it. */
    String blockingIssue;

    String selectedSlotNote;

    String savedFilePath;

    public static WorkflowProgress initial() {
        return WorkflowProgress.builder().build();
    }

    public boolean hasBlockingIssue() {
        return blockingIssue != null && !blockingIssue.isBlank();
    }

    /**
     * Derived from blocking issue, stage and the first unconfirmed field; never stored.
     */
    public DiscussionTopic getCurrentTopic() {
        return TopicResolver.resolve(this);
    }
}
