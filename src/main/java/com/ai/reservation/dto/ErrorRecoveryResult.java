package com.ai.reservation.dto;

import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.conversation.WorkflowStage;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Points the state machine back to a safe stage after a blocking issue.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class ErrorRecoveryResult extends ActionResult {

    @Builder.Default
    private WorkflowStage resetStage = WorkflowStage.SHARE_PREFERENCES;

    @Override
    public ActionKind kind() {
        return ActionKind.ERROR_RECOVERY;
    }
}
