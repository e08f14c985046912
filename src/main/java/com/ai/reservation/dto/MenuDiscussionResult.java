package com.ai.reservation.dto;

import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.conversation.WorkflowStage;
import com.ai.reservation.memory.MenuPreferences;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Menu questions or highlights, plus where the conversation should go next.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class MenuDiscussionResult extends ActionResult {

    @Builder.Default
    private MenuPreferences menuPreferences = MenuPreferences.none();

    @Builder.Default
    private WorkflowStage nextStage = WorkflowStage.AWAIT_CONFIRMATION;

    @Override
    public ActionKind kind() {
        return ActionKind.MENU_DISCUSSION;
    }
}
