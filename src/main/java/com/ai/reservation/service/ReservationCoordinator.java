package com.ai.reservation.service;

import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.conversation.ConfirmationStatus;
import com.ai.reservation.conversation.WorkflowStage;
import com.ai.reservation.memory.SessionState;
import com.ai.reservation.memory.WorkflowProgress;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Deterministic router: picks the next action for a session, or none once the flow is terminal.
 * Never returns empty for a non-terminal stage, so the loop cannot stall.
 */
@Service
public class ReservationCoordinator {

    public Optional<ActionKind> selectAction(SessionState state) {
        WorkflowProgress workflow = state.getWorkflow();
        WorkflowStage stage = workflow.getStage();

        if (stage != null && stage.isTerminal()) {
            return Optional.empty();
        }
        if (workflow.hasBlockingIssue()) {
            return Optional.of(ActionKind.ERROR_RECOVERY);
        }
        return Optional.of(forStage(stage, workflow.getConfirmationStatus()));
    }

    public boolean isComplete(SessionState state) {
        return selectAction(state).isEmpty();
    }

    private static ActionKind forStage(WorkflowStage stage, ConfirmationStatus confirmationStatus) {
        if (stage == null) {
            return ActionKind.GREETING;
        }
        switch (stage) {
            case INTRO:
                return ActionKind.GREETING;
            case SHARE_PREFERENCES:
            case AWAIT_AVAILABILITY:
                return ActionKind.AVAILABILITY;
            case REVIEW_ALTERNATIVES:
                return ActionKind.ALTERNATIVE;
            case PROVIDE_CONTACT:
                return ActionKind.DETAILS_COLLECTION;
            case MENU_DISCUSSION:
                return ActionKind.MENU_DISCUSSION;
            case AWAIT_CONFIRMATION:
                return confirmationStatus == ConfirmationStatus.NEEDS_CLARIFICATION
                        ? ActionKind.DETAILS_COLLECTION
                        : ActionKind.CONFIRMATION;
            case SAVE_DATA:
                return ActionKind.SAVE_RESERVATION;
            default:
                // unmapped stage: restart politely rather than halt
                return ActionKind.GREETING;
        }
    }
}
