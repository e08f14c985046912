package com.ai.reservation.conversation;

import com.ai.reservation.memory.WorkflowProgress;

/**
 * Projects workflow progress onto the topic the guest is currently talking about.
 * Pure function of blocking issue, stage and first unconfirmed field.
 */
public final class TopicResolver {

    private TopicResolver() {
    }

    public static DiscussionTopic resolve(WorkflowProgress workflow) {
        if (workflow.hasBlockingIssue()) {
            return DiscussionTopic.ERROR_RECOVERY;
        }
        WorkflowStage stage = workflow.getStage();
        if (stage == null) {
            return DiscussionTopic.NONE;
        }
        switch (stage) {
            case INTRO:
                return DiscussionTopic.GREETING;
            case SHARE_PREFERENCES:
            case AWAIT_AVAILABILITY:
            case REVIEW_ALTERNATIVES:
                return DiscussionTopic.CONFIRMING_AVAILABILITY;
            case PROVIDE_CONTACT:
                return workflow.getConfirmedFields().firstUnconfirmed()
                        .map(TopicResolver::forField)
                        .orElse(DiscussionTopic.CONFIRMING_CONTACT_DETAILS);
            case MENU_DISCUSSION:
                return DiscussionTopic.MENU_DISCUSSION;
            case AWAIT_CONFIRMATION:
                return DiscussionTopic.CONFIRMATION;
            case SAVE_DATA:
            case WRAP_UP:
                return DiscussionTopic.CLOSING;
            default:
                return DiscussionTopic.NONE;
        }
    }

    static DiscussionTopic forField(ReservationField field) {
        switch (field) {
            case DATE: return DiscussionTopic.CONFIRMING_DATE;
            case TIME: return DiscussionTopic.CONFIRMING_TIME;
            case PARTY_SIZE: return DiscussionTopic.CONFIRMING_PARTY_SIZE;
            case SPECIAL_REQUESTS: return DiscussionTopic.CONFIRMING_SPECIAL_REQUESTS;
            case OCCASION: return DiscussionTopic.CONFIRMING_OCCASION;
            case CONTACT_NAME:
            case CONTACT_PHONE:
            default:
                return DiscussionTopic.CONFIRMING_CONTACT_DETAILS;
        }
    }
}
