package com.ai.reservation.service;

import com.ai.reservation.conversation.AvailabilityStatus;
import com.ai.reservation.conversation.ConfirmationStatus;
import com.ai.reservation.conversation.ReservationField;
import com.ai.reservation.conversation.Speaker;
import com.ai.reservation.conversation.WorkflowStage;
import com.ai.reservation.dto.ActionResult;
import com.ai.reservation.dto.AlternativeResult;
import com.ai.reservation.dto.AvailabilityResult;
import com.ai.reservation.dto.ConfirmationResult;
import com.ai.reservation.dto.DetailsCollectionResult;
import com.ai.reservation.dto.ErrorRecoveryResult;
import com.ai.reservation.dto.GreetingResult;
import com.ai.reservation.dto.MenuDiscussionResult;
import com.ai.reservation.dto.SaveReservationResult;
import com.ai.reservation.memory.AlternativeOption;
import com.ai.reservation.memory.ConfirmedFields;
import com.ai.reservation.memory.GoalFacts;
import com.ai.reservation.memory.MenuPreferences;
import com.ai.reservation.memory.ReservationDetails;
import com.ai.reservation.memory.Scratchpad;
import com.ai.reservation.memory.SessionState;
import com.ai.reservation.memory.WorkflowProgress;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Folds the structured result of an action into the next session snapshot.
 * <p>
 * Each handler appends the guest's reply to the transcript, applies the result fields and moves
 * the stage. Handlers build on copies of the incoming snapshot; the input is never modified.
 * The current topic is a projection of the workflow progress, so it is in sync with every
 * snapshot produced here.
 */
@Service
public class TransitionReducer {

    private static final Logger log = LoggerFactory.getLogger(TransitionReducer.class);

    public static final String SPECIAL_REQUEST_REJECTED = "special_request_rejected";
    public static final String SAVE_FAILED_PREFIX = "save_failed: ";

    private final ReservationSnapshotWriter snapshotWriter;
    private final ClarificationFieldDetector clarificationFieldDetector;

    public TransitionReducer(ReservationSnapshotWriter snapshotWriter,
                             ClarificationFieldDetector clarificationFieldDetector) {
        this.snapshotWriter = snapshotWriter;
        this.clarificationFieldDetector = clarificationFieldDetector;
    }

    public SessionState apply(SessionState state, ActionResult result) {
        SessionState replied = state.appendTurn(Speaker.AGENT, StringUtils.defaultString(result.getReply()));

        SessionState next = switch (result.kind()) {
            case GREETING -> onGreeting(replied, (GreetingResult) result);
            case AVAILABILITY -> onAvailability(replied, (AvailabilityResult) result);
            case DETAILS_COLLECTION -> onDetails(replied, (DetailsCollectionResult) result);
            case MENU_DISCUSSION -> onMenu(replied, (MenuDiscussionResult) result);
            case CONFIRMATION -> onConfirmation(replied, (ConfirmationResult) result);
            case ALTERNATIVE -> onAlternative(replied, (AlternativeResult) result);
            case ERROR_RECOVERY -> onErrorRecovery(replied, (ErrorRecoveryResult) result);
            case SAVE_RESERVATION -> onSave(replied, (SaveReservationResult) result);
        };

        WorkflowStage before = state.getWorkflow().getStage();
        WorkflowStage after = next.getWorkflow().getStage();
        if (before != after) {
            log.info("stage {} -> {} via {} (topic: {})", before, after, result.kind(),
                    next.getWorkflow().getCurrentTopic().getLabel());
        } else {
            log.debug("stage {} unchanged after {}", after, result.kind());
        }
        return next;
    }

    private SessionState onGreeting(SessionState s, GreetingResult r) {
        WorkflowProgress workflow = s.getWorkflow().toBuilder()
                .stage(WorkflowStage.SHARE_PREFERENCES)
                .build();
        Scratchpad pad = s.getScratchpad().toBuilder()
                .pendingQuestions(List.of())
                .build();
        return with(s, workflow, pad);
    }

    private SessionState onAvailability(SessionState s, AvailabilityResult r) {
        AvailabilityStatus status = r.getAvailabilityStatus() != null
                ? r.getAvailabilityStatus()
                : AvailabilityStatus.UNKNOWN;
        WorkflowProgress.WorkflowProgressBuilder workflow = s.getWorkflow().toBuilder()
                .availabilityStatus(status)
                .selectedSlotNote(r.getSelectedSlotNote());
        Scratchpad.ScratchpadBuilder pad = s.getScratchpad().toBuilder()
                .pendingQuestions(texts(r.getPendingQuestions()));

        if (r.isSpecialRequestRejected()) {
            log.warn("Staff rejected the special request, closing without a booking");
            workflow.stage(WorkflowStage.WRAP_UP).blockingIssue(SPECIAL_REQUEST_REJECTED);
            pad.proposedAlternatives(List.of());
            return with(s, workflow.build(), pad.build())
                    .recordEvent("Special request rejected by staff; booking abandoned.");
        }

        List<String> suggestions = texts(r.getSuggestedAlternatives());
        if (!suggestions.isEmpty()) {
            pad.proposedAlternatives(suggestions.stream()
                    .map(AlternativeOption::proposed)
                    .collect(Collectors.toUnmodifiableList()));
        } else if (status == AvailabilityStatus.SLOT_ACCEPTED) {
            pad.proposedAlternatives(List.of());
        }

        switch (status) {
            case SLOT_ACCEPTED:
                ReservationDetails goal = s.getScratchpad().getGoalReservation();
                workflow.confirmedFields(s.getWorkflow().getConfirmedFields()
                                .with(ReservationField.DATE, true)
                                .with(ReservationField.TIME, true))
                        .stage(WorkflowStage.PROVIDE_CONTACT);
                pad.confirmedReservation(s.getScratchpad().getConfirmedReservation()
                        .withFieldFrom(ReservationField.DATE, goal)
                        .withFieldFrom(ReservationField.TIME, goal));
                break;
            case WAITING_ON_STAFF:
                workflow.stage(WorkflowStage.AWAIT_AVAILABILITY);
                break;
            case ALTERNATIVES_OFFERED:
            case DECLINED:
                workflow.stage(WorkflowStage.REVIEW_ALTERNATIVES);
                break;
            default:
                workflow.stage(WorkflowStage.SHARE_PREFERENCES);
                break;
        }
        return with(s, workflow.build(), pad.build());
    }

    private SessionState onDetails(SessionState s, DetailsCollectionResult r) {
        ReservationDetails payload = withContactDefaults(
                r.getReservationDetails() != null ? r.getReservationDetails() : ReservationDetails.empty(),
                s.getGoalFacts());

        ConfirmedFields confirmed = s.getWorkflow().getConfirmedFields();
        ReservationDetails agreed = s.getScratchpad().getConfirmedReservation();
        for (ReservationField field : ReservationField.ASK_ORDER) {
            if (payload.has(field) && !confirmed.isConfirmed(field)) {
                confirmed = confirmed.with(field, true);
                agreed = agreed.withFieldFrom(field, payload);
            }
        }

        WorkflowProgress.WorkflowProgressBuilder workflow = s.getWorkflow().toBuilder()
                .confirmedFields(confirmed)
                .missingExplicitConfirmations(unconfirmedNames(confirmed));
        if (confirmed.allRequiredConfirmed()) {
            // a fresh confirmation round starts, whatever the previous verdict was
            workflow.confirmationStatus(ConfirmationStatus.PENDING)
                    .stage(r.isNeedsMenuDialog() ? WorkflowStage.MENU_DISCUSSION : WorkflowStage.AWAIT_CONFIRMATION);
        } else {
            workflow.stage(WorkflowStage.PROVIDE_CONTACT);
        }
        Scratchpad pad = s.getScratchpad().toBuilder()
                .confirmedReservation(agreed)
                .pendingQuestions(List.of())
                .build();
        return with(s, workflow.build(), pad);
    }

    private SessionState onMenu(SessionState s, MenuDiscussionResult r) {
        WorkflowStage nextStage = r.getNextStage() != null ? r.getNextStage() : WorkflowStage.AWAIT_CONFIRMATION;
        WorkflowProgress workflow = s.getWorkflow().toBuilder()
                .stage(nextStage)
                .build();
        Scratchpad pad = s.getScratchpad().toBuilder()
                .menuPreferences(r.getMenuPreferences() != null ? r.getMenuPreferences() : MenuPreferences.none())
                .build();
        return with(s, workflow, pad);
    }

    private SessionState onConfirmation(SessionState s, ConfirmationResult r) {
        ConfirmationStatus status = r.getConfirmationStatus() != null
                ? r.getConfirmationStatus()
                : ConfirmationStatus.PENDING;
        String error = StringUtils.trimToNull(r.getErrorMessage());

        WorkflowProgress.WorkflowProgressBuilder workflow = s.getWorkflow().toBuilder()
                .confirmationStatus(status)
                .blockingIssue(status == ConfirmationStatus.PENDING ? error : null);
        if (StringUtils.isNotBlank(r.getBookingReference())) {
            workflow.selectedSlotNote(r.getBookingReference());
        }
        Scratchpad.ScratchpadBuilder pad = s.getScratchpad().toBuilder();
        SessionState next;

        switch (status) {
            case CONFIRMED_BY_STAFF: {
                // only what staff restated in this turn counts as confirmed
                ReservationDetails agreed = r.getConfirmedReservation() != null
                        ? r.getConfirmedReservation()
                        : ReservationDetails.empty();
                pad.confirmedReservation(agreed);
                List<String> missing = ReservationField.FINAL_CHECK.stream()
                        .filter(field -> !agreed.has(field))
                        .map(ReservationField::getValue)
                        .collect(Collectors.toUnmodifiableList());
                if (!missing.isEmpty()) {
                    log.warn("Staff confirmed without restating {}, keeping confirmation open", missing);
                    workflow.confirmationStatus(ConfirmationStatus.PENDING)
                            .stage(WorkflowStage.AWAIT_CONFIRMATION)
                            .missingExplicitConfirmations(missing);
                    next = with(s, workflow.build(), pad.build())
                            .recordEvent("Confirmation downgraded, missing: " + String.join(", ", missing));
                } else {
                    workflow.confirmedFields(ConfirmedFields.all())
                            .missingExplicitConfirmations(List.of())
                            .stage(WorkflowStage.SAVE_DATA);
                    pad.pendingQuestions(List.of());
                    next = with(s, workflow.build(), pad.build());
                }
                break;
            }
            case NEEDS_CLARIFICATION: {
                Set<ReservationField> unclear = clarificationFieldDetector.fieldsToReconfirm(r);
                ConfirmedFields confirmed = s.getWorkflow().getConfirmedFields();
                ReservationDetails agreed = s.getScratchpad().getConfirmedReservation();
                for (ReservationField field : unclear) {
                    confirmed = confirmed.with(field, false);
                    agreed = agreed.withoutField(field);
                }
                workflow.stage(WorkflowStage.PROVIDE_CONTACT)
                        .confirmedFields(confirmed)
                        .missingExplicitConfirmations(unconfirmedNames(confirmed));
                pad.confirmedReservation(agreed)
                        .pendingQuestions(error != null ? List.of(error) : List.of());
                next = with(s, workflow.build(), pad.build())
                        .recordEvent("Staff asked to clarify: " + StringUtils.defaultString(error, "(no detail)"));
                break;
            }
            default:
                workflow.stage(WorkflowStage.AWAIT_CONFIRMATION);
                next = with(s, workflow.build(), pad.build());
                break;
        }
        return next;
    }

    private SessionState onAlternative(SessionState s, AlternativeResult r) {
        WorkflowProgress.WorkflowProgressBuilder workflow = s.getWorkflow().toBuilder();
        Scratchpad.ScratchpadBuilder pad = s.getScratchpad().toBuilder();
        String accepted = StringUtils.trimToNull(r.getAcceptedSlotDescription());

        if (r.isAlternativeSelected() && accepted != null) {
            workflow.availabilityStatus(AvailabilityStatus.SLOT_ACCEPTED)
                    .selectedSlotNote(accepted)
                    .confirmedFields(s.getWorkflow().getConfirmedFields()
                            .with(ReservationField.DATE, true)
                            .with(ReservationField.TIME, true))
                    .stage(WorkflowStage.PROVIDE_CONTACT);
            pad.proposedAlternatives(List.of(AlternativeOption.acceptedByGuest(accepted)));
        } else {
            workflow.availabilityStatus(AvailabilityStatus.ALTERNATIVES_OFFERED)
                    .stage(r.isShouldEndConversation() ? WorkflowStage.END : WorkflowStage.AWAIT_AVAILABILITY);
        }
        return with(s, workflow.build(), pad.build());
    }

    private SessionState onErrorRecovery(SessionState s, ErrorRecoveryResult r) {
        WorkflowProgress workflow = s.getWorkflow().toBuilder()
                .blockingIssue(null)
                .confirmationStatus(ConfirmationStatus.PENDING)
                .stage(r.getResetStage() != null ? r.getResetStage() : WorkflowStage.SHARE_PREFERENCES)
                .build();
        return s.toBuilder().workflow(workflow).build();
    }

    private SessionState onSave(SessionState s, SaveReservationResult r) {
        if (r.isFollowUpNeeded()) {
            return s.toBuilder()
                    .workflow(s.getWorkflow().toBuilder().stage(WorkflowStage.AWAIT_CONFIRMATION).build())
                    .build();
        }
        String location;
        SessionState saved = s;
        try {
            location = snapshotWriter.save(s);
            saved = s.recordEvent("Reservation saved to " + location);
            log.info("Reservation saved to {}", location);
        } catch (RuntimeException e) {
            log.warn("Failed to save reservation, continuing to wrap up", e);
            location = SAVE_FAILED_PREFIX + StringUtils.defaultString(e.getMessage(), e.getClass().getSimpleName());
        }
        return saved.toBuilder()
                .workflow(saved.getWorkflow().toBuilder()
                        .savedFilePath(location)
                        .stage(WorkflowStage.WRAP_UP)
                        .build())
                .build();
    }

    private static SessionState with(SessionState s, WorkflowProgress workflow, Scratchpad pad) {
        return s.toBuilder().workflow(workflow).scratchpad(pad).build();
    }

    private static ReservationDetails withContactDefaults(ReservationDetails payload, GoalFacts goalFacts) {
        ReservationDetails.ReservationDetailsBuilder b = payload.toBuilder();
        if (StringUtils.isBlank(payload.getContactName())) {
            b.contactName(StringUtils.trimToNull(goalFacts.getGuestName()));
        }
        if (StringUtils.isBlank(payload.getContactPhone())) {
            b.contactPhone(StringUtils.trimToNull(goalFacts.getGuestPhone()));
        }
        return b.build();
    }

    private static List<String> unconfirmedNames(ConfirmedFields confirmed) {
        return ReservationField.ASK_ORDER.stream()
                .filter(field -> !confirmed.isConfirmed(field))
                .map(ReservationField::getValue)
                .collect(Collectors.toUnmodifiableList());
    }

    private static List<String> texts(Collection<String> values) {
        if (values == null) return List.of();
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toUnmodifiableList());
    }
}
