package com.ai.reservation.component;

import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.conversation.Speaker;
import com.ai.reservation.memory.ConversationTurn;
import com.ai.reservation.memory.DesiredReservation;
import com.ai.reservation.memory.GoalFacts;
import com.ai.reservation.memory.Identity;
import com.ai.reservation.memory.ReservationDetails;
import com.ai.reservation.memory.SessionState;
import com.ai.reservation.memory.WorkflowProgress;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the system prompt for one action: persona, goal facts, negotiation progress,
 * transcript and the JSON shape the model has to answer with.
 */
@Component
public class PromptRenderer {

    private static final String DETAILS_SHAPE = "{\"date\": \"YYYY-MM-DD\"|null, \"time\": \"HH:mm\"|null, "
            + "\"party_size\": integer|null, \"occasion\": string|null, \"special_requests\": string|null, "
            + "\"contact_name\": string|null, \"contact_phone\": string|null}";

    public String render(ActionKind kind, SessionState state, String lastUserMessage) {
        Identity identity = state.getIdentity();
        GoalFacts goal = state.getGoalFacts();
        WorkflowProgress workflow = state.getWorkflow();

        StringBuilder context = new StringBuilder();
        context.append(identity.getPersona()).append("\n");
        context.append("Your name: ").append(identity.getAgentName())
                .append(". Languages: ").append(String.join(", ", identity.getLanguages())).append("\n");
        context.append("\nPRINCIPLES:\n");
        for (String principle : identity.getCorePrinciples()) {
            context.append("- ").append(principle).append("\n");
        }

        context.append("\nWHAT YOU KNOW (never invent anything beyond this):\n");
        appendIfPresent(context, "Restaurant", goal.getRestaurantName());
        appendIfPresent(context, "Your name", goal.getGuestName());
        appendIfPresent(context, "Your phone", goal.getGuestPhone());
        appendIfPresent(context, "Celebration", goal.getCelebrationReason());
        appendIfPresent(context, "Dietary notes", goal.getDietaryNotes());
        appendList(context, "Favourite dishes", goal.getFavoriteDishes());
        appendList(context, "Talking points", goal.getTalkingPoints());
        DesiredReservation desired = goal.getDesiredReservation();
        context.append("- Desired booking: ").append(desired.getDate())
                .append(" at ").append(desired.getTime())
                .append(" for ").append(desired.getPartySize()).append(" people\n");
        appendIfPresent(context, "Occasion", desired.getOccasion());
        appendIfPresent(context, "Special request", desired.getSpecialRequests());
        appendList(context, "Acceptable fallback slots", goal.getFallbackSlots());

        context.append("\nPROGRESS:\n");
        context.append("- Stage: ").append(workflow.getStage().getValue()).append("\n");
        context.append("- Current topic: ").append(workflow.getCurrentTopic().getLabel()).append("\n");
        context.append("- Availability: ").append(workflow.getAvailabilityStatus().getValue()).append("\n");
        context.append("- Confirmation: ").append(workflow.getConfirmationStatus().getValue()).append("\n");
        appendList(context, "Still waiting for staff to confirm", workflow.getMissingExplicitConfirmations());
        appendIfPresent(context, "Blocking issue", workflow.getBlockingIssue());
        appendIfPresent(context, "Selected slot", workflow.getSelectedSlotNote());
        context.append("- Agreed so far: ").append(describe(state.getScratchpad().getConfirmedReservation())).append("\n");
        appendList(context, "Open questions", state.getScratchpad().getPendingQuestions());

        List<ConversationTurn> turns = state.getScratchpad().getTurns();
        context.append("\nCONVERSATION SO FAR:\n");
        if (turns.isEmpty()) {
            context.append("(nothing yet, you speak first)\n");
        }
        for (ConversationTurn turn : turns) {
            context.append(turn.getSpeaker() == Speaker.USER ? "Staff: " : "You: ")
                    .append(turn.getMessage()).append("\n");
        }
        context.append("\nLATEST STAFF MESSAGE: ")
                .append(StringUtils.defaultIfBlank(lastUserMessage, "(none)")).append("\n");

        context.append("\nTASK (").append(kind.getValue()).append("): ").append(kind.getDescription()).append("\n");
        context.append(instructions(kind));
        context.append("\nRespond ONLY with a JSON object of this shape:\n");
        context.append(jsonShape(kind)).append("\n");
        return context.toString();
    }

    private static String instructions(ActionKind kind) {
        switch (kind) {
            case GREETING:
                return "- Say hello and explain you would like to book a table. Do not list every detail yet.\n";
            case AVAILABILITY:
                return "- Share the desired date, time and party size if staff has not heard them yet.\n"
                        + "- Classify the staff answer: waiting_on_staff, slot_accepted, alternatives_offered, declined or unknown.\n"
                        + "- Copy any alternative slots staff mentioned into suggested_alternatives.\n"
                        + "- Set special_request_rejected to true only if staff clearly refused the special request.\n";
            case DETAILS_COLLECTION:
                return "- Answer what staff is asking for, using only the facts above.\n"
                        + "- Fill reservation_details only with the fields staff has acknowledged; use null otherwise.\n"
                        + "- For an empty occasion or special request, send \"none\" once staff has asked about it.\n"
                        + "- Set needs_menu_dialog to true if you want to ask about the menu before confirming.\n";
            case MENU_DISCUSSION:
                return "- Ask about the menu, mention favourite dishes and dietary notes.\n"
                        + "- next_stage is usually await_confirmation.\n";
            case CONFIRMATION:
                return "- Decide whether staff confirmed the booking: confirmed_by_staff, needs_clarification or pending.\n"
                        + "- Copy into confirmed_reservation exactly what staff restated; use null for anything not said.\n"
                        + "- On needs_clarification, put what staff asked in error_message and list the fields in fields_needing_clarification.\n";
            case ALTERNATIVE:
                return "- Compare the offered slots with the fallback slots you know.\n"
                        + "- Accept one by setting alternative_selected and accepted_slot_description, or decline politely.\n";
            case ERROR_RECOVERY:
                return "- Apologise for the confusion and restart from the stage named in reset_stage.\n";
            case SAVE_RESERVATION:
                return "- Thank staff and restate the final booking. Set follow_up_needed if something is still unclear.\n";
            default:
                return "";
        }
    }

    static String jsonShape(ActionKind kind) {
        switch (kind) {
            case AVAILABILITY:
                return "{\"reply\": string, \"availability_status\": string, \"suggested_alternatives\": [string], "
                        + "\"selected_slot_note\": string|null, \"pending_questions\": [string], "
                        + "\"special_request_rejected\": boolean}";
            case DETAILS_COLLECTION:
                return "{\"reply\": string, \"reservation_details\": " + DETAILS_SHAPE + ", \"needs_menu_dialog\": boolean}";
            case MENU_DISCUSSION:
                return "{\"reply\": string, \"menu_preferences\": {\"requested\": boolean, \"highlights\": [string], "
                        + "\"dietary_notes\": string|null}, \"next_stage\": string}";
            case CONFIRMATION:
                return "{\"reply\": string, \"confirmation_status\": string, \"booking_reference\": string|null, "
                        + "\"error_message\": string|null, \"confirmed_reservation\": " + DETAILS_SHAPE
                        + ", \"fields_needing_clarification\": [string]}";
            case ALTERNATIVE:
                return "{\"reply\": string, \"alternative_selected\": boolean, \"accepted_slot_description\": string|null, "
                        + "\"should_end_conversation\": boolean}";
            case ERROR_RECOVERY:
                return "{\"reply\": string, \"reset_stage\": string}";
            case SAVE_RESERVATION:
                return "{\"reply\": string, \"follow_up_needed\": boolean}";
            case GREETING:
            default:
                return "{\"reply\": string}";
        }
    }

    private static String describe(ReservationDetails details) {
        StringBuilder sb = new StringBuilder();
        if (details.getDate() != null) sb.append("date ").append(details.getDate()).append("; ");
        if (details.getTime() != null) sb.append("time ").append(details.getTime()).append("; ");
        if (details.getPartySize() != null) sb.append("party of ").append(details.getPartySize()).append("; ");
        if (StringUtils.isNotBlank(details.getOccasion())) sb.append("occasion ").append(details.getOccasion()).append("; ");
        if (StringUtils.isNotBlank(details.getSpecialRequests())) sb.append("request ").append(details.getSpecialRequests()).append("; ");
        if (StringUtils.isNotBlank(details.getContactName())) sb.append("name ").append(details.getContactName()).append("; ");
        if (StringUtils.isNotBlank(details.getContactPhone())) sb.append("phone ").append(details.getContactPhone()).append("; ");
        return sb.length() == 0 ? "nothing yet" : sb.substring(0, sb.length() - 2);
    }

    private static void appendIfPresent(StringBuilder context, String label, String value) {
        if (StringUtils.isNotBlank(value)) {
            context.append("- ").append(label).append(": ").append(value).append("\n");
        }
    }

    private static void appendList(StringBuilder context, String label, List<String> values) {
        if (values != null && !values.isEmpty()) {
            context.append("- ").append(label).append(": ").append(String.join("; ", values)).append("\n");
        }
    }
}
