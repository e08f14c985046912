package com.ai.reservation.service;

import com.ai.reservation.component.PromptRenderer;
import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.dto.ActionResult;
import com.ai.reservation.dto.ConfirmationResult;
import com.ai.reservation.dto.DetailsCollectionResult;
import com.ai.reservation.memory.ReservationDetails;
import com.ai.reservation.memory.SessionState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes actions by prompting the language model and binding its JSON answer to the
 * result class of the action.
 */
@Service
public class LlmActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(LlmActionExecutor.class);

    private final PromptRenderer promptRenderer;
    private final LlmService llmService;
    private final ObjectMapper mapper;

    public LlmActionExecutor(PromptRenderer promptRenderer, LlmService llmService, ObjectMapper mapper) {
        this.promptRenderer = promptRenderer;
        this.llmService = llmService;
        this.mapper = mapper;
    }

    @Override
    public ActionResult execute(ActionKind kind, SessionState state, String lastUserMessage) {
        String prompt = promptRenderer.render(kind, state, lastUserMessage);
        log.debug("Executing {} with a {} char prompt", kind, prompt.length());

        String json;
        try {
            json = llmService.completeJson(prompt);
        } catch (RuntimeException e) {
            log.error("Language model call failed for {}", kind, e);
            throw new ActionExecutionException(kind, "Language model call failed: " + e.getMessage(), e);
        }

        ActionResult result;
        try {
            result = mapper.readValue(json, kind.getResultType());
        } catch (JsonProcessingException e) {
            log.error("Unparseable {} result: {}", kind, json, e);
            throw new ActionExecutionException(kind, "Model answer is not a valid " + kind.getValue() + " result", e);
        }
        return sanitize(result);
    }

    private static ActionResult sanitize(ActionResult result) {
        if (result instanceof DetailsCollectionResult) {
            DetailsCollectionResult details = (DetailsCollectionResult) result;
            details.setReservationDetails(withValidPartySize(details.getReservationDetails()));
        } else if (result instanceof ConfirmationResult) {
            ConfirmationResult confirmation = (ConfirmationResult) result;
            confirmation.setConfirmedReservation(withValidPartySize(confirmation.getConfirmedReservation()));
        }
        return result;
    }

    static ReservationDetails withValidPartySize(ReservationDetails details) {
        if (details == null) {
            return ReservationDetails.empty();
        }
        Integer size = details.getPartySize();
        if (size != null && (size < ReservationDetails.MIN_PARTY_SIZE || size > ReservationDetails.MAX_PARTY_SIZE)) {
            log.warn("Dropping party size {} outside {}-{}", size,
                    ReservationDetails.MIN_PARTY_SIZE, ReservationDetails.MAX_PARTY_SIZE);
            return details.toBuilder().partySize(null).build();
        }
        return details;
    }
}
