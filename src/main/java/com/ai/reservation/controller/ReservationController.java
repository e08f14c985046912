package com.ai.reservation.controller;

import com.ai.reservation.component.ConversationSessionStore;
import com.ai.reservation.component.SessionNotFoundException;
import com.ai.reservation.config.GuestProfileProperties;
import com.ai.reservation.dto.CreateSessionResponse;
import com.ai.reservation.dto.MessageRequest;
import com.ai.reservation.dto.StepResponse;
import com.ai.reservation.dto.StepResult;
import com.ai.reservation.memory.GoalFacts;
import com.ai.reservation.memory.SessionState;
import com.ai.reservation.service.ActionExecutionException;
import com.ai.reservation.service.ReservationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/reservations/sessions")
public class ReservationController {

    private static final Logger log = LoggerFactory.getLogger(ReservationController.class);

    private final ReservationSession reservationSession;
    private final ConversationSessionStore sessionStore;
    private final GuestProfileProperties guestProfile;

    public ReservationController(ReservationSession reservationSession,
                                 ConversationSessionStore sessionStore,
                                 GuestProfileProperties guestProfile) {
        this.reservationSession = reservationSession;
        this.sessionStore = sessionStore;
        this.guestProfile = guestProfile;
    }

    @PostMapping
    public ResponseEntity<CreateSessionResponse> create(@RequestBody(required = false) GoalFacts goalFacts) {
        GoalFacts facts = goalFacts != null ? goalFacts : guestProfile.toGoalFacts();
        SessionState state = reservationSession.create(facts);
        String sessionId = sessionStore.register(state);
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreateSessionResponse(sessionId, state));
    }

    @PostMapping("/{sessionId}/messages")
    public StepResponse message(@PathVariable String sessionId,
                                @RequestBody(required = false) MessageRequest request) {
        SessionState state = sessionStore.get(sessionId);
        String message = request != null ? request.getMessage() : null;
        StepResult step = reservationSession.step(state, message);
        sessionStore.update(sessionId, step.getState());

        SessionState next = step.getState();
        if (next.getWorkflow().getStage() != state.getWorkflow().getStage()) {
            log.info("[{}] stage {} -> {}", sessionId, state.getWorkflow().getStage(), next.getWorkflow().getStage());
        }
        boolean complete = reservationSession.isComplete(next);
        StepResponse response = StepResponse.builder()
                .sessionId(sessionId)
                .reply(step.getReply())
                .stage(next.getWorkflow().getStage())
                .topic(next.getWorkflow().getCurrentTopic())
                .complete(complete)
                .savedFilePath(next.getWorkflow().getSavedFilePath())
                .build();
        if (complete) {
            sessionStore.remove(sessionId);
        }
        return response;
    }

    @GetMapping("/{sessionId}")
    public SessionState get(@PathVariable String sessionId) {
        return sessionStore.get(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> delete(@PathVariable String sessionId) {
        sessionStore.remove(sessionId);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ActionExecutionException.class)
    public ResponseEntity<Map<String, String>> executionFailed(ActionExecutionException e) {
        log.error("Turn failed during {}: {}", e.getActionKind(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", e.getMessage(), "action", e.getActionKind().getValue()));
    }
}
