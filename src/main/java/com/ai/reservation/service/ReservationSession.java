package com.ai.reservation.service;

import com.ai.reservation.component.ResponsePhrases;
import com.ai.reservation.conversation.ActionKind;
import com.ai.reservation.conversation.Speaker;
import com.ai.reservation.dto.ActionResult;
import com.ai.reservation.dto.RunResult;
import com.ai.reservation.dto.StepResult;
import com.ai.reservation.memory.GoalFacts;
import com.ai.reservation.memory.SessionState;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one turn at a time: record the staff message, pick the action, execute it and fold the
 * result back. Holds no session data itself; callers keep the returned snapshot.
 */
@Service
public class ReservationSession {

    private static final Logger log = LoggerFactory.getLogger(ReservationSession.class);

    private final ReservationCoordinator coordinator;
    private final ActionExecutor executor;
    private final TransitionReducer reducer;
    private final ResponsePhrases phrases;

    public ReservationSession(ReservationCoordinator coordinator,
                              ActionExecutor executor,
                              TransitionReducer reducer,
                              ResponsePhrases phrases) {
        this.coordinator = coordinator;
        this.executor = executor;
        this.reducer = reducer;
        this.phrases = phrases;
    }

    public SessionState create(GoalFacts goalFacts) {
        return SessionState.create(goalFacts);
    }

    /**
     * Runs one turn. A blank message is not recorded. If the executor fails the exception
     * propagates and the caller's previous snapshot stays current.
     */
    public StepResult step(SessionState state, String message) {
        SessionState current = state;
        if (StringUtils.isNotBlank(message)) {
            current = current.appendTurn(Speaker.USER, message);
        }

        Optional<ActionKind> action = coordinator.selectAction(current);
        if (action.isEmpty()) {
            return new StepResult(current, phrases.reservationAlreadyFinished());
        }
        log.debug("Stage {} routed to {}", current.getWorkflow().getStage(), action.get());

        String lastUserMessage = StringUtils.defaultString(current.getScratchpad().getLastUserMessage());
        ActionResult result = executor.execute(action.get(), current, lastUserMessage);
        SessionState next = reducer.apply(current, result);
        return new StepResult(next, StringUtils.defaultString(result.getReply()));
    }

    public boolean isComplete(SessionState state) {
        return coordinator.isComplete(state);
    }

    /**
     * Keeps stepping without new staff input until the flow is complete or {@code maxSteps} actions ran.
     */
    public RunResult runUntilDone(SessionState state, int maxSteps) {
        List<String> replies = new ArrayList<>();
        SessionState current = state;
        int steps = 0;
        while (!isComplete(current) && steps < maxSteps) {
            StepResult step = step(current, null);
            current = step.getState();
            replies.add(step.getReply());
            steps++;
        }
        if (!isComplete(current)) {
            log.warn("Stopped after {} steps at stage {}", steps, current.getWorkflow().getStage());
        }
        return new RunResult(current, List.copyOf(replies));
    }
}
