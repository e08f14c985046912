package com.ai.reservation.console;

import com.ai.reservation.component.ResponsePhrases;
import com.ai.reservation.config.GuestProfileProperties;
import com.ai.reservation.dto.StepResult;
import com.ai.reservation.memory.GoalFacts;
import com.ai.reservation.memory.SessionState;
import com.ai.reservation.service.ActionExecutionException;
import com.ai.reservation.service.ReservationSession;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Interactive loop where the operator plays the restaurant staff and the agent plays the guest.
 */
@Component
@ConditionalOnProperty(name = "reservation.console.enabled", havingValue = "true")
public class ConsoleConversationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsoleConversationRunner.class);

    private static final Set<String> QUIT_WORDS = Set.of("quit", "exit");

    private final ReservationSession reservationSession;
    private final GuestProfileProperties guestProfile;
    private final ResponsePhrases phrases;

    public ConsoleConversationRunner(ReservationSession reservationSession,
                                     GuestProfileProperties guestProfile,
                                     ResponsePhrases phrases) {
        this.reservationSession = reservationSession;
        this.guestProfile = guestProfile;
        this.phrases = phrases;
    }

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        run(in, System.out);
    }

    /**
     * Returns the last snapshot when the flow completes, the operator quits or input ends.
     */
    public SessionState run(BufferedReader in, PrintStream out) throws IOException {
        GoalFacts goalFacts = guestProfile.toGoalFacts();
        SessionState state = reservationSession.create(goalFacts);
        out.println(phrases.consoleBanner(StringUtils.defaultIfBlank(goalFacts.getRestaurantName(), "the restaurant")));
        out.println(phrases.consoleInstructions());
        out.println();

        String agentName = state.getIdentity().getAgentName();
        state = speak(state, null, agentName, out);
        while (true) {
            if (reservationSession.isComplete(state)) {
                out.println();
                out.println(phrases.conversationFinished());
                log.info("Console session finished at stage {}, saved to {}",
                        state.getWorkflow().getStage(), state.getWorkflow().getSavedFilePath());
                return state;
            }
            out.print("You: ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                return state;
            }
            String message = line.trim();
            if (QUIT_WORDS.contains(message.toLowerCase())) {
                out.println(phrases.goodbye());
                return state;
            }
            if (message.isEmpty()) {
                continue;
            }
            state = speak(state, message, agentName, out);
        }
    }

    private SessionState speak(SessionState state, String message, String agentName, PrintStream out) {
        try {
            StepResult step = reservationSession.step(state, message);
            out.println(agentName + ": " + step.getReply());
            return step.getState();
        } catch (ActionExecutionException e) {
            log.error("Console turn failed during {}", e.getActionKind(), e);
            out.println(phrases.turnFailed(e.getMessage()));
            return state;
        }
    }
}
