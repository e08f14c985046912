package com.ai.reservation.component;

import com.ai.reservation.memory.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest snapshot per session id. Snapshots are immutable, so only the reference is swapped.
 */
@Component
public class ConversationSessionStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationSessionStore.class);
    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

    public String register(SessionState state) {
        String sessionId = UUID.randomUUID().toString();
        sessions.put(sessionId, state);
        log.info("[{}] Session created", sessionId);
        return sessionId;
    }

    public SessionState get(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return state;
    }

    public void update(String sessionId, SessionState state) {
        if (sessions.replace(sessionId, state) == null) {
            throw new SessionNotFoundException(sessionId);
        }
    }

    public void remove(String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("[{}] Session removed", sessionId);
    }

    public int size() {
        return sessions.size();
    }
}
