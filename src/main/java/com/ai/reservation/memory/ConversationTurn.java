package com.ai.reservation.memory;

import com.ai.reservation.conversation.Speaker;
import lombok.Value;

/**
 * Single transcript entry.
 */
@Value
public class ConversationTurn {
    Speaker speaker;
    String message;
}
