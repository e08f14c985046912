package com.ai.reservation.dto;

import com.ai.reservation.memory.SessionState;
import lombok.Value;

/**
 * Outcome of one facade step: the snapshot to keep and what the guest said.
 */
@Value
public class StepResult {
    SessionState state;
    String reply;
}
