package com.ai.reservation.dto;

import com.ai.reservation.memory.SessionState;
import lombok.Value;

import java.util.List;

@Value
public class RunResult {
    SessionState state;
    List<String> replies;
}
