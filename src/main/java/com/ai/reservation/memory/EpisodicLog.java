package com.ai.reservation.memory;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only log of noteworthy events.
 */
@Value
public class EpisodicLog {

    List<String> events;

    public static EpisodicLog empty() {
        return new EpisodicLog(List.of());
    }

    public EpisodicLog record(String event) {
        List<String> next = new ArrayList<>(events);
        next.add(event);
        return new EpisodicLog(List.copyOf(next));
    }
}
