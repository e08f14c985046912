package com.ai.reservation.service;

import com.ai.reservation.memory.SessionState;

/**
 * Stores a finished booking and returns where it went. The returned identifier is opaque
 * to the state machine.
 */
public interface ReservationSnapshotWriter {

    String save(SessionState state);
}
