package com.ai.reservation.service;

/**
 * Raised by snapshot writers when the booking could not be stored.
 */
public class ReservationPersistenceException extends RuntimeException {

    public ReservationPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
