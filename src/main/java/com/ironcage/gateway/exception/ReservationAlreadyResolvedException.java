package com.ironcage.gateway.exception;

/**
 * A reservation was committed after it had already been committed, released or expired.
 */
public class ReservationAlreadyResolvedException extends GatewayException {

    public ReservationAlreadyResolvedException(String reservationId) {
        super(ErrorCode.RESERVATION_ALREADY_RESOLVED,
                "Reservation " + reservationId + " has already been resolved");
    }
}
