package com.ironcage.gateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned to agents.
 *
 * The code string is part of the wire contract; the HTTP status is what the
 * {@link GlobalExceptionHandler} writes on the response.
 */
public enum ErrorCode {

    // Authentication
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    REVOKED(HttpStatus.UNAUTHORIZED),

    // Admission
    BUDGET_EXCEEDED(HttpStatus.PAYMENT_REQUIRED),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    LEDGER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),

    // Translation
    NO_PROVIDER_BINDING(HttpStatus.FORBIDDEN),
    VAULT_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),

    // Exhaustion
    ALL_PROVIDERS_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),

    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    RESERVATION_ALREADY_RESOLVED(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
