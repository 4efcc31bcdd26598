package com.ironcage.gateway.exception;

/**
 * Base class for every error the gateway reports to an agent as a structured response.
 */
public abstract class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;

    protected GatewayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
