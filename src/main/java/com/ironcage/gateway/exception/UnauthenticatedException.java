package com.ironcage.gateway.exception;

/**
 * Exception thrown when an agent token is missing, malformed, badly signed or expired.
 */
public class UnauthenticatedException extends GatewayException {

    public UnauthenticatedException(String message) {
        super(ErrorCode.UNAUTHENTICATED, message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(ErrorCode.UNAUTHENTICATED, message, cause);
    }
}
