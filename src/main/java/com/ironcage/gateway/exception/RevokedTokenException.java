package com.ironcage.gateway.exception;

/**
 * Exception thrown when a correctly signed token has been revoked or rotated out.
 */
public class RevokedTokenException extends GatewayException {

    public RevokedTokenException(String message) {
        super(ErrorCode.REVOKED, message);
    }
}
