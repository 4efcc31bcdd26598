package com.ironcage.gateway.exception;

public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
