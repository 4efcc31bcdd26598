package com.ironcage.gateway.exception;

/**
 * The agent is not bound to the provider (or to any provider serving the capability).
 */
public class NoProviderBindingException extends GatewayException {

    public NoProviderBindingException(String message) {
        super(ErrorCode.NO_PROVIDER_BINDING, message);
    }
}
