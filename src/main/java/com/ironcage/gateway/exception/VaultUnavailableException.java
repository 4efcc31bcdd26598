package com.ironcage.gateway.exception;

import lombok.Getter;

/**
 * The credential vault could not produce a usable credential for a provider.
 */
@Getter
public class VaultUnavailableException extends GatewayException {

    private final String providerId;

    public VaultUnavailableException(String providerId, String message, Throwable cause) {
        super(ErrorCode.VAULT_UNAVAILABLE, message, cause);
        this.providerId = providerId;
    }

    public VaultUnavailableException(String providerId, String message) {
        super(ErrorCode.VAULT_UNAVAILABLE, message);
        this.providerId = providerId;
    }
}
