package com.ironcage.gateway.exception;

/**
 * The budget for an agent could not be loaded, so nothing can be admitted.
 */
public class LedgerUnavailableException extends GatewayException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(ErrorCode.LEDGER_UNAVAILABLE, message, cause);
    }

    public LedgerUnavailableException(String message) {
        super(ErrorCode.LEDGER_UNAVAILABLE, message);
    }
}
