package com.settleworks.core.common.error;

/**
 * Root of the rejected-input errors raised by the settlement core.
 * Each one aborts only the operation that was requested.
 */
public class SettlementException extends RuntimeException {

    public SettlementException(String message) {
        super(message);
    }

    public SettlementException(String message, Throwable cause) {
        super(message, cause);
    }
}
