package com.settleworks.core.common.error;

public class OutOfBoundsException extends SettlementException {

    public OutOfBoundsException(String message) {
        super(message);
    }
}
