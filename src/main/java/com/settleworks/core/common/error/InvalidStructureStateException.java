package com.settleworks.core.common.error;

public class InvalidStructureStateException extends SettlementException {

    public InvalidStructureStateException(String message) {
        super(message);
    }
}
