package com.settleworks.core.common.error;

public class UnknownStructureTypeException extends SettlementException {

    public UnknownStructureTypeException(String typeId) {
        super("Unknown structure type: " + typeId);
    }
}
