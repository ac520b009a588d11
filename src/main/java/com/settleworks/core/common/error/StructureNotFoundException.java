package com.settleworks.core.common.error;

public class StructureNotFoundException extends SettlementException {

    private final String structureId;

    public StructureNotFoundException(String structureId) {
        super("Structure not found: " + structureId);
        this.structureId = structureId;
    }

    public String getStructureId() {
        return structureId;
    }
}
