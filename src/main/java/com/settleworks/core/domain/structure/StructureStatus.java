package com.settleworks.core.domain.structure;

public enum StructureStatus {
    BLUEPRINT,
    UNDER_CONSTRUCTION,
    COMPLETE,
    DAMAGED,
    DESTROYED;

    public boolean isOperational() {
        return this == COMPLETE;
    }
}
