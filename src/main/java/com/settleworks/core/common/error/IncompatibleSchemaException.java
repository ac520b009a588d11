package com.settleworks.core.common.error;

public class IncompatibleSchemaException extends SettlementException {

    private final int foundVersion;
    private final int expectedVersion;

    public IncompatibleSchemaException(int foundVersion, int expectedVersion) {
        super("Snapshot schema version " + foundVersion + " is not supported (expected " + expectedVersion + ")");
        this.foundVersion = foundVersion;
        this.expectedVersion = expectedVersion;
    }

    public int getFoundVersion() { return foundVersion; }
    public int getExpectedVersion() { return expectedVersion; }
}
