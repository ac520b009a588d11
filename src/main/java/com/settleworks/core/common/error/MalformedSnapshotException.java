package com.settleworks.core.common.error;

public class MalformedSnapshotException extends SettlementException {

    public MalformedSnapshotException(String message) {
        super(message);
    }

    public MalformedSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
