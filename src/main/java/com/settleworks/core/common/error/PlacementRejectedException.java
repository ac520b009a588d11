package com.settleworks.core.common.error;

public class PlacementRejectedException extends SettlementException {

    public PlacementRejectedException(String message) {
        super(message);
    }
}
