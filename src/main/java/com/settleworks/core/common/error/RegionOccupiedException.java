package com.settleworks.core.common.error;

import com.settleworks.core.common.GridPosition;

import java.util.List;

public class RegionOccupiedException extends SettlementException {

    private final List<GridPosition> blockedCells;

    public RegionOccupiedException(String message, List<GridPosition> blockedCells) {
        super(message);
        this.blockedCells = List.copyOf(blockedCells);
    }

    public List<GridPosition> getBlockedCells() {
        return blockedCells;
    }
}
