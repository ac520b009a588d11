package com.settleworks.core.economy;

import java.util.List;

/**
 * One consumption tick. Starvation is a flag, not an error.
 */
public record ConsumptionResult(
        double totalDemand,
        double foodConsumed,
        double foodRemaining,
        boolean starvationOccurred,
        List<String> affectedSettlerIds,
        List<String> deaths,
        int aliveCount,
        int workingCount,
        int idleCount
) {

    public ConsumptionResult {
        affectedSettlerIds = List.copyOf(affectedSettlerIds);
        deaths = List.copyOf(deaths);
    }
}
