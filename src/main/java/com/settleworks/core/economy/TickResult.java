package com.settleworks.core.economy;

import com.settleworks.core.domain.resources.ResourceAmounts;
import com.settleworks.core.domain.resources.ResourceType;

import java.util.Map;

/**
 * Report of one settlement tick. Never persisted.
 */
public record TickResult(
        long tick,
        Map<ResourceType, Double> produced,
        Map<ResourceType, Double> consumed,
        OverflowReport overflow,
        ConsumptionResult consumption,
        MoraleSnapshot morale
) {

    public TickResult {
        produced = ResourceAmounts.immutableCopy(produced);
        consumed = ResourceAmounts.immutableCopy(consumed);
    }

    public boolean starvationOccurred() {
        return consumption.starvationOccurred();
    }
}
