package com.settleworks.core.economy;

import com.settleworks.core.domain.resources.ResourceAmounts;
import com.settleworks.core.domain.resources.ResourceType;

import java.util.Map;

public record OverflowReport(boolean overflowed, double totalDumped, Map<ResourceType, Double> dumped) {

    public OverflowReport {
        dumped = ResourceAmounts.immutableCopy(dumped);
    }

    public static OverflowReport none() {
        return new OverflowReport(false, 0.0, Map.of());
    }

    public double dumpedOf(ResourceType type) {
        return dumped.getOrDefault(type, 0.0);
    }
}
