package com.settleworks.core.economy;

import com.settleworks.core.domain.resources.ResourceAmounts;
import com.settleworks.core.domain.resources.ResourceType;

import java.util.List;
import java.util.Map;

public record ProductionResult(
        long tick,
        Map<ResourceType, Double> produced,
        List<StructureYield> yields,
        OverflowReport overflow
) {

    public record StructureYield(String structureId, double multiplier, Map<ResourceType, Double> produced) {
        public StructureYield {
            produced = ResourceAmounts.immutableCopy(produced);
        }
    }

    public ProductionResult {
        produced = ResourceAmounts.immutableCopy(produced);
        yields = List.copyOf(yields);
    }

    public double producedOf(ResourceType type) {
        return produced.getOrDefault(type, 0.0);
    }
}
