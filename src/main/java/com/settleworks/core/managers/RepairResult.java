package com.settleworks.core.managers;

import com.settleworks.core.domain.resources.ResourceAmounts;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.domain.structure.Structure;

import java.util.Map;

public record RepairResult(boolean repaired, Structure structure, Map<ResourceType, Double> missing) {

    public RepairResult {
        missing = ResourceAmounts.immutableCopy(missing);
    }
}
