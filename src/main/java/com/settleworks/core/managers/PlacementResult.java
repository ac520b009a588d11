package com.settleworks.core.managers;

import com.settleworks.core.domain.resources.ResourceAmounts;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.domain.structure.Structure;

import java.util.Map;

public record PlacementResult(Status status, Structure structure, Map<ResourceType, Double> missing, String message) {

    public enum Status {
        PLACED,
        TIER_LOCKED,
        INSUFFICIENT_RESOURCES
    }

    public PlacementResult {
        missing = ResourceAmounts.immutableCopy(missing);
    }

    public boolean placed() {
        return status == Status.PLACED;
    }
}
