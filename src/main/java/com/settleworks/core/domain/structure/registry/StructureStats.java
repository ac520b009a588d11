package com.settleworks.core.domain.structure.registry;

import com.settleworks.core.common.Vector3Int;
import com.settleworks.core.domain.effects.ZoneKind;
import com.settleworks.core.domain.resources.ResourceAmounts;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.progression.Tier;

import java.util.Map;

/**
 * Static definition of a structure type. Maps are immutable views, so a caller can never
 * corrupt the catalog through a returned value.
 * <p>
 * {@code unlockTier} defaults to {@code tier}; a tier's landmark is unlocked one tier earlier so it can
 * be built before the advancement that requires it.
 */
public record StructureStats(
        String id,
        Tier tier,
        Tier unlockTier,
        Vector3Int dimensions,
        Map<ResourceType, Double> cost,
        Map<ResourceType, Double> production,
        Map<ResourceType, Double> storage,
        int workSlots,
        int housingCapacity,
        int maxHealth,
        int constructionTicks,
        int moraleBonus,
        AuraSpec aura,
        ZoneSpec zone
) {

    public record AuraSpec(double radius, double multiplier) {
    }

    public record ZoneSpec(ZoneKind kind, double radius, double multiplier) {
    }

    public StructureStats {
        if (unlockTier == null) unlockTier = tier;
        cost = ResourceAmounts.immutableCopy(cost);
        production = ResourceAmounts.immutableCopy(production);
        storage = ResourceAmounts.immutableCopy(storage);
    }

    /** Buildable once the settlement has reached {@link #unlockTier()}. */
    public boolean isBuildableAt(Tier current) {
        return !unlockTier.isAfter(current);
    }

    public boolean isProducer() {
        return production.values().stream().anyMatch(v -> v > 0);
    }

    public boolean hasEffects() {
        return aura != null || zone != null;
    }

    public double totalStorage() {
        return ResourceAmounts.total(storage);
    }

    /** Workers needed for full output; producers without declared slots count as one. */
    public int effectiveWorkSlots() {
        return workSlots > 0 ? workSlots : 1;
    }
}
