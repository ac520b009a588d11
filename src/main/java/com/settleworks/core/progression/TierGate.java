package com.settleworks.core.progression;

import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.domain.structure.Structure;

import java.util.*;

/**
 * AND-gated tier advancement: one step at a time, every structure count and every resource
 * threshold of the target tier must hold.
 */
public class TierGate {

    private final TierRequirements requirements;

    public TierGate(TierRequirements requirements) {
        this.requirements = Objects.requireNonNull(requirements, "requirements");
    }

    public AdvancementResult canAdvance(Tier targetTier, Collection<Structure> structures,
                                        Map<ResourceType, Double> resources, Tier currentTier) {
        if (targetTier == null || currentTier == null) {
            return AdvancementResult.rejected(AdvancementResult.Reason.INVALID_TIER,
                    "Invalid tier", currentTier, targetTier);
        }

        int steps = targetTier.stepsFrom(currentTier);
        if (steps <= 0) {
            return AdvancementResult.rejected(AdvancementResult.Reason.BACKWARDS,
                    "Cannot advance backwards from " + currentTier + " to " + targetTier, currentTier, targetTier);
        }
        if (steps > 1) {
            return AdvancementResult.rejected(AdvancementResult.Reason.SKIP_TIER,
                    "Cannot skip tiers: " + currentTier + " -> " + targetTier, currentTier, targetTier);
        }

        List<ResourceType> absent = missingKeys(resources);
        if (!absent.isEmpty()) {
            return AdvancementResult.rejected(AdvancementResult.Reason.MALFORMED_RESOURCES,
                    "Resource map is missing " + absent, currentTier, targetTier);
        }

        TierRequirements.Requirement req = requirements.forTier(targetTier);
        Map<String, Integer> counts = countComplete(structures);

        List<AdvancementResult.Progress> progress = new ArrayList<>();
        for (var e : req.structures().entrySet()) {
            progress.add(new AdvancementResult.Progress(AdvancementResult.Kind.STRUCTURE, e.getKey(),
                    counts.getOrDefault(e.getKey(), 0), e.getValue()));
        }
        for (var e : req.resources().entrySet()) {
            progress.add(new AdvancementResult.Progress(AdvancementResult.Kind.RESOURCE, e.getKey().key(),
                    resources.get(e.getKey()), e.getValue()));
        }

        List<AdvancementResult.Progress> missing = progress.stream().filter(p -> !p.met()).toList();
        if (!missing.isEmpty()) {
            return new AdvancementResult(false, AdvancementResult.Reason.REQUIREMENTS_UNMET,
                    missing.size() + " requirement(s) unmet for " + targetTier,
                    currentTier, targetTier, progress, missing);
        }
        return new AdvancementResult(true, AdvancementResult.Reason.READY,
                "Ready to advance to " + targetTier, currentTier, targetTier, progress, List.of());
    }

    public TierRequirements.Requirement requirementFor(Tier tier) {
        return requirements.forTier(tier);
    }

    private static List<ResourceType> missingKeys(Map<ResourceType, Double> resources) {
        if (resources == null) return List.of(ResourceType.values());
        List<ResourceType> absent = new ArrayList<>();
        for (ResourceType t : ResourceType.values()) {
            if (resources.get(t) == null) absent.add(t);
        }
        return absent;
    }

    private static Map<String, Integer> countComplete(Collection<Structure> structures) {
        Map<String, Integer> counts = new HashMap<>();
        if (structures == null) return counts;
        for (Structure s : structures) {
            if (s.isComplete()) counts.merge(s.typeId(), 1, Integer::sum);
        }
        return counts;
    }
}
