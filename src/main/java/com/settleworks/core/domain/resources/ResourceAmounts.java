package com.settleworks.core.domain.resources;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Helpers for resource maps. Everything returned here is an independent copy or an immutable view.
 */
public final class ResourceAmounts {

    private ResourceAmounts() {
    }

    public static Map<ResourceType, Double> empty() {
        return new EnumMap<>(ResourceType.class);
    }

    /** A full map with every resource type present at zero. */
    public static Map<ResourceType, Double> zeroed() {
        Map<ResourceType, Double> out = new EnumMap<>(ResourceType.class);
        for (ResourceType t : ResourceType.values()) out.put(t, 0.0);
        return out;
    }

    public static Map<ResourceType, Double> immutableCopy(Map<ResourceType, Double> source) {
        Map<ResourceType, Double> copy = new EnumMap<>(ResourceType.class);
        if (source != null) {
            for (var e : source.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                copy.put(e.getKey(), e.getValue());
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    public static void addInto(Map<ResourceType, Double> target, ResourceType type, double amount) {
        target.merge(type, amount, Double::sum);
    }

    public static double total(Map<ResourceType, Double> amounts) {
        double sum = 0.0;
        for (Double v : amounts.values()) {
            if (v != null) sum += v;
        }
        return sum;
    }
}
