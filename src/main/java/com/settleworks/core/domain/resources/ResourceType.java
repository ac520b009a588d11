package com.settleworks.core.domain.resources;

import java.util.Locale;

/**
 * Resource kinds stored in the ledger. The default unit value drives the overflow dump order
 * (cheapest first) unless the settings override it.
 */
public enum ResourceType {
    FOOD(12.0),
    WOOD(1.0),
    STONE(2.0),
    GOLD(5.0),
    ESSENCE(8.0),
    CRYSTAL(10.0);

    private final double defaultUnitValue;

    ResourceType(double defaultUnitValue) {
        this.defaultUnitValue = defaultUnitValue;
    }

    public double defaultUnitValue() {
        return defaultUnitValue;
    }

    /** Lower-case key used in JSON tables and properties ("wood", "food", ...). */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResourceType fromKey(String key) {
        if (key == null) throw new IllegalArgumentException("Resource key is null");
        try {
            return ResourceType.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resource type: " + key, e);
        }
    }
}
