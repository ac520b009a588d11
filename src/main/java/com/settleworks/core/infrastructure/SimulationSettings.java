package com.settleworks.core.infrastructure;

import com.settleworks.core.domain.resources.ResourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable tuning values for one settlement. Built from a {@link CoreConfig}; every settlement
 * gets its own instance.
 */
public record SimulationSettings(
        int worldWidth,
        int worldHeight,
        int worldDepth,
        int chunkSize,
        double baseStorageCapacity,
        double workingFoodPerTick,
        double idleFoodPerTick,
        double dailyFoodPerSettler,
        double starvationHappinessPenalty,
        double starvationHealthPenalty,
        double settlerMaxHealth,
        double productionMultiplierCap,
        long tickIntervalMillis,
        Map<ResourceType, Double> unitValues
) {

    // 12 ticks of 5 seconds per simulated minute
    public static final int TICKS_PER_MINUTE = 12;

    public SimulationSettings {
        if (worldWidth <= 0 || worldHeight <= 0 || worldDepth <= 0) {
            throw new IllegalArgumentException("World extents must be > 0");
        }
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
        if (baseStorageCapacity < 0) throw new IllegalArgumentException("baseStorageCapacity must be >= 0");
        if (settlerMaxHealth <= 0) throw new IllegalArgumentException("settlerMaxHealth must be > 0");
        Map<ResourceType, Double> values = new EnumMap<>(ResourceType.class);
        for (ResourceType t : ResourceType.values()) {
            Double v = unitValues == null ? null : unitValues.get(t);
            values.put(t, v != null ? v : t.defaultUnitValue());
        }
        unitValues = Collections.unmodifiableMap(values);
    }

    public static SimulationSettings defaults() {
        return from(CoreConfig.defaults());
    }

    public static SimulationSettings from(CoreConfig config) {
        Map<ResourceType, Double> values = new EnumMap<>(ResourceType.class);
        for (ResourceType t : ResourceType.values()) {
            values.put(t, config.getDouble("resource.value." + t.key(), t.defaultUnitValue()));
        }

        return new SimulationSettings(
                config.getInt("world.width", 100),
                config.getInt("world.height", 50),
                config.getInt("world.depth", 100),
                config.getInt("spatial.chunk_size", 10),
                config.getDouble("storage.base_capacity", 100.0),
                config.getDouble("consumption.working_per_tick", 0.5 / TICKS_PER_MINUTE),
                config.getDouble("consumption.idle_per_tick", 0.1 / TICKS_PER_MINUTE),
                config.getDouble("morale.daily_food_per_settler", 0.5),
                config.getDouble("starvation.happiness_penalty", 10.0),
                config.getDouble("starvation.health_penalty", 10.0),
                config.getDouble("settler.max_health", 100.0),
                config.getDouble("production.multiplier_cap", 2.0),
                config.getInt("loop.tick_interval_ms", 5000),
                values
        );
    }

    public double unitValue(ResourceType type) {
        return unitValues.get(type);
    }
}
