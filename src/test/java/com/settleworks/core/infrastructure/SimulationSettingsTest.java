package com.settleworks.core.infrastructure;

import com.settleworks.core.domain.resources.ResourceType;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SimulationSettingsTest {

    @Test
    void defaultsMatchBundledProperties() {
        SimulationSettings fromFile = SimulationSettings.from(CoreConfig.load());
        SimulationSettings builtIn = SimulationSettings.defaults();

        assertEquals(builtIn.worldWidth(), fromFile.worldWidth());
        assertEquals(builtIn.chunkSize(), fromFile.chunkSize());
        assertEquals(builtIn.workingFoodPerTick(), fromFile.workingFoodPerTick(), 1e-9);
        assertEquals(builtIn.unitValues(), fromFile.unitValues());
        assertEquals(5000, builtIn.tickIntervalMillis());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties p = new Properties();
        p.setProperty("spatial.chunk_size", "16");
        p.setProperty("resource.value.food", "0.25");

        SimulationSettings s = SimulationSettings.from(new CoreConfig(p));

        assertEquals(16, s.chunkSize());
        assertEquals(0.25, s.unitValue(ResourceType.FOOD), 1e-9);
        assertEquals(1.0, s.unitValue(ResourceType.WOOD), 1e-9);
    }

    @Test
    void malformedNumbersFallBackToDefaults() {
        Properties p = new Properties();
        p.setProperty("world.width", "wide");
        p.setProperty("storage.base_capacity", "lots");

        SimulationSettings s = SimulationSettings.from(new CoreConfig(p));

        assertEquals(100, s.worldWidth());
        assertEquals(100.0, s.baseStorageCapacity(), 1e-9);
    }

    @Test
    void invalidValuesAreRejected() {
        Properties p = new Properties();
        p.setProperty("spatial.chunk_size", "0");

        assertThrows(IllegalArgumentException.class, () -> SimulationSettings.from(new CoreConfig(p)));
    }
}
