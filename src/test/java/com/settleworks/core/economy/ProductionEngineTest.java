package com.settleworks.core.economy;

import com.settleworks.core.TestFixtures;
import com.settleworks.core.common.GridPosition;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.domain.structure.Structure;
import com.settleworks.core.domain.structure.StructureStatus;
import com.settleworks.core.domain.structure.registry.StructureCatalog;
import com.settleworks.core.managers.EffectRegistry;
import com.settleworks.core.managers.SpatialIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProductionEngineTest {

    private final StructureCatalog catalog = TestFixtures.catalog();
    private final Map<String, Structure> structures = new LinkedHashMap<>();
    private final WorkerAssignments workers = new WorkerAssignments();

    private SpatialIndex spatial;
    private EffectRegistry effects;
    private StorageLedger ledger;
    private ProductionEngine engine;

    @BeforeEach
    void setUp() {
        spatial = new SpatialIndex(10, structures::get);
        effects = new EffectRegistry(spatial, catalog);
        ledger = new StorageLedger(10_000);
        engine = new ProductionEngine(effects, ledger, catalog, 2.0);
    }

    private Structure add(String id, String type, int x, int z, StructureStatus status) {
        var stats = catalog.getStats(type);
        Structure s = new Structure(id, type, GridPosition.of(x, 0, z), stats.dimensions(), status,
                stats.maxHealth(), stats.maxHealth(), 0);
        structures.put(id, s);
        spatial.insert(s);
        if (s.isComplete() && stats.hasEffects()) effects.registerEffects(s);
        return s;
    }

    @Test
    void tickOrdinalStartsAtZeroAndAdvancesEvenWithoutProducers() {
        assertEquals(0, engine.runTick(structures.values(), workers, 1.0).tick());
        assertEquals(1, engine.runTick(structures.values(), workers, 1.0).tick());
        assertEquals(2, engine.getNextTick());
    }

    @Test
    void onlyCompleteStaffedStructuresProduce() {
        add("farm", "FARM", 0, 0, StructureStatus.COMPLETE);
        add("blueprint", "FARM", 5, 0, StructureStatus.BLUEPRINT);
        add("unstaffed", "FARM", 10, 0, StructureStatus.COMPLETE);
        add("damaged", "FARM", 15, 0, StructureStatus.DAMAGED);
        workers.assign("s1", "farm");
        workers.assign("s2", "blueprint");
        workers.assign("s3", "damaged");

        ProductionResult result = engine.runTick(structures.values(), workers, 1.0);

        assertEquals(1.0, result.producedOf(ResourceType.FOOD), 1e-9);
        assertEquals(1, result.yields().size());
        assertEquals("farm", result.yields().get(0).structureId());
        assertEquals(1.0, ledger.getAmount(ResourceType.FOOD), 1e-9);
    }

    @Test
    void moraleAndAuraMultiplyBaseYield() {
        add("tc", "TOWN_CENTER", 0, 0, StructureStatus.COMPLETE);
        add("farm", "FARM", 20, 0, StructureStatus.COMPLETE);
        workers.assign("s1", "farm");

        ProductionResult result = engine.runTick(structures.values(), workers, 1.1);

        assertEquals(1.05 * 1.1, result.producedOf(ResourceType.FOOD), 1e-9);
    }

    @Test
    void partialStaffingScalesOutput() {
        add("mill", "LUMBER_MILL", 0, 0, StructureStatus.COMPLETE);
        workers.assign("s1", "mill");

        assertEquals(0.5, engine.runTick(structures.values(), workers, 1.0).producedOf(ResourceType.WOOD), 1e-9);

        workers.assign("s2", "mill");
        assertEquals(1.0, engine.runTick(structures.values(), workers, 1.0).producedOf(ResourceType.WOOD), 1e-9);
    }

    @Test
    void combinedMultiplierIsCapped() {
        add("farm", "FARM", 0, 0, StructureStatus.COMPLETE);
        workers.assign("s1", "farm");

        assertEquals(2.0, engine.runTick(structures.values(), workers, 5.0).producedOf(ResourceType.FOOD), 1e-9);
    }

    @Test
    void overflowIsResolvedOnceAfterTheWholeBatch() {
        ledger = new StorageLedger(1);
        engine = new ProductionEngine(effects, ledger, catalog, 2.0);
        add("farm", "FARM", 0, 0, StructureStatus.COMPLETE);
        add("mill", "LUMBER_MILL", 10, 0, StructureStatus.COMPLETE);
        workers.assign("s1", "farm");
        workers.assign("s2", "mill");
        workers.assign("s3", "mill");

        ProductionResult result = engine.runTick(structures.values(), workers, 1.0);

        assertTrue(result.overflow().overflowed());
        assertEquals(1.0, result.overflow().dumpedOf(ResourceType.WOOD), 1e-9);
        assertEquals(1.0, ledger.getAmount(ResourceType.FOOD), 1e-9);
        assertEquals(0.0, ledger.getAmount(ResourceType.WOOD), 1e-9);
    }
}
