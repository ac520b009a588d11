package com.settleworks.core.managers;

import com.settleworks.core.TestFixtures;
import com.settleworks.core.common.GridPosition;
import com.settleworks.core.common.Vector3Int;
import com.settleworks.core.common.error.*;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.domain.structure.Structure;
import com.settleworks.core.domain.structure.StructureStatus;
import com.settleworks.core.economy.TickResult;
import com.settleworks.core.ports.IPlacementValidator;
import com.settleworks.core.progression.AdvancementResult;
import com.settleworks.core.progression.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettlementTest {

    @Mock
    private IPlacementValidator validator;

    private Settlement settlement;

    @BeforeEach
    void setUp() {
        settlement = TestFixtures.settlement("storage.base_capacity", "10000");
    }

    // ==========================================================
    // PLACEMENT
    // ==========================================================

    @Test
    void placingPaysTheCostAndCreatesABlueprint() {
        settlement.getLedger().deposit(ResourceType.WOOD, 50);

        PlacementResult result = settlement.placeStructure("FARM", GridPosition.of(0, 0, 0));

        assertTrue(result.placed());
        assertEquals(StructureStatus.BLUEPRINT, result.structure().status());
        assertEquals(40, settlement.getLedger().getAmount(ResourceType.WOOD), 1e-9);
        assertEquals(4, settlement.getGridIndex().occupiedCellCount());
        assertTrue(settlement.getSpatialIndex().contains(result.structure().id()));
    }

    @Test
    void unaffordablePlacementIsAnOrdinaryResult() {
        PlacementResult result = settlement.placeStructure("FARM", GridPosition.of(0, 0, 0));

        assertEquals(PlacementResult.Status.INSUFFICIENT_RESOURCES, result.status());
        assertEquals(10.0, result.missing().get(ResourceType.WOOD), 1e-9);
        assertEquals(0, settlement.getGridIndex().occupiedCellCount());
    }

    @Test
    void typesAboveTheCurrentTierAreLocked() {
        settlement.getLedger().deposit(ResourceType.WOOD, 500);

        assertEquals(PlacementResult.Status.TIER_LOCKED,
                settlement.placeStructure("WAREHOUSE", GridPosition.of(0, 0, 0)).status());
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(UnknownStructureTypeException.class,
                () -> settlement.placeStructure("SPACEPORT", GridPosition.of(0, 0, 0)));
    }

    @Test
    void blockedFootprintDoesNotSpendResources() {
        settlement.seedStructure("HOUSE", GridPosition.of(1, 0, 1), StructureStatus.COMPLETE);
        settlement.getLedger().deposit(ResourceType.WOOD, 50);

        assertThrows(RegionOccupiedException.class, () -> settlement.placeStructure("FARM", GridPosition.of(0, 0, 0)));
        assertEquals(50, settlement.getLedger().getAmount(ResourceType.WOOD), 1e-9);
    }

    @Test
    void originOutsideTheWorldIsOutOfBounds() {
        assertThrows(OutOfBoundsException.class,
                () -> settlement.seedStructure("HOUSE", GridPosition.of(-1, 0, 0), StructureStatus.COMPLETE));
    }

    @Test
    void externalValidatorCanVetoPlacement() {
        Settlement guarded = new Settlement(TestFixtures.settings(), TestFixtures.catalog(), TestFixtures.tiers(), validator);
        when(validator.validate(eq("HOUSE"), any(GridPosition.class), any(Vector3Int.class), anyCollection()))
                .thenReturn(IPlacementValidator.Verdict.deny("too close to the river"));

        PlacementRejectedException ex = assertThrows(PlacementRejectedException.class,
                () -> guarded.seedStructure("HOUSE", GridPosition.of(5, 0, 5), StructureStatus.COMPLETE));

        assertTrue(ex.getMessage().contains("too close to the river"));
        verify(validator).validate(eq("HOUSE"), eq(GridPosition.of(5, 0, 5)), eq(Vector3Int.one()), anyCollection());
        assertTrue(guarded.getStructures().isEmpty());
    }

    // ==========================================================
    // LIFECYCLE
    // ==========================================================

    @Test
    void constructionCompletesAfterTheTypesBuildTime() {
        Structure tc = settlement.seedStructure("TOWN_CENTER", GridPosition.of(10, 0, 10), StructureStatus.BLUEPRINT);

        settlement.startConstruction(tc.id());
        assertEquals(StructureStatus.UNDER_CONSTRUCTION, settlement.progressConstruction(tc.id(), 7).status());
        assertEquals(0, settlement.getEffectRegistry().size());
        assertEquals(10000, settlement.getLedger().getCapacity(), 1e-9);

        assertEquals(StructureStatus.COMPLETE, settlement.progressConstruction(tc.id(), 1).status());
        assertEquals(1, settlement.getEffectRegistry().size());
        assertEquals(10800, settlement.getLedger().getCapacity(), 1e-9);
    }

    @Test
    void progressingABlueprintIsInvalid() {
        Structure farm = settlement.seedStructure("FARM", GridPosition.of(0, 0, 0), StructureStatus.BLUEPRINT);

        assertThrows(InvalidStructureStateException.class, () -> settlement.progressConstruction(farm.id(), 1));
    }

    @Test
    void damageRemovesEffectsUntilFullyRepaired() {
        Structure tc = settlement.seedStructure("TOWN_CENTER", GridPosition.of(10, 0, 10), StructureStatus.COMPLETE);
        settlement.getLedger().deposit(ResourceType.WOOD, 200);
        settlement.getLedger().deposit(ResourceType.FOOD, 200);
        settlement.getLedger().deposit(ResourceType.STONE, 200);

        assertEquals(StructureStatus.DAMAGED, settlement.damage(tc.id(), 30).status());
        assertEquals(0, settlement.getEffectRegistry().size());
        assertEquals(1.0, settlement.getEffectRegistry().getProductionBonusAt(10, 0, 10), 1e-9);

        RepairResult first = settlement.repair(tc.id());
        assertTrue(first.repaired());
        assertEquals(195, first.structure().health());
        assertEquals(StructureStatus.DAMAGED, first.structure().status());
        assertEquals(150, settlement.getLedger().getAmount(ResourceType.WOOD), 1e-9);

        RepairResult second = settlement.repair(tc.id());
        assertEquals(200, second.structure().health());
        assertEquals(StructureStatus.COMPLETE, second.structure().status());
        assertEquals(1, settlement.getEffectRegistry().size());
    }

    @Test
    void repairWithoutResourcesReportsTheShortfall() {
        Structure farm = settlement.seedStructure("FARM", GridPosition.of(0, 0, 0), StructureStatus.COMPLETE);
        settlement.damage(farm.id(), 10);

        RepairResult result = settlement.repair(farm.id());

        assertFalse(result.repaired());
        assertEquals(5.0, result.missing().get(ResourceType.WOOD), 1e-9);
    }

    @Test
    void destroyedStructuresAreRemovedAndTheirWorkersIdled() {
        Structure farm = settlement.seedStructure("FARM", GridPosition.of(0, 0, 0), StructureStatus.COMPLETE);
        settlement.registerSettler("ann");
        settlement.assignWorker("ann", farm.id());

        Structure wreck = settlement.damage(farm.id(), 1000);

        assertEquals(StructureStatus.DESTROYED, wreck.status());
        assertTrue(settlement.getStructure(farm.id()).isEmpty());
        assertEquals(0, settlement.getGridIndex().occupiedCellCount());
        assertFalse(settlement.getConsumptionEngine().getSettler("ann").orElseThrow().isWorking());
        assertTrue(settlement.getAssignments().postOf("ann").isEmpty());
    }

    @Test
    void demolishClearsEveryIndex() {
        Structure castle = settlement.seedStructure("CASTLE", GridPosition.of(20, 0, 20), StructureStatus.COMPLETE);
        assertEquals(2, settlement.getEffectRegistry().size());

        settlement.demolish(castle.id());

        assertEquals(0, settlement.getGridIndex().occupiedCellCount());
        assertEquals(0, settlement.getSpatialIndex().size());
        assertEquals(0, settlement.getEffectRegistry().size());
        assertEquals(10000, settlement.getLedger().getCapacity(), 1e-9);
        assertThrows(StructureNotFoundException.class, () -> settlement.demolish(castle.id()));
    }

    // ==========================================================
    // WORKERS
    // ==========================================================

    @Test
    void workSlotsLimitAssignments() {
        Structure farm = settlement.seedStructure("FARM", GridPosition.of(0, 0, 0), StructureStatus.COMPLETE);
        Structure house = settlement.seedStructure("HOUSE", GridPosition.of(5, 0, 5), StructureStatus.COMPLETE);
        settlement.registerSettler("a");
        settlement.registerSettler("b");

        assertTrue(settlement.assignWorker("a", farm.id()));
        assertFalse(settlement.assignWorker("b", farm.id()));
        assertFalse(settlement.assignWorker("b", house.id()));
        assertFalse(settlement.assignWorker("nobody", farm.id()));
        assertTrue(settlement.getConsumptionEngine().getSettler("a").orElseThrow().isWorking());

        assertTrue(settlement.unassignWorker("a"));
        assertTrue(settlement.assignWorker("b", farm.id()));
    }

    // ==========================================================
    // TICK
    // ==========================================================

    @Test
    void tickRunsProductionThenConsumptionThenMorale() {
        Structure farm = settlement.seedStructure("FARM", GridPosition.of(0, 0, 0), StructureStatus.COMPLETE);
        settlement.registerSettler("ann");
        settlement.assignWorker("ann", farm.id());

        TickResult result = settlement.runTick();

        assertEquals(0, result.tick());
        assertEquals(1.0, result.produced().get(ResourceType.FOOD), 1e-9);
        assertEquals(0.5 / 12, result.consumed().get(ResourceType.FOOD), 1e-9);
        assertFalse(result.starvationOccurred());
        assertEquals(1.0 - 0.5 / 12, settlement.getLedger().getAmount(ResourceType.FOOD), 1e-9);
        assertEquals(result.morale(), settlement.getMoraleEngine().getLast());
    }

    @Test
    void productionUsesThePreviousTicksMorale() {
        Structure farm = settlement.seedStructure("FARM", GridPosition.of(0, 0, 0), StructureStatus.COMPLETE);
        settlement.registerSettler("ann");
        settlement.assignWorker("ann", farm.id());

        TickResult first = settlement.runTick();
        TickResult second = settlement.runTick();

        assertEquals(first.morale().multiplier(), second.produced().get(ResourceType.FOOD), 1e-9);
        assertEquals(1, second.tick());
    }

    @Test
    void completedCampfireLiftsMorale() {
        Settlement withFire = TestFixtures.settlement("storage.base_capacity", "10000");
        for (Settlement s : List.of(settlement, withFire)) {
            s.registerSettler("ann");
            s.getLedger().deposit(ResourceType.FOOD, 100);
        }
        Structure fire = withFire.seedStructure("CAMPFIRE", GridPosition.of(5, 0, 5), StructureStatus.COMPLETE);

        double without = settlement.runTick().morale().morale();
        double with = withFire.runTick().morale().morale();

        assertEquals(5, withFire.buildingMoraleBonus());
        assertEquals(without + 5, with, 1e-9);

        withFire.damage(fire.id(), 10);
        assertEquals(0, withFire.buildingMoraleBonus());
    }

    @Test
    void settlersStarveWithoutFood() {
        settlement.registerSettler("a");
        settlement.registerSettler("b");

        TickResult result = settlement.runTick();

        assertTrue(result.starvationOccurred());
        assertEquals(0.0, result.consumption().foodRemaining(), 1e-9);
        assertEquals(2, result.consumption().affectedSettlerIds().size());
    }

    @Test
    void housingCapacityCountsCompleteHousesOnly() {
        settlement.seedStructure("HOUSE", GridPosition.of(0, 0, 0), StructureStatus.COMPLETE);
        settlement.seedStructure("HOUSE", GridPosition.of(2, 0, 0), StructureStatus.COMPLETE);
        settlement.seedStructure("HOUSE", GridPosition.of(4, 0, 0), StructureStatus.BLUEPRINT);

        assertEquals(4, settlement.housingCapacity());
    }

    // ==========================================================
    // PROGRESSION
    // ==========================================================

    @Test
    void advancementPaysTheTierCost() {
        settlement.seedStructure("HOUSE", GridPosition.of(0, 0, 0), StructureStatus.COMPLETE);
        settlement.getLedger().deposit(ResourceType.WOOD, 25);

        AdvancementResult result = settlement.requestAdvancement(Tier.PERMANENT);

        assertTrue(result.advanceable());
        assertEquals(Tier.PERMANENT, settlement.getTier());
        assertEquals(5, settlement.getLedger().getAmount(ResourceType.WOOD), 1e-9);
        assertEquals(AdvancementResult.Reason.SKIP_TIER, settlement.requestAdvancement(Tier.CASTLE).reason());
    }

    @Test
    void failedAdvancementChangesNothing() {
        settlement.getLedger().deposit(ResourceType.WOOD, 25);

        AdvancementResult result = settlement.requestAdvancement(Tier.PERMANENT);

        assertFalse(result.advanceable());
        assertEquals(Tier.SURVIVAL, settlement.getTier());
        assertEquals(25, settlement.getLedger().getAmount(ResourceType.WOOD), 1e-9);
    }

    @Test
    void integrityHoldsAfterMixedOperations() {
        Structure a = settlement.seedStructure("CASTLE", GridPosition.of(0, 0, 0), StructureStatus.COMPLETE);
        settlement.seedStructure("MARKET", GridPosition.of(30, 0, 30), StructureStatus.COMPLETE);
        Structure c = settlement.seedStructure("WATCHTOWER", GridPosition.of(8, 0, 8), StructureStatus.COMPLETE);
        settlement.damage(c.id(), 10);
        settlement.demolish(a.id());

        SettlementIntegrityValidator.Report report = settlement.validateIntegrity();

        assertTrue(report.valid(), () -> String.join("\n", report.problems()));
    }

    @Test
    void survivalToTownIsReachableByBuildingAlone() {
        settlement.getLedger().deposit(ResourceType.WOOD, 1000);
        settlement.getLedger().deposit(ResourceType.FOOD, 500);
        settlement.getLedger().deposit(ResourceType.STONE, 500);

        PlacementResult house = settlement.placeStructure("HOUSE", GridPosition.of(0, 0, 0));
        assertTrue(house.placed());
        assertEquals(PlacementResult.Status.TIER_LOCKED,
                settlement.placeStructure("TOWN_CENTER", GridPosition.of(10, 0, 10)).status());

        settlement.startConstruction(house.structure().id());
        settlement.progressConstruction(house.structure().id(), 2);
        assertTrue(settlement.requestAdvancement(Tier.PERMANENT).advanceable());

        PlacementResult townCenter = settlement.placeStructure("TOWN_CENTER", GridPosition.of(10, 0, 10));
        assertTrue(townCenter.placed(), townCenter.message());
        assertEquals(PlacementResult.Status.TIER_LOCKED,
                settlement.placeStructure("CASTLE", GridPosition.of(40, 0, 40)).status());

        settlement.startConstruction(townCenter.structure().id());
        settlement.progressConstruction(townCenter.structure().id(), 8);
        AdvancementResult town = settlement.requestAdvancement(Tier.TOWN);

        assertTrue(town.advanceable(), town.message());
        assertEquals(Tier.TOWN, settlement.getTier());
        assertEquals(300, settlement.getLedger().getAmount(ResourceType.STONE), 1e-9);
        assertEquals(PlacementResult.Status.INSUFFICIENT_RESOURCES,
                settlement.placeStructure("CASTLE", GridPosition.of(40, 0, 40)).status());
    }
}
