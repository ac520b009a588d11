package com.settleworks.core.managers;

import com.settleworks.core.common.GridPosition;
import com.settleworks.core.common.error.*;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.domain.structure.Structure;
import com.settleworks.core.domain.structure.StructureStatus;
import com.settleworks.core.domain.structure.registry.StructureCatalog;
import com.settleworks.core.domain.structure.registry.StructureStats;
import com.settleworks.core.economy.*;
import com.settleworks.core.infrastructure.CoreConfig;
import com.settleworks.core.infrastructure.SimulationSettings;
import com.settleworks.core.persistence.SettlementSnapshot;
import com.settleworks.core.persistence.SnapshotCodec;
import com.settleworks.core.progression.AdvancementResult;
import com.settleworks.core.progression.Tier;
import com.settleworks.core.progression.TierGate;
import com.settleworks.core.progression.TierRequirements;
import com.settleworks.core.ports.IPlacementValidator;

import java.util.*;

/**
 * Simulation context of one settlement. Owns the canonical structure records and every engine;
 * nothing here is shared between settlements.
 * <p>
 * Not thread-safe: the driver must serialize {@link #runTick()} and all mutations.
 */
public class Settlement {

    private final SimulationSettings settings;
    private final StructureCatalog catalog;
    private final IPlacementValidator placementValidator;

    private final Map<String, Structure> structures = new LinkedHashMap<>();

    private final GridIndex gridIndex;
    private final SpatialIndex spatialIndex;
    private final EffectRegistry effectRegistry;
    private final StorageLedger ledger;
    private final WorkerAssignments assignments = new WorkerAssignments();
    private final ProductionEngine productionEngine;
    private final ConsumptionEngine consumptionEngine;
    private final MoraleEngine moraleEngine;
    private final TierGate tierGate;

    private Tier tier = Tier.SURVIVAL;
    private int expansionCount = 0;
    private long structureSequence = 0;

    public Settlement(SimulationSettings settings, StructureCatalog catalog, TierRequirements tiers,
                      IPlacementValidator placementValidator) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.placementValidator = placementValidator != null ? placementValidator : IPlacementValidator.permissive();

        this.gridIndex = new GridIndex(settings.worldWidth(), settings.worldHeight(), settings.worldDepth());
        this.spatialIndex = new SpatialIndex(settings.chunkSize(), structures::get);
        this.effectRegistry = new EffectRegistry(spatialIndex, catalog);
        this.ledger = new StorageLedger(settings.baseStorageCapacity(), settings.unitValues());
        this.productionEngine = new ProductionEngine(effectRegistry, ledger, catalog, settings.productionMultiplierCap());
        this.consumptionEngine = new ConsumptionEngine(
                settings.workingFoodPerTick(), settings.idleFoodPerTick(),
                settings.starvationHappinessPenalty(), settings.starvationHealthPenalty(),
                settings.settlerMaxHealth());
        this.moraleEngine = new MoraleEngine(settings.dailyFoodPerSettler());
        this.tierGate = new TierGate(Objects.requireNonNull(tiers, "tiers"));
    }

    /** Settlement built from the bundled configuration and tables. */
    public static Settlement createDefault() {
        return new Settlement(SimulationSettings.from(CoreConfig.load()), StructureCatalog.loadDefault(),
                TierRequirements.loadDefault(), IPlacementValidator.permissive());
    }

    // ==========================================================
    // TICK
    // ==========================================================

    /**
     * One simulation step: production (with the previous morale multiplier), then consumption,
     * then morale on the post-consumption food reserve.
     */
    public TickResult runTick() {
        ProductionResult production = productionEngine.runTick(
                List.copyOf(structures.values()), assignments, moraleEngine.getMoraleMultiplier());

        ConsumptionResult consumption = consumptionEngine.runTick(ledger.getAmount(ResourceType.FOOD));
        double eaten = ledger.withdraw(ResourceType.FOOD, consumption.foodConsumed());
        for (String dead : consumption.deaths()) {
            assignments.unassign(dead);
        }

        MoraleSnapshot morale = moraleEngine.computeMorale(consumptionEngine.getSettlers(),
                ledger.getAmount(ResourceType.FOOD), housingCapacity(), expansionCount, buildingMoraleBonus());

        Map<ResourceType, Double> consumed = new EnumMap<>(ResourceType.class);
        if (eaten > 0) consumed.put(ResourceType.FOOD, eaten);

        return new TickResult(production.tick(), production.produced(), consumed, production.overflow(), consumption, morale);
    }

    // ==========================================================
    // PLACEMENT
    // ==========================================================

    /**
     * Pays for and places a BLUEPRINT of the given type.
     *
     * @throws UnknownStructureTypeException for a type missing from the catalog
     * @throws OutOfBoundsException          if the origin is outside the world
     * @throws PlacementRejectedException    if the external validator refuses the spot
     * @throws RegionOccupiedException       if the footprint is not free
     */
    public PlacementResult placeStructure(String typeId, GridPosition position) {
        StructureStats stats = catalog.getStats(typeId);

        if (!stats.isBuildableAt(tier)) {
            return new PlacementResult(PlacementResult.Status.TIER_LOCKED, null, Map.of(),
                    typeId + " requires tier " + stats.unlockTier() + " (current " + tier + ")");
        }

        checkPlacement(stats, position);

        Map<ResourceType, Double> missing = ledger.missingFor(stats.cost());
        if (!missing.isEmpty()) {
            return new PlacementResult(PlacementResult.Status.INSUFFICIENT_RESOURCES, null, missing,
                    "Not enough resources for " + typeId);
        }
        ledger.spend(stats.cost());

        Structure s = Structure.blueprint(nextStructureId(), typeId, position, stats.dimensions(), stats.maxHealth());
        admit(s);
        System.out.println("[Settlement] Placed " + typeId + " " + s.id() + " at " + position);
        return new PlacementResult(PlacementResult.Status.PLACED, s, Map.of(), "Placed " + s.id());
    }

    /**
     * Cost-free placement for world setup. DESTROYED is not a valid starting status.
     */
    public Structure seedStructure(String typeId, GridPosition position, StructureStatus status) {
        if (status == StructureStatus.DESTROYED) {
            throw new InvalidStructureStateException("Cannot seed a DESTROYED structure");
        }
        StructureStats stats = catalog.getStats(typeId);
        checkPlacement(stats, position);

        Structure s = new Structure(nextStructureId(), typeId, position, stats.dimensions(), status,
                stats.maxHealth(), stats.maxHealth(), status == StructureStatus.COMPLETE ? stats.constructionTicks() : 0);
        admit(s);
        return s;
    }

    private void checkPlacement(StructureStats stats, GridPosition position) {
        gridIndex.validateBounds(position.x(), position.y(), position.z());

        IPlacementValidator.Verdict verdict = placementValidator.validate(
                stats.id(), position, stats.dimensions(), List.copyOf(structures.values()));
        if (verdict == null || !verdict.allowed()) {
            String reason = verdict == null ? "no verdict" : verdict.reason();
            throw new PlacementRejectedException("Placement of " + stats.id() + " at " + position + " rejected: " + reason);
        }

        GridIndex.RegionCheck check = gridIndex.isRegionFree(position.x(), position.y(), position.z(),
                stats.dimensions().x(), stats.dimensions().y(), stats.dimensions().z());
        if (!check.free()) {
            throw new RegionOccupiedException("Footprint of " + stats.id() + " at " + position + " is blocked",
                    check.blocked().stream().map(GridIndex.BlockedCell::cell).toList());
        }
    }

    private void admit(Structure s) {
        gridIndex.place(s);
        structures.put(s.id(), s);
        spatialIndex.insert(s);
        if (s.isComplete()) {
            effectRegistry.registerEffects(s);
            recalculateCapacity();
        }
    }

    private String nextStructureId() {
        String id;
        do {
            id = "structure_" + (++structureSequence);
        } while (structures.containsKey(id));
        return id;
    }

    // ==========================================================
    // LIFECYCLE
    // ==========================================================

    public Structure startConstruction(String id) {
        Structure s = require(id);
        if (s.status() != StructureStatus.BLUEPRINT) {
            throw new InvalidStructureStateException(id + " is " + s.status() + ", expected BLUEPRINT");
        }
        Structure next = s.withStatus(StructureStatus.UNDER_CONSTRUCTION);
        if (catalog.getStats(s.typeId()).constructionTicks() == 0) {
            next = next.withStatus(StructureStatus.COMPLETE);
        }
        return transition(s, next);
    }

    /**
     * Advances construction; the structure becomes COMPLETE once its type's construction time is reached.
     */
    public Structure progressConstruction(String id, int ticks) {
        if (ticks < 0) throw new IllegalArgumentException("ticks must be >= 0");
        Structure s = require(id);
        if (s.status() != StructureStatus.UNDER_CONSTRUCTION) {
            throw new InvalidStructureStateException(id + " is " + s.status() + ", expected UNDER_CONSTRUCTION");
        }
        int needed = catalog.getStats(s.typeId()).constructionTicks();
        int progress = Math.min(needed, s.constructionProgress() + ticks);

        Structure next = s.withConstructionProgress(progress);
        if (progress >= needed) {
            next = next.withStatus(StructureStatus.COMPLETE);
            System.out.println("[Settlement] " + s.typeId() + " " + id + " completed");
        }
        return transition(s, next);
    }

    /**
     * @return the updated record; DESTROYED when health ran out, in which case it is already removed
     */
    public Structure damage(String id, int amount) {
        if (amount < 0) throw new IllegalArgumentException("damage must be >= 0");
        Structure s = require(id);

        Structure next = s.withHealth(s.health() - amount);
        if (next.status() == StructureStatus.COMPLETE && next.health() < next.maxHealth()) {
            next = next.withStatus(StructureStatus.DAMAGED);
        }
        if (next.status() == StructureStatus.DESTROYED) {
            System.err.println("⚠️ [Settlement] " + s.typeId() + " " + id + " destroyed");
            removeStructure(s);
            return next;
        }
        return transition(s, next);
    }

    /**
     * Pays the type's repair cost and restores a fixed amount of health. Back to COMPLETE at full health.
     */
    public RepairResult repair(String id) {
        Structure s = require(id);
        if (s.status() != StructureStatus.DAMAGED) {
            throw new InvalidStructureStateException(id + " is " + s.status() + ", only DAMAGED structures can be repaired");
        }
        Map<ResourceType, Double> cost = catalog.repairCost(s.typeId());
        Map<ResourceType, Double> missing = ledger.missingFor(cost);
        if (!missing.isEmpty()) return new RepairResult(false, s, missing);

        ledger.spend(cost);
        Structure next = s.withHealth(s.health() + catalog.repairAmount());
        if (next.health() >= next.maxHealth()) next = next.withStatus(StructureStatus.COMPLETE);
        return new RepairResult(true, transition(s, next), Map.of());
    }

    /**
     * @throws StructureNotFoundException for an unknown id
     */
    public void demolish(String id) {
        removeStructure(require(id));
        System.out.println("[Settlement] Demolished " + id);
    }

    private Structure transition(Structure before, Structure after) {
        structures.put(after.id(), after);
        if (before.isComplete() && !after.isComplete()) {
            effectRegistry.unregisterEffects(after.id());
            recalculateCapacity();
        } else if (!before.isComplete() && after.isComplete()) {
            effectRegistry.registerEffects(after);
            recalculateCapacity();
        }
        return after;
    }

    private void removeStructure(Structure s) {
        effectRegistry.unregisterEffects(s.id());
        for (String settlerId : assignments.clearStructure(s.id())) {
            consumptionEngine.setWorking(settlerId, false);
        }
        gridIndex.remove(s.id());
        spatialIndex.remove(s.id());
        structures.remove(s.id());
        if (s.isComplete()) recalculateCapacity();
    }

    private void recalculateCapacity() {
        double capacity = settings.baseStorageCapacity();
        for (Structure s : structures.values()) {
            if (s.isComplete()) capacity += catalog.getStats(s.typeId()).totalStorage();
        }
        ledger.setCapacity(capacity);
    }

    private Structure require(String id) {
        Structure s = structures.get(id);
        if (s == null) throw new StructureNotFoundException(id);
        return s;
    }

    // ==========================================================
    // SETTLERS
    // ==========================================================

    public Settler registerSettler(String id) {
        return consumptionEngine.registerSettler(id, false);
    }

    public boolean removeSettler(String id) {
        assignments.unassign(id);
        return consumptionEngine.removeSettler(id);
    }

    /**
     * @return false when the settler is unknown or dead, or the structure has no free work slot
     */
    public boolean assignWorker(String settlerId, String structureId) {
        Structure s = require(structureId);
        Optional<Settler> settler = consumptionEngine.getSettler(settlerId);
        if (settler.isEmpty() || !settler.get().isAlive()) return false;

        if (structureId.equals(assignments.postOf(settlerId).orElse(null))) return true;

        int slots = catalog.getStats(s.typeId()).workSlots();
        if (assignments.workerCount(structureId) >= slots) return false;

        assignments.assign(settlerId, structureId);
        consumptionEngine.setWorking(settlerId, true);
        return true;
    }

    public boolean unassignWorker(String settlerId) {
        if (assignments.unassign(settlerId) == null) return false;
        consumptionEngine.setWorking(settlerId, false);
        return true;
    }

    // ==========================================================
    // PROGRESSION
    // ==========================================================

    public AdvancementResult checkAdvancement(Tier target) {
        return tierGate.canAdvance(target, List.copyOf(structures.values()), ledger.amounts(), tier);
    }

    /**
     * Advances one tier when the gate allows it, paying the tier's resource requirement.
     */
    public AdvancementResult requestAdvancement(Tier target) {
        AdvancementResult result = checkAdvancement(target);
        if (!result.advanceable()) return result;

        ledger.spend(tierGate.requirementFor(target).resources());
        System.out.println("[Settlement] Tier advanced: " + tier + " -> " + target);
        tier = target;
        return result;
    }

    public int expandTerritory() {
        return ++expansionCount;
    }

    // ==========================================================
    // QUERIES
    // ==========================================================

    public Optional<Structure> getStructure(String id) {
        return Optional.ofNullable(structures.get(id));
    }

    public List<Structure> getStructures() {
        return List.copyOf(structures.values());
    }

    public int housingCapacity() {
        int capacity = 0;
        for (Structure s : structures.values()) {
            if (s.isComplete()) capacity += catalog.getStats(s.typeId()).housingCapacity();
        }
        return capacity;
    }

    /** Sum of the morale bonus of COMPLETE structures. */
    public int buildingMoraleBonus() {
        int bonus = 0;
        for (Structure s : structures.values()) {
            if (s.isComplete()) bonus += catalog.getStats(s.typeId()).moraleBonus();
        }
        return bonus;
    }

    public Tier getTier() { return tier; }
    public int getExpansionCount() { return expansionCount; }
    public long getTickCount() { return productionEngine.getNextTick(); }
    public SimulationSettings getSettings() { return settings; }
    public StructureCatalog getCatalog() { return catalog; }

    public GridIndex getGridIndex() { return gridIndex; }
    public SpatialIndex getSpatialIndex() { return spatialIndex; }
    public EffectRegistry getEffectRegistry() { return effectRegistry; }
    public StorageLedger getLedger() { return ledger; }
    public ConsumptionEngine getConsumptionEngine() { return consumptionEngine; }
    public MoraleEngine getMoraleEngine() { return moraleEngine; }
    public WorkerAssignments getAssignments() { return assignments; }

    public SettlementIntegrityValidator.Report validateIntegrity() {
        return new SettlementIntegrityValidator(this).validate();
    }

    // ==========================================================
    // SNAPSHOT
    // ==========================================================

    public SettlementSnapshot snapshot() {
        List<SettlementSnapshot.StructureRecord> structureRecords = new ArrayList<>();
        for (Structure s : structures.values()) {
            structureRecords.add(new SettlementSnapshot.StructureRecord(
                    s.id(), s.typeId(),
                    s.position().x(), s.position().y(), s.position().z(),
                    s.dimensions().x(), s.dimensions().y(), s.dimensions().z(),
                    s.status().name(), s.health(), s.maxHealth(), s.constructionProgress()));
        }

        Map<String, Double> amounts = new LinkedHashMap<>();
        ledger.amounts().forEach((t, v) -> amounts.put(t.key(), v));

        List<SettlementSnapshot.SettlerRecord> settlerRecords = new ArrayList<>();
        for (Settler s : consumptionEngine.getSettlers()) {
            settlerRecords.add(new SettlementSnapshot.SettlerRecord(
                    s.getId(), s.isWorking(), s.getHappiness(), s.getMorale(), s.getHealth(), s.isAlive()));
        }

        return new SettlementSnapshot(SnapshotCodec.SCHEMA_VERSION, productionEngine.getNextTick(), tier.name(), expansionCount,
                structureSequence, moraleEngine.getLast().morale(), structureRecords,
                new SettlementSnapshot.LedgerRecord(ledger.getCapacity(), amounts),
                settlerRecords, assignments.asMap());
    }

    /**
     * Rebuilds a settlement from a snapshot, re-registering effects of COMPLETE structures.
     */
    public static Settlement restore(SettlementSnapshot snapshot, SimulationSettings settings, StructureCatalog catalog,
                                     TierRequirements tiers, IPlacementValidator placementValidator) {
        Settlement s = new Settlement(settings, catalog, tiers, placementValidator);
        SnapshotRestorer.apply(s, snapshot);
        return s;
    }

    // package-private hooks for SnapshotRestorer

    void restoreStructure(Structure structure) {
        catalog.getStats(structure.typeId());
        gridIndex.place(structure);
        structures.put(structure.id(), structure);
        spatialIndex.insert(structure);
        if (structure.isComplete()) effectRegistry.registerEffects(structure);
    }

    void restoreCounters(Tier tier, int expansionCount, long structureSequence, long nextTick) {
        this.tier = tier;
        this.expansionCount = expansionCount;
        this.structureSequence = structureSequence;
        productionEngine.setNextTick(nextTick);
    }
}
