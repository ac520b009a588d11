package com.settleworks.core.economy;

import com.settleworks.core.domain.resources.ResourceAmounts;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.domain.structure.Structure;
import com.settleworks.core.domain.structure.registry.StructureCatalog;
import com.settleworks.core.domain.structure.registry.StructureStats;
import com.settleworks.core.managers.EffectRegistry;

import java.util.*;

/**
 * Per-tick yield of every COMPLETE, staffed production structure.
 * Output = base yield x staffing x locational aura x morale, capped; totals are deposited as one
 * batch and overflow is resolved once at the end.
 */
public class ProductionEngine {

    private final EffectRegistry effects;
    private final StorageLedger ledger;
    private final StructureCatalog catalog;
    private final double multiplierCap;

    private long nextTick = 0;

    public ProductionEngine(EffectRegistry effects, StorageLedger ledger, StructureCatalog catalog, double multiplierCap) {
        this.effects = Objects.requireNonNull(effects, "effects");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        if (multiplierCap <= 0) throw new IllegalArgumentException("multiplierCap must be > 0");
        this.multiplierCap = multiplierCap;
    }

    public ProductionResult runTick(Collection<Structure> structures, WorkerAssignments assignments, double moraleMultiplier) {
        long tick = nextTick++;

        Map<ResourceType, Double> totals = ResourceAmounts.empty();
        List<ProductionResult.StructureYield> yields = new ArrayList<>();

        for (Structure s : structures) {
            if (!s.isComplete()) continue;

            StructureStats stats = catalog.getStats(s.typeId());
            if (!stats.isProducer()) continue;

            int workers = assignments.workerCount(s.id());
            if (workers <= 0) continue;

            double staffing = Math.min(1.0, (double) workers / stats.effectiveWorkSlots());
            double aura = effects.getProductionBonusAt(s.position().x(), s.position().y(), s.position().z());
            double multiplier = Math.min(multiplierCap, staffing * aura * moraleMultiplier);

            Map<ResourceType, Double> out = ResourceAmounts.empty();
            for (var e : stats.production().entrySet()) {
                double amount = e.getValue() * multiplier;
                if (amount <= 0) continue;
                out.put(e.getKey(), amount);
                ResourceAmounts.addInto(totals, e.getKey(), amount);
            }
            yields.add(new ProductionResult.StructureYield(s.id(), multiplier, out));
        }

        for (var e : totals.entrySet()) {
            ledger.deposit(e.getKey(), e.getValue());
        }
        OverflowReport overflow = ledger.resolveOverflow();

        return new ProductionResult(tick, totals, yields, overflow);
    }

    /** Ordinal the next {@link #runTick} call will report. */
    public long getNextTick() {
        return nextTick;
    }

    public void setNextTick(long nextTick) {
        if (nextTick < 0) throw new IllegalArgumentException("tick must be >= 0");
        this.nextTick = nextTick;
    }
}
