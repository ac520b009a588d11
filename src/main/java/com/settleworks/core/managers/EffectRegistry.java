package com.settleworks.core.managers;

import com.settleworks.core.common.error.InvalidStructureStateException;
import com.settleworks.core.domain.effects.Effect;
import com.settleworks.core.domain.effects.ZoneKind;
import com.settleworks.core.domain.structure.Structure;
import com.settleworks.core.domain.structure.registry.StructureCatalog;
import com.settleworks.core.domain.structure.registry.StructureStats;

import java.util.*;

/**
 * Turns the declared aura/zone of COMPLETE structures into registered effects and answers
 * "what bonus applies at this point". Overlapping effects of one kind do not stack: the strongest
 * applicable multiplier wins.
 */
public class EffectRegistry {

    public static final double NEUTRAL = 1.0;

    private final SpatialIndex spatialIndex;
    private final StructureCatalog catalog;

    private final Map<String, List<Effect>> effectsByOrigin = new LinkedHashMap<>();
    // radius -> count, per effect kind; keeps the query reach O(1)
    private final Map<Class<? extends Effect>, TreeMap<Double, Integer>> radiiByKind = new HashMap<>();
    private long auraCounter = 0;
    private long zoneCounter = 0;

    public EffectRegistry(SpatialIndex spatialIndex, StructureCatalog catalog) {
        this.spatialIndex = Objects.requireNonNull(spatialIndex, "spatialIndex");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    // ==========================================================
    // REGISTRATION
    // ==========================================================

    /**
     * Registers one effect per bonus declared by the structure's type.
     * A structure that was already registered gets its effects replaced.
     *
     * @return generated effect ids, empty when the type declares no bonus
     * @throws InvalidStructureStateException if the structure is not COMPLETE
     */
    public List<String> registerEffects(Structure structure) {
        if (!structure.isComplete()) {
            throw new InvalidStructureStateException("Effects can only be registered for COMPLETE structures: "
                    + structure.id() + " is " + structure.status());
        }
        StructureStats stats = catalog.getStats(structure.typeId());
        if (!stats.hasEffects()) return List.of();

        unregisterEffects(structure.id());

        List<Effect> created = new ArrayList<>(2);
        if (stats.aura() != null) {
            created.add(new Effect.ProductionAura("effect_aura_" + (++auraCounter), structure.id(),
                    stats.aura().radius(), stats.aura().multiplier()));
        }
        StructureStats.ZoneSpec zone = stats.zone();
        if (zone != null) {
            String effectId = "effect_zone_" + (++zoneCounter);
            created.add(zone.kind() == ZoneKind.DEFENSE
                    ? new Effect.DefenseZone(effectId, structure.id(), zone.radius(), zone.multiplier())
                    : new Effect.TradeZone(effectId, structure.id(), zone.radius(), zone.multiplier()));
        }

        effectsByOrigin.put(structure.id(), List.copyOf(created));
        for (Effect e : created) {
            radiiByKind.computeIfAbsent(e.getClass(), k -> new TreeMap<>()).merge(e.radius(), 1, Integer::sum);
        }
        return created.stream().map(Effect::id).toList();
    }

    /**
     * @return number of effects removed (0 when the structure never had any)
     */
    public int unregisterEffects(String structureId) {
        List<Effect> removed = effectsByOrigin.remove(structureId);
        if (removed == null) return 0;
        for (Effect e : removed) {
            TreeMap<Double, Integer> radii = radiiByKind.get(e.getClass());
            if (radii == null) continue;
            radii.computeIfPresent(e.radius(), (r, n) -> n > 1 ? n - 1 : null);
            if (radii.isEmpty()) radiiByKind.remove(e.getClass());
        }
        return removed.size();
    }

    public void clear() {
        effectsByOrigin.clear();
        radiiByKind.clear();
    }

    // ==========================================================
    // LOCATIONAL BONUSES
    // ==========================================================

    public double getProductionBonusAt(double x, double y, double z) {
        return strongest(Effect.ProductionAura.class, x, y, z);
    }

    public double getDefenseBonusAt(double x, double y, double z) {
        return strongest(Effect.DefenseZone.class, x, y, z);
    }

    public double getTradeBonusAt(double x, double y, double z) {
        return strongest(Effect.TradeZone.class, x, y, z);
    }

    private double strongest(Class<? extends Effect> kind, double x, double y, double z) {
        double best = NEUTRAL;
        for (Effect e : affecting(kind, x, y, z)) {
            best = Math.max(best, e.multiplier());
        }
        return best;
    }

    /** Every effect of any kind whose radius reaches the point. */
    public List<Effect> getAffectingEffects(double x, double y, double z) {
        return affecting(Effect.class, x, y, z);
    }

    private List<Effect> affecting(Class<? extends Effect> kind, double x, double y, double z) {
        double maxRadius = maxRadius(kind);
        if (maxRadius < 0) return List.of();

        List<Effect> out = new ArrayList<>();
        for (SpatialIndex.Hit hit : spatialIndex.queryRadius(x, y, z, maxRadius)) {
            List<Effect> effects = effectsByOrigin.get(hit.structureId());
            if (effects == null) continue;
            for (Effect e : effects) {
                if (kind.isInstance(e) && e.reaches(hit.distance())) out.add(e);
            }
        }
        return out;
    }

    /** Largest radius among registered effects of the kind, -1 when there is none. */
    double maxRadius(Class<? extends Effect> kind) {
        double max = -1;
        for (var e : radiiByKind.entrySet()) {
            if (kind.isAssignableFrom(e.getKey())) max = Math.max(max, e.getValue().lastKey());
        }
        return max;
    }

    // ==========================================================
    // INSPECTION
    // ==========================================================

    public List<Effect> effectsOf(String structureId) {
        return effectsByOrigin.getOrDefault(structureId, List.of());
    }

    public List<Effect> allEffects() {
        List<Effect> all = new ArrayList<>();
        effectsByOrigin.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        int n = 0;
        for (List<Effect> effects : effectsByOrigin.values()) n += effects.size();
        return n;
    }
}
