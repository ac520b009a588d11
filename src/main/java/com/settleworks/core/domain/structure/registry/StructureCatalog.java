package com.settleworks.core.domain.structure.registry;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.settleworks.core.common.Vector3Int;
import com.settleworks.core.common.error.ConfigurationException;
import com.settleworks.core.common.error.UnknownStructureTypeException;
import com.settleworks.core.domain.effects.ZoneKind;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.progression.Tier;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Read-only table of structure types, loaded from a JSON document.
 */
public class StructureCatalog {

    public static final String DEFAULT_RESOURCE = "/structures.json";

    private static final double REPAIR_COST_RATIO = 0.5;
    private static final int REPAIR_AMOUNT = 25;

    private final Map<String, StructureStats> statsCache;

    public StructureCatalog(Collection<StructureStats> definitions) {
        Map<String, StructureStats> map = new LinkedHashMap<>();
        for (StructureStats s : definitions) {
            validate(s);
            if (map.putIfAbsent(s.id(), s) != null) {
                throw new ConfigurationException("Duplicate structure type: " + s.id());
            }
        }
        this.statsCache = Collections.unmodifiableMap(map);
    }

    public static StructureCatalog loadDefault() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public static StructureCatalog loadFromClasspath(String resource) {
        try (InputStream in = StructureCatalog.class.getResourceAsStream(resource)) {
            if (in == null) throw new ConfigurationException("Structure catalog not found on classpath: " + resource);
            StructureCatalog catalog = fromJson(new InputStreamReader(in, StandardCharsets.UTF_8));
            System.out.println("[StructureCatalog] Loaded " + catalog.size() + " structure types from " + resource);
            return catalog;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read structure catalog " + resource, e);
        }
    }

    public static StructureCatalog fromJson(Reader reader) {
        CatalogDocument doc;
        try {
            doc = new Gson().fromJson(reader, CatalogDocument.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Structure catalog is not valid JSON", e);
        }
        if (doc == null || doc.structures == null) {
            throw new ConfigurationException("Structure catalog has no 'structures' array");
        }

        List<StructureStats> defs = new ArrayList<>();
        for (StructureDefinition d : doc.structures) {
            defs.add(d.toStats());
        }
        return new StructureCatalog(defs);
    }

    // ==========================================================
    // LOOKUP
    // ==========================================================

    public StructureStats getStats(String typeId) {
        StructureStats s = typeId == null ? null : statsCache.get(typeId);
        if (s == null) throw new UnknownStructureTypeException(typeId);
        return s;
    }

    public Optional<StructureStats> find(String typeId) {
        if (typeId == null) return Optional.empty();
        return Optional.ofNullable(statsCache.get(typeId));
    }

    public boolean contains(String typeId) {
        return typeId != null && statsCache.containsKey(typeId);
    }

    public Vector3Int getDimensions(String typeId) {
        return getStats(typeId).dimensions();
    }

    public List<String> typeIds() {
        return List.copyOf(statsCache.keySet());
    }

    public List<String> typesForTier(Tier tier) {
        List<String> out = new ArrayList<>();
        for (StructureStats s : statsCache.values()) {
            if (s.tier() == tier) out.add(s.id());
        }
        return out;
    }

    public int size() {
        return statsCache.size();
    }

    /** Half of the build cost per resource, rounded up. */
    public Map<ResourceType, Double> repairCost(String typeId) {
        Map<ResourceType, Double> out = new EnumMap<>(ResourceType.class);
        for (var e : getStats(typeId).cost().entrySet()) {
            double c = Math.ceil(e.getValue() * REPAIR_COST_RATIO);
            if (c > 0) out.put(e.getKey(), c);
        }
        return Collections.unmodifiableMap(out);
    }

    public int repairAmount() {
        return REPAIR_AMOUNT;
    }

    // ==========================================================
    // VALIDATION
    // ==========================================================

    private static void validate(StructureStats s) {
        if (s.id() == null || s.id().isBlank()) throw new ConfigurationException("Structure type without id");
        if (s.tier() == null) throw new ConfigurationException(s.id() + ": missing tier");
        if (s.unlockTier().isAfter(s.tier())) {
            throw new ConfigurationException(s.id() + ": unlock tier " + s.unlockTier() + " is after its tier " + s.tier());
        }
        if (s.dimensions() == null || !s.dimensions().isPositive()) {
            throw new ConfigurationException(s.id() + ": dimensions must be >= 1 on every axis");
        }
        if (s.maxHealth() <= 0) throw new ConfigurationException(s.id() + ": maxHealth must be > 0");
        if (s.workSlots() < 0 || s.housingCapacity() < 0 || s.constructionTicks() < 0) {
            throw new ConfigurationException(s.id() + ": negative slots, housing or construction time");
        }
        requireNonNegative(s.id(), "cost", s.cost());
        requireNonNegative(s.id(), "production", s.production());
        requireNonNegative(s.id(), "storage", s.storage());
        if (s.aura() != null && (s.aura().radius() <= 0 || s.aura().multiplier() <= 0)) {
            throw new ConfigurationException(s.id() + ": aura radius and multiplier must be > 0");
        }
        if (s.zone() != null && (s.zone().kind() == null || s.zone().radius() <= 0 || s.zone().multiplier() <= 0)) {
            throw new ConfigurationException(s.id() + ": zone needs a kind, radius > 0 and multiplier > 0");
        }
    }

    private static void requireNonNegative(String id, String field, Map<ResourceType, Double> values) {
        for (var e : values.entrySet()) {
            if (e.getValue() < 0) {
                throw new ConfigurationException(id + ": negative " + field + " for " + e.getKey().key());
            }
        }
    }

    // ==========================================================
    // JSON DOCUMENT
    // ==========================================================

    private static final class CatalogDocument {
        List<StructureDefinition> structures;
    }

    private static final class DimensionsDefinition {
        int width = 1;
        int height = 1;
        int depth = 1;
    }

    private static final class EffectDefinition {
        String kind;
        double radius;
        double multiplier;
    }

    private static final class StructureDefinition {
        String id;
        String tier;
        String unlockTier;
        DimensionsDefinition dimensions;
        Map<String, Double> cost;
        Map<String, Double> production;
        Map<String, Double> storage;
        int workSlots;
        int housingCapacity;
        int maxHealth;
        int constructionTicks;
        int moraleBonus;
        EffectDefinition aura;
        EffectDefinition zone;

        StructureStats toStats() {
            if (id == null) throw new ConfigurationException("Structure definition without id");
            Tier t;
            try {
                t = Tier.valueOf(String.valueOf(tier));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(id + ": unknown tier " + tier, e);
            }
            Tier unlock = t;
            if (unlockTier != null) {
                try {
                    unlock = Tier.valueOf(unlockTier);
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(id + ": unknown unlock tier " + unlockTier, e);
                }
            }
            DimensionsDefinition d = dimensions != null ? dimensions : new DimensionsDefinition();

            StructureStats.AuraSpec auraSpec = aura == null ? null
                    : new StructureStats.AuraSpec(aura.radius, aura.multiplier);
            StructureStats.ZoneSpec zoneSpec = null;
            if (zone != null) {
                try {
                    zoneSpec = new StructureStats.ZoneSpec(ZoneKind.valueOf(String.valueOf(zone.kind)), zone.radius, zone.multiplier);
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(id + ": unknown zone kind " + zone.kind, e);
                }
            }

            return new StructureStats(
                    id, t, unlock, new Vector3Int(d.width, d.height, d.depth),
                    toResources(cost), toResources(production), toResources(storage),
                    workSlots, housingCapacity, maxHealth, constructionTicks, moraleBonus,
                    auraSpec, zoneSpec
            );
        }

        private Map<ResourceType, Double> toResources(Map<String, Double> raw) {
            Map<ResourceType, Double> out = new EnumMap<>(ResourceType.class);
            if (raw == null) return out;
            for (var e : raw.entrySet()) {
                try {
                    out.put(ResourceType.fromKey(e.getKey()), e.getValue() == null ? 0.0 : e.getValue());
                } catch (IllegalArgumentException ex) {
                    throw new ConfigurationException(id + ": " + ex.getMessage(), ex);
                }
            }
            return out;
        }
    }
}
