package com.settleworks.core.progression;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.settleworks.core.common.error.ConfigurationException;
import com.settleworks.core.domain.resources.ResourceAmounts;
import com.settleworks.core.domain.resources.ResourceType;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * What each tier demands: structure counts and resource thresholds. Read-only.
 */
public class TierRequirements {

    public static final String DEFAULT_RESOURCE = "/tiers.json";

    public record Requirement(Tier tier, Map<String, Integer> structures, Map<ResourceType, Double> resources) {
        public Requirement {
            structures = Collections.unmodifiableMap(new LinkedHashMap<>(structures));
            resources = ResourceAmounts.immutableCopy(resources);
        }
    }

    private final Map<Tier, Requirement> byTier;

    public TierRequirements(Collection<Requirement> requirements) {
        Map<Tier, Requirement> map = new EnumMap<>(Tier.class);
        for (Requirement r : requirements) {
            for (var e : r.structures().entrySet()) {
                if (e.getValue() < 0) throw new ConfigurationException(r.tier() + ": negative count for " + e.getKey());
            }
            for (var e : r.resources().entrySet()) {
                if (e.getValue() < 0) throw new ConfigurationException(r.tier() + ": negative " + e.getKey().key());
            }
            map.put(r.tier(), r);
        }
        this.byTier = Collections.unmodifiableMap(map);
    }

    public static TierRequirements loadDefault() {
        try (InputStream in = TierRequirements.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new ConfigurationException("Tier table not found on classpath: " + DEFAULT_RESOURCE);
            return fromJson(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read tier table " + DEFAULT_RESOURCE, e);
        }
    }

    public static TierRequirements fromJson(Reader reader) {
        TierDocument doc;
        try {
            doc = new Gson().fromJson(reader, TierDocument.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Tier table is not valid JSON", e);
        }
        if (doc == null || doc.tiers == null) throw new ConfigurationException("Tier table has no 'tiers' array");

        List<Requirement> out = new ArrayList<>();
        for (TierDefinition d : doc.tiers) {
            Tier tier;
            try {
                tier = Tier.valueOf(String.valueOf(d.tier));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown tier in tier table: " + d.tier, e);
            }
            Map<ResourceType, Double> resources = new EnumMap<>(ResourceType.class);
            if (d.resources != null) {
                for (var e : d.resources.entrySet()) {
                    try {
                        resources.put(ResourceType.fromKey(e.getKey()), e.getValue());
                    } catch (IllegalArgumentException ex) {
                        throw new ConfigurationException(tier + ": " + ex.getMessage(), ex);
                    }
                }
            }
            out.add(new Requirement(tier, d.structures != null ? d.structures : Map.of(), resources));
        }
        return new TierRequirements(out);
    }

    /** Requirement of the tier; tiers without an entry require nothing. */
    public Requirement forTier(Tier tier) {
        Requirement r = byTier.get(tier);
        return r != null ? r : new Requirement(tier, Map.of(), Map.of());
    }

    private static final class TierDocument {
        List<TierDefinition> tiers;
    }

    private static final class TierDefinition {
        String tier;
        Map<String, Integer> structures;
        Map<String, Double> resources;
    }
}
