package com.settleworks.core.managers;

import com.settleworks.core.domain.effects.Effect;
import com.settleworks.core.domain.structure.Structure;

import java.util.ArrayList;
import java.util.List;

/**
 * Controllo incrociato tra i record canonici delle strutture e griglia, indice spaziale
 * e registro degli effetti. Non corregge nulla: segnala soltanto.
 */
public final class SettlementIntegrityValidator {

    public record Report(boolean valid, List<String> problems) {
        public Report {
            problems = List.copyOf(problems);
        }
    }

    private final Settlement settlement;

    SettlementIntegrityValidator(Settlement settlement) {
        this.settlement = settlement;
    }

    Report validate() {
        List<String> problems = new ArrayList<>(settlement.getGridIndex().validateIntegrity().problems());

        List<Structure> structures = settlement.getStructures();
        for (Structure s : structures) {
            List<?> cells = settlement.getGridIndex().cellsOf(s.id());
            if (cells.size() != s.dimensions().volume()) {
                problems.add("❌ " + s.id() + " covers " + cells.size() + " cells, expected " + s.dimensions().volume());
            }
            if (!settlement.getSpatialIndex().contains(s.id())) {
                problems.add("❌ " + s.id() + " missing from spatial index");
            }
            List<Effect> effects = settlement.getEffectRegistry().effectsOf(s.id());
            if (!s.isComplete() && !effects.isEmpty()) {
                problems.add("❌ " + s.id() + " is " + s.status() + " but still has " + effects.size() + " effect(s)");
            }
            if (s.isComplete() && effects.isEmpty() && settlement.getCatalog().getStats(s.typeId()).hasEffects()) {
                problems.add("❌ " + s.id() + " is COMPLETE but its effects are not registered");
            }
        }

        if (settlement.getGridIndex().size() != structures.size()) {
            problems.add("❌ Grid tracks " + settlement.getGridIndex().size() + " structures, settlement owns " + structures.size());
        }
        if (settlement.getSpatialIndex().size() != structures.size()) {
            problems.add("❌ Spatial index tracks " + settlement.getSpatialIndex().size() + " structures, settlement owns " + structures.size());
        }
        for (Effect e : settlement.getEffectRegistry().allEffects()) {
            if (settlement.getStructure(e.originId()).isEmpty()) {
                problems.add("❌ Effect " + e.id() + " outlived its origin " + e.originId());
            }
        }

        if (problems.isEmpty()) {
            System.out.println("✅ [Integrity] " + structures.size() + " strutture verificate: 0 conflitti.");
        } else {
            System.err.println("⚠️ [Integrity] " + problems.size() + " problemi trovati:");
            problems.forEach(p -> System.err.println("   " + p));
        }
        return new Report(problems.isEmpty(), problems);
    }
}
