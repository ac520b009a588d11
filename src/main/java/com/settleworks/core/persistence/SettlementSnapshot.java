package com.settleworks.core.persistence;

import java.util.List;
import java.util.Map;

/**
 * Plain serializable state of a settlement: ids, amounts and flags only.
 * Effects are not stored; they are rebuilt from COMPLETE structures on restore.
 */
public record SettlementSnapshot(
        int schemaVersion,
        long tick,
        String tier,
        int expansionCount,
        long structureSequence,
        double morale,
        List<StructureRecord> structures,
        LedgerRecord ledger,
        List<SettlerRecord> settlers,
        Map<String, List<String>> assignments
) {

    public record StructureRecord(
            String id,
            String typeId,
            int x, int y, int z,
            int width, int height, int depth,
            String status,
            int health,
            int maxHealth,
            int constructionProgress
    ) {
    }

    public record LedgerRecord(double capacity, Map<String, Double> amounts) {
    }

    public record SettlerRecord(String id, boolean working, double happiness, double morale, double health, boolean alive) {
    }
}
