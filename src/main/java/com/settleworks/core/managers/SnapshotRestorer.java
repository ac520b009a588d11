package com.settleworks.core.managers;

import com.settleworks.core.common.GridPosition;
import com.settleworks.core.common.Vector3Int;
import com.settleworks.core.common.error.IncompatibleSchemaException;
import com.settleworks.core.common.error.MalformedSnapshotException;
import com.settleworks.core.domain.resources.ResourceType;
import com.settleworks.core.domain.structure.Structure;
import com.settleworks.core.domain.structure.StructureStatus;
import com.settleworks.core.economy.MoraleEngine;
import com.settleworks.core.economy.MoraleSnapshot;
import com.settleworks.core.economy.Settler;
import com.settleworks.core.economy.StorageLedger;
import com.settleworks.core.persistence.SettlementSnapshot;
import com.settleworks.core.persistence.SnapshotCodec;
import com.settleworks.core.progression.Tier;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

final class SnapshotRestorer {

    private SnapshotRestorer() {
    }

    static void apply(Settlement target, SettlementSnapshot snap) {
        if (snap.schemaVersion() != SnapshotCodec.SCHEMA_VERSION) {
            throw new IncompatibleSchemaException(snap.schemaVersion(), SnapshotCodec.SCHEMA_VERSION);
        }

        for (SettlementSnapshot.StructureRecord r : snap.structures()) {
            target.restoreStructure(toStructure(r));
        }

        Map<ResourceType, Double> amounts = new EnumMap<>(ResourceType.class);
        for (var e : snap.ledger().amounts().entrySet()) {
            amounts.put(parseResource(e.getKey()), e.getValue() == null ? 0.0 : e.getValue());
        }
        try {
            target.getLedger().restore(new StorageLedger.Snapshot(snap.ledger().capacity(), amounts));
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException("Invalid ledger in snapshot: " + e.getMessage(), e);
        }

        for (SettlementSnapshot.SettlerRecord r : snap.settlers()) {
            try {
                target.getConsumptionEngine().restoreSettler(
                        new Settler(r.id(), r.working(), r.happiness(), r.morale(), r.health(), r.alive()));
            } catch (IllegalArgumentException e) {
                throw new MalformedSnapshotException("Invalid settler record " + r.id(), e);
            }
        }

        if (snap.assignments() != null) {
            for (var e : snap.assignments().entrySet()) {
                if (target.getStructure(e.getKey()).isEmpty()) {
                    throw new MalformedSnapshotException("Assignment to unknown structure " + e.getKey());
                }
                List<String> workers = e.getValue() == null ? List.of() : e.getValue();
                for (String settlerId : workers) {
                    target.getAssignments().assign(settlerId, e.getKey());
                }
            }
        }

        double morale = Math.max(-100.0, Math.min(100.0, snap.morale()));
        target.getMoraleEngine().setLast(new MoraleSnapshot(morale, 0, 0, 0, 0, 0,
                MoraleEngine.toMultiplier(morale), MoraleEngine.describe(morale)));

        target.restoreCounters(parseTier(snap.tier()), Math.max(0, snap.expansionCount()),
                Math.max(0, snap.structureSequence()), Math.max(0, snap.tick()));
    }

    private static Structure toStructure(SettlementSnapshot.StructureRecord r) {
        StructureStatus status;
        try {
            status = StructureStatus.valueOf(r.status());
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException("Unknown structure status " + r.status() + " for " + r.id(), e);
        }
        if (status == StructureStatus.DESTROYED) {
            throw new MalformedSnapshotException("Snapshot contains destroyed structure " + r.id());
        }
        try {
            return new Structure(r.id(), r.typeId(), GridPosition.of(r.x(), r.y(), r.z()),
                    new Vector3Int(r.width(), r.height(), r.depth()), status,
                    r.health(), r.maxHealth(), r.constructionProgress());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new MalformedSnapshotException("Invalid structure record " + r.id() + ": " + e.getMessage(), e);
        }
    }

    private static ResourceType parseResource(String key) {
        try {
            return ResourceType.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException("Unknown resource in snapshot: " + key, e);
        }
    }

    private static Tier parseTier(String tier) {
        try {
            return Tier.valueOf(tier);
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException("Unknown tier in snapshot: " + tier, e);
        }
    }
}
