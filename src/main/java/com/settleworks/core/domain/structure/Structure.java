package com.settleworks.core.domain.structure;

import com.settleworks.core.common.GridPosition;
import com.settleworks.core.common.Vector3Int;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Canonical record of a placed structure. Immutable: every change produces a new record that the
 * settlement swaps in, so the indices only ever hold the id.
 */
public record Structure(
        String id,
        String typeId,
        GridPosition position,
        Vector3Int dimensions,
        StructureStatus status,
        int health,
        int maxHealth,
        int constructionProgress
) {

    public Structure {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(typeId, "typeId");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(dimensions, "dimensions");
        Objects.requireNonNull(status, "status");
        if (!dimensions.isPositive()) {
            throw new IllegalArgumentException("Dimensions must be >= 1 on every axis: " + dimensions);
        }
        if (maxHealth <= 0) {
            throw new IllegalArgumentException("maxHealth must be > 0 for " + id);
        }
        if (health > maxHealth) {
            throw new IllegalArgumentException("health " + health + " exceeds maxHealth " + maxHealth + " for " + id);
        }
        if (status != StructureStatus.DESTROYED && health <= 0) {
            throw new IllegalArgumentException("health must be > 0 unless DESTROYED: " + id);
        }
        if (constructionProgress < 0) constructionProgress = 0;
    }

    public static Structure blueprint(String id, String typeId, GridPosition position, Vector3Int dimensions, int maxHealth) {
        return new Structure(id, typeId, position, dimensions, StructureStatus.BLUEPRINT, maxHealth, maxHealth, 0);
    }

    public Structure withStatus(StructureStatus newStatus) {
        return new Structure(id, typeId, position, dimensions, newStatus, health, maxHealth, constructionProgress);
    }

    public Structure withHealth(int newHealth) {
        int clamped = Math.min(newHealth, maxHealth);
        StructureStatus s = status;
        if (clamped <= 0) {
            clamped = 0;
            s = StructureStatus.DESTROYED;
        }
        return new Structure(id, typeId, position, dimensions, s, clamped, maxHealth, constructionProgress);
    }

    public Structure withConstructionProgress(int progress) {
        return new Structure(id, typeId, position, dimensions, status, health, maxHealth, progress);
    }

    public boolean isComplete() {
        return status == StructureStatus.COMPLETE;
    }

    /** Every cell covered by the footprint, origin corner first. */
    public List<GridPosition> footprint() {
        List<GridPosition> cells = new ArrayList<>(dimensions.volume());
        for (int dx = 0; dx < dimensions.x(); dx++) {
            for (int dy = 0; dy < dimensions.y(); dy++) {
                for (int dz = 0; dz < dimensions.z(); dz++) {
                    cells.add(position.add(dx, dy, dz));
                }
            }
        }
        return cells;
    }
}
