package com.settleworks.core.ports;

import com.settleworks.core.common.GridPosition;
import com.settleworks.core.common.Vector3Int;
import com.settleworks.core.domain.structure.Structure;

import java.util.Collection;

/**
 * External placement rules (spacing, terrain, reserved areas) consulted before a structure is
 * admitted to the grid. Occupancy itself is still checked by the grid index.
 */
public interface IPlacementValidator {

    record Verdict(boolean allowed, String reason) {
        public static Verdict allow() {
            return new Verdict(true, null);
        }

        public static Verdict deny(String reason) {
            return new Verdict(false, reason);
        }
    }

    Verdict validate(String typeId, GridPosition origin, Vector3Int size, Collection<Structure> existing);

    static IPlacementValidator permissive() {
        return (typeId, origin, size, existing) -> Verdict.allow();
    }
}
