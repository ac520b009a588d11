package com.settleworks.core.managers;

import com.settleworks.core.common.GridPosition;
import com.settleworks.core.common.Vector3Int;
import com.settleworks.core.common.error.OutOfBoundsException;
import com.settleworks.core.common.error.RegionOccupiedException;
import com.settleworks.core.common.error.StructureNotFoundException;
import com.settleworks.core.domain.structure.Structure;

import java.util.*;

/**
 * Occupazione a celle intere del mondo dell'insediamento.
 * Unica autorità su "si può piazzare qui": ogni cella punta all'id della struttura che la copre.
 */
public class GridIndex {

    public record BlockedCell(GridPosition cell, String occupantId, String reason) {
    }

    public record RegionCheck(boolean free, List<BlockedCell> blocked) {
        public RegionCheck {
            blocked = List.copyOf(blocked);
        }
    }

    public record IntegrityReport(boolean valid, List<String> problems) {
        public IntegrityReport {
            problems = List.copyOf(problems);
        }
    }

    private final int width;
    private final int height;
    private final int depth;

    private final Map<GridPosition, String> occupancy = new HashMap<>();
    private final Map<String, List<GridPosition>> cellsById = new LinkedHashMap<>();

    public GridIndex(int width, int height, int depth) {
        if (width <= 0 || height <= 0 || depth <= 0) {
            throw new IllegalArgumentException("World extents must be > 0");
        }
        this.width = width;
        this.height = height;
        this.depth = depth;
    }

    // ==========================================================
    // BOUNDS
    // ==========================================================

    public void validateBounds(int x, int y, int z) {
        if (!isInside(x, y, z)) {
            throw new OutOfBoundsException("Position (" + x + "," + y + "," + z + ") is outside world "
                    + width + "x" + height + "x" + depth);
        }
    }

    /**
     * Variante per coordinate da sorgenti continue: tutto ciò che non è intero viene rifiutato.
     */
    public void validateBounds(double x, double y, double z) {
        if (!isIntegral(x) || !isIntegral(y) || !isIntegral(z)) {
            throw new OutOfBoundsException("Position (" + x + "," + y + "," + z + ") is not on the integer grid");
        }
        validateBounds((int) x, (int) y, (int) z);
    }

    public boolean isInside(int x, int y, int z) {
        return x >= 0 && x < width && y >= 0 && y < height && z >= 0 && z < depth;
    }

    private static boolean isIntegral(double v) {
        return !Double.isNaN(v) && !Double.isInfinite(v) && v == Math.rint(v);
    }

    // ==========================================================
    // QUERIES
    // ==========================================================

    public RegionCheck isRegionFree(int x, int y, int z, int w, int h, int d) {
        if (w <= 0 || h <= 0 || d <= 0) {
            throw new IllegalArgumentException("Region dimensions must be >= 1");
        }
        List<BlockedCell> blocked = new ArrayList<>();
        for (int dx = 0; dx < w; dx++) {
            for (int dy = 0; dy < h; dy++) {
                for (int dz = 0; dz < d; dz++) {
                    GridPosition cell = GridPosition.of(x + dx, y + dy, z + dz);
                    if (!isInside(cell.x(), cell.y(), cell.z())) {
                        blocked.add(new BlockedCell(cell, null, "out of bounds"));
                        continue;
                    }
                    String occupant = occupancy.get(cell);
                    if (occupant != null) {
                        blocked.add(new BlockedCell(cell, occupant, "occupied"));
                    }
                }
            }
        }
        return new RegionCheck(blocked.isEmpty(), blocked);
    }

    public Optional<String> occupantAt(int x, int y, int z) {
        return Optional.ofNullable(occupancy.get(GridPosition.of(x, y, z)));
    }

    public List<GridPosition> cellsOf(String id) {
        List<GridPosition> cells = cellsById.get(id);
        return cells != null ? List.copyOf(cells) : List.of();
    }

    public boolean contains(String id) {
        return cellsById.containsKey(id);
    }

    public int occupiedCellCount() {
        return occupancy.size();
    }

    public int size() {
        return cellsById.size();
    }

    // ==========================================================
    // MUTATION
    // ==========================================================

    /**
     * Marks the structure's footprint as occupied.
     *
     * @return the id the cells are attributed to
     * @throws OutOfBoundsException if the origin is outside the world
     * @throws RegionOccupiedException if any footprint cell is taken or out of bounds
     */
    public String place(Structure structure) {
        GridPosition p = structure.position();
        Vector3Int size = structure.dimensions();
        validateBounds(p.x(), p.y(), p.z());

        if (cellsById.containsKey(structure.id())) {
            throw new RegionOccupiedException("Structure " + structure.id() + " is already placed", cellsOf(structure.id()));
        }

        RegionCheck check = isRegionFree(p.x(), p.y(), p.z(), size.x(), size.y(), size.z());
        if (!check.free()) {
            List<GridPosition> cells = check.blocked().stream().map(BlockedCell::cell).toList();
            throw new RegionOccupiedException("Cannot place " + structure.id() + " at " + p + ": "
                    + cells.size() + " blocked cell(s)", cells);
        }

        List<GridPosition> footprint = structure.footprint();
        for (GridPosition cell : footprint) {
            occupancy.put(cell, structure.id());
        }
        cellsById.put(structure.id(), footprint);
        return structure.id();
    }

    /**
     * @return number of cells freed
     */
    public int remove(String id) {
        List<GridPosition> cells = cellsById.remove(id);
        if (cells == null) throw new StructureNotFoundException(id);

        int freed = 0;
        for (GridPosition cell : cells) {
            if (occupancy.remove(cell, id)) freed++;
        }
        return freed;
    }

    public void clear() {
        occupancy.clear();
        cellsById.clear();
    }

    // ==========================================================
    // INTEGRITY
    // ==========================================================

    public IntegrityReport validateIntegrity() {
        List<String> problems = new ArrayList<>();

        for (var e : occupancy.entrySet()) {
            List<GridPosition> owned = cellsById.get(e.getValue());
            if (owned == null) {
                problems.add("Cell " + e.getKey() + " points at unknown structure " + e.getValue());
            } else if (!owned.contains(e.getKey())) {
                problems.add("Cell " + e.getKey() + " is not in the footprint of " + e.getValue());
            }
        }
        for (var e : cellsById.entrySet()) {
            for (GridPosition cell : e.getValue()) {
                if (!e.getKey().equals(occupancy.get(cell))) {
                    problems.add("Structure " + e.getKey() + " lost cell " + cell);
                }
            }
        }

        if (!problems.isEmpty()) {
            System.err.println("⚠️ [GridIndex] Integrity check found " + problems.size() + " problem(s)");
        }
        return new IntegrityReport(problems.isEmpty(), problems);
    }
}
