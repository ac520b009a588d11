package com.settleworks.core.managers;

import com.settleworks.core.common.GridPosition;
import com.settleworks.core.domain.structure.Structure;

import java.util.*;
import java.util.function.Function;

/**
 * Coarse chunk partition over structure footprints.
 * Queries first collect candidates from the chunks around the query, then filter by exact
 * geometry against the structure's current position.
 */
public class SpatialIndex {

    public record ChunkKey(int cx, int cy, int cz) {
    }

    public record Hit(String structureId, double distance) {
    }

    // beyond this many chunks per axis a radius query scans the populated chunks directly
    private static final double MAX_CHUNK_SPAN = 1 << 20;

    private final int chunkSize;
    private final Function<String, Structure> lookup;

    private final Map<ChunkKey, Set<String>> chunks = new HashMap<>();
    private final Map<String, Set<ChunkKey>> chunksById = new HashMap<>();
    private final Map<String, Long> insertionOrder = new HashMap<>();
    private long insertionCounter = 0;

    /**
     * @param lookup resolves an id to the canonical structure record (null when unknown)
     */
    public SpatialIndex(int chunkSize, Function<String, Structure> lookup) {
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
        this.chunkSize = chunkSize;
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    public ChunkKey chunkOf(int x, int y, int z) {
        return new ChunkKey(Math.floorDiv(x, chunkSize), Math.floorDiv(y, chunkSize), Math.floorDiv(z, chunkSize));
    }

    private ChunkKey chunkOf(double x, double y, double z) {
        return chunkOf((int) Math.floor(x), (int) Math.floor(y), (int) Math.floor(z));
    }

    // ==========================================================
    // MUTATION
    // ==========================================================

    public void insert(Structure structure) {
        String id = structure.id();
        if (chunksById.containsKey(id)) {
            removeFromChunks(id);
        } else {
            insertionOrder.put(id, insertionCounter++);
        }

        Set<ChunkKey> keys = new LinkedHashSet<>();
        for (GridPosition cell : structure.footprint()) {
            ChunkKey key = chunkOf(cell.x(), cell.y(), cell.z());
            if (keys.add(key)) {
                chunks.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(id);
            }
        }
        chunksById.put(id, keys);
    }

    public boolean remove(String id) {
        if (!chunksById.containsKey(id)) return false;
        removeFromChunks(id);
        chunksById.remove(id);
        insertionOrder.remove(id);
        return true;
    }

    /** Re-indexes a moved or resized structure, keeping its original insertion rank. */
    public void update(Structure structure) {
        insert(structure);
    }

    private void removeFromChunks(String id) {
        Set<ChunkKey> keys = chunksById.get(id);
        if (keys == null) return;
        for (ChunkKey key : keys) {
            Set<String> ids = chunks.get(key);
            if (ids == null) continue;
            ids.remove(id);
            if (ids.isEmpty()) chunks.remove(key);
        }
    }

    public void clear() {
        chunks.clear();
        chunksById.clear();
        insertionOrder.clear();
    }

    // ==========================================================
    // QUERIES
    // ==========================================================

    /**
     * Structures whose position lies within {@code radius} of the point, nearest first.
     * The chunk neighborhood is 3x3x3 while the radius fits in one chunk and widens with it.
     */
    public List<Hit> queryRadius(double x, double y, double z, double radius) {
        if (radius < 0 || Double.isNaN(radius)) return List.of();

        Set<String> candidates = new HashSet<>();
        double span = Math.max(1.0, Math.ceil(radius / chunkSize));
        if (span > MAX_CHUNK_SPAN) {
            for (Set<String> ids : chunks.values()) candidates.addAll(ids);
        } else {
            ChunkKey center = chunkOf(x, y, z);
            long reach = (long) span;
            collect(center.cx() - reach, center.cy() - reach, center.cz() - reach,
                    center.cx() + reach, center.cy() + reach, center.cz() + reach, candidates);
        }

        List<Hit> hits = new ArrayList<>();
        for (String id : candidates) {
            Structure s = lookup.apply(id);
            if (s == null) continue;
            double dist = s.position().distanceTo(x, y, z);
            if (dist <= radius) hits.add(new Hit(id, dist));
        }
        hits.sort(Comparator.comparingDouble(Hit::distance)
                .thenComparingLong(h -> insertionOrder.getOrDefault(h.structureId(), Long.MAX_VALUE)));
        return hits;
    }

    /**
     * Structures whose position lies inside the axis-aligned box (inclusive), in insertion order.
     */
    public List<String> queryRegion(int x1, int y1, int z1, int x2, int y2, int z2) {
        int minX = Math.min(x1, x2), maxX = Math.max(x1, x2);
        int minY = Math.min(y1, y2), maxY = Math.max(y1, y2);
        int minZ = Math.min(z1, z2), maxZ = Math.max(z1, z2);

        ChunkKey lo = chunkOf(minX, minY, minZ);
        ChunkKey hi = chunkOf(maxX, maxY, maxZ);

        Set<String> candidates = new HashSet<>();
        collect(lo.cx(), lo.cy(), lo.cz(), hi.cx(), hi.cy(), hi.cz(), candidates);

        List<String> out = new ArrayList<>();
        for (String id : candidates) {
            Structure s = lookup.apply(id);
            if (s == null) continue;
            GridPosition p = s.position();
            if (p.x() >= minX && p.x() <= maxX && p.y() >= minY && p.y() <= maxY && p.z() >= minZ && p.z() <= maxZ) {
                out.add(id);
            }
        }
        out.sort(Comparator.comparingLong(id -> insertionOrder.getOrDefault(id, Long.MAX_VALUE)));
        return out;
    }

    private void collect(long cx1, long cy1, long cz1, long cx2, long cy2, long cz2, Set<String> into) {
        // chunk keys live in int space
        cx1 = Math.max(cx1, Integer.MIN_VALUE); cy1 = Math.max(cy1, Integer.MIN_VALUE); cz1 = Math.max(cz1, Integer.MIN_VALUE);
        cx2 = Math.min(cx2, Integer.MAX_VALUE); cy2 = Math.min(cy2, Integer.MAX_VALUE); cz2 = Math.min(cz2, Integer.MAX_VALUE);
        double range = (double) (cx2 - cx1 + 1) * (cy2 - cy1 + 1) * (cz2 - cz1 + 1);
        if (range > chunks.size()) {
            // cheaper to walk the populated chunks than the whole range
            for (var e : chunks.entrySet()) {
                ChunkKey k = e.getKey();
                if (k.cx() >= cx1 && k.cx() <= cx2 && k.cy() >= cy1 && k.cy() <= cy2 && k.cz() >= cz1 && k.cz() <= cz2) {
                    into.addAll(e.getValue());
                }
            }
            return;
        }
        for (long cx = cx1; cx <= cx2; cx++) {
            for (long cy = cy1; cy <= cy2; cy++) {
                for (long cz = cz1; cz <= cz2; cz++) {
                    Set<String> ids = chunks.get(new ChunkKey((int) cx, (int) cy, (int) cz));
                    if (ids != null) into.addAll(ids);
                }
            }
        }
    }

    public Set<ChunkKey> chunksOf(String id) {
        Set<ChunkKey> keys = chunksById.get(id);
        return keys != null ? Set.copyOf(keys) : Set.of();
    }

    public boolean contains(String id) {
        return chunksById.containsKey(id);
    }

    public int size() {
        return chunksById.size();
    }

    public int chunkCount() {
        return chunks.size();
    }

    public int getChunkSize() {
        return chunkSize;
    }
}
