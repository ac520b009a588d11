package com.settleworks.core.economy;

import java.util.*;

/**
 * Which settlers staff which structure. Slot limits are checked by the caller that knows the
 * structure type.
 */
public class WorkerAssignments {

    private final Map<String, Set<String>> workersByStructure = new LinkedHashMap<>();
    private final Map<String, String> structureBySettler = new HashMap<>();

    /**
     * Moves the settler to the structure, leaving any previous post.
     */
    public void assign(String settlerId, String structureId) {
        unassign(settlerId);
        workersByStructure.computeIfAbsent(structureId, k -> new LinkedHashSet<>()).add(settlerId);
        structureBySettler.put(settlerId, structureId);
    }

    /**
     * @return the structure the settler worked at, or null
     */
    public String unassign(String settlerId) {
        String structureId = structureBySettler.remove(settlerId);
        if (structureId == null) return null;
        Set<String> workers = workersByStructure.get(structureId);
        if (workers != null) {
            workers.remove(settlerId);
            if (workers.isEmpty()) workersByStructure.remove(structureId);
        }
        return structureId;
    }

    /**
     * @return settlers that lost their post
     */
    public List<String> clearStructure(String structureId) {
        Set<String> workers = workersByStructure.remove(structureId);
        if (workers == null) return List.of();
        workers.forEach(structureBySettler::remove);
        return List.copyOf(workers);
    }

    public int workerCount(String structureId) {
        Set<String> workers = workersByStructure.get(structureId);
        return workers == null ? 0 : workers.size();
    }

    public List<String> workersOf(String structureId) {
        Set<String> workers = workersByStructure.get(structureId);
        return workers == null ? List.of() : List.copyOf(workers);
    }

    public Optional<String> postOf(String settlerId) {
        return Optional.ofNullable(structureBySettler.get(settlerId));
    }

    /** Copy of the whole table, structure id to settler ids. */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        workersByStructure.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return out;
    }

    public void clear() {
        workersByStructure.clear();
        structureBySettler.clear();
    }
}
