package com.settleworks.core.economy;

import com.settleworks.core.domain.resources.ResourceAmounts;
import com.settleworks.core.domain.resources.ResourceType;

import java.util.*;

/**
 * Bounded resource accounting. All types share one aggregate capacity.
 * A deposit batch may push the total above capacity; {@link #resolveOverflow()} then dumps the
 * cheapest resources first until the total fits again.
 */
public class StorageLedger {

    // absorbs floating point dust when comparing totals against capacity
    private static final double EPSILON = 1e-9;

    public record Snapshot(double capacity, Map<ResourceType, Double> amounts) {
        public Snapshot {
            amounts = ResourceAmounts.immutableCopy(amounts);
        }
    }

    public record Statistics(double totalDeposited, double totalWithdrawn, double totalDumped, int overflowEvents) {
    }

    private final Map<ResourceType, Double> amounts = ResourceAmounts.zeroed();
    private final List<ResourceType> dumpOrder;
    private double capacity;

    private double totalDeposited = 0.0;
    private double totalWithdrawn = 0.0;
    private double totalDumped = 0.0;
    private int overflowEvents = 0;

    public StorageLedger(double capacity) {
        this(capacity, null);
    }

    /**
     * @param unitValues value per unit of each type; missing types use their default value
     */
    public StorageLedger(double capacity, Map<ResourceType, Double> unitValues) {
        requireNonNegative(capacity, "capacity");
        this.capacity = capacity;

        Map<ResourceType, Double> values = new EnumMap<>(ResourceType.class);
        for (ResourceType t : ResourceType.values()) {
            Double v = unitValues == null ? null : unitValues.get(t);
            values.put(t, v != null ? v : t.defaultUnitValue());
        }
        List<ResourceType> order = new ArrayList<>(List.of(ResourceType.values()));
        order.sort(Comparator.comparingDouble((ResourceType t) -> values.get(t)).thenComparingInt(Enum::ordinal));
        this.dumpOrder = List.copyOf(order);
    }

    // ==========================================================
    // DEPOSIT / WITHDRAW
    // ==========================================================

    public DepositResult deposit(ResourceType type, double amount) {
        Objects.requireNonNull(type, "type");
        requireNonNegative(amount, "deposit amount");

        double freeBefore = Math.max(0.0, capacity - getTotal());
        amounts.merge(type, amount, Double::sum);
        totalDeposited += amount;

        double accepted = Math.min(amount, freeBefore);
        return new DepositResult(type, amount, accepted, amount - accepted);
    }

    /**
     * Removes up to {@code amount}.
     *
     * @return the amount actually removed, possibly less than requested
     */
    public double withdraw(ResourceType type, double amount) {
        Objects.requireNonNull(type, "type");
        requireNonNegative(amount, "withdraw amount");

        double available = amounts.get(type);
        double taken = Math.min(amount, available);
        amounts.put(type, available - taken);
        totalWithdrawn += taken;
        return taken;
    }

    public boolean canAfford(Map<ResourceType, Double> cost) {
        return missingFor(cost).isEmpty();
    }

    /** Shortfall per resource for the given cost; empty when affordable. */
    public Map<ResourceType, Double> missingFor(Map<ResourceType, Double> cost) {
        Map<ResourceType, Double> missing = new EnumMap<>(ResourceType.class);
        for (var e : cost.entrySet()) {
            double have = amounts.get(e.getKey());
            if (have + EPSILON < e.getValue()) missing.put(e.getKey(), e.getValue() - have);
        }
        return Collections.unmodifiableMap(missing);
    }

    /**
     * Withdraws the whole cost, or nothing if any part is missing.
     */
    public boolean spend(Map<ResourceType, Double> cost) {
        if (!canAfford(cost)) return false;
        for (var e : cost.entrySet()) {
            withdraw(e.getKey(), Math.min(e.getValue(), amounts.get(e.getKey())));
        }
        return true;
    }

    // ==========================================================
    // OVERFLOW
    // ==========================================================

    /**
     * Dumps the lowest-value resources first until the total fits under capacity.
     * Calling it again without an intervening deposit changes nothing.
     */
    public OverflowReport resolveOverflow() {
        double excess = getTotal() - capacity;
        if (excess <= EPSILON) return OverflowReport.none();

        Map<ResourceType, Double> dumped = new EnumMap<>(ResourceType.class);
        for (ResourceType type : dumpOrder) {
            if (excess <= EPSILON) break;
            double have = amounts.get(type);
            if (have <= 0) continue;

            double drop = Math.min(have, excess);
            amounts.put(type, have - drop);
            dumped.put(type, drop);
            excess -= drop;
        }

        double total = ResourceAmounts.total(dumped);
        totalDumped += total;
        overflowEvents++;
        System.err.println("⚠️ [StorageLedger] Storage overflow: dumped " + format(dumped)
                + " (capacity " + capacity + ")");
        return new OverflowReport(true, total, dumped);
    }

    // ==========================================================
    // CAPACITY
    // ==========================================================

    public void increaseCapacity(double amount) {
        requireNonNegative(amount, "capacity increase");
        capacity += amount;
    }

    /**
     * Replaces the capacity. Shrinking below the stored total resolves the overflow at once.
     */
    public OverflowReport setCapacity(double newCapacity) {
        requireNonNegative(newCapacity, "capacity");
        capacity = newCapacity;
        return resolveOverflow();
    }

    // ==========================================================
    // QUERIES
    // ==========================================================

    public double getAmount(ResourceType type) {
        return amounts.get(type);
    }

    public double getTotal() {
        return ResourceAmounts.total(amounts);
    }

    public double getCapacity() {
        return capacity;
    }

    public double getUtilization() {
        return capacity <= 0 ? (getTotal() > 0 ? 1.0 : 0.0) : getTotal() / capacity;
    }

    /** Independent copy of the stored amounts, every type present. */
    public Map<ResourceType, Double> amounts() {
        return ResourceAmounts.immutableCopy(amounts);
    }

    public List<ResourceType> dumpOrder() {
        return dumpOrder;
    }

    public Statistics getStatistics() {
        return new Statistics(totalDeposited, totalWithdrawn, totalDumped, overflowEvents);
    }

    // ==========================================================
    // SNAPSHOT
    // ==========================================================

    public Snapshot snapshot() {
        return new Snapshot(capacity, amounts);
    }

    public void restore(Snapshot snapshot) {
        requireNonNegative(snapshot.capacity(), "capacity");
        capacity = snapshot.capacity();
        for (ResourceType t : ResourceType.values()) {
            double v = snapshot.amounts().getOrDefault(t, 0.0);
            requireNonNegative(v, t.key() + " amount");
            amounts.put(t, v);
        }
    }

    private static void requireNonNegative(double value, String what) {
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(what + " must be >= 0, got " + value);
        }
    }

    private static String format(Map<ResourceType, Double> dumped) {
        StringJoiner j = new StringJoiner(", ");
        dumped.forEach((t, v) -> j.add(String.format(Locale.ROOT, "%.2f %s", v, t.key())));
        return j.toString();
    }
}
