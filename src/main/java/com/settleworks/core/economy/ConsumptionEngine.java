package com.settleworks.core.economy;

import java.util.*;

/**
 * Settler roster and food upkeep.
 * Does not touch the ledger: the caller passes the food on hand and withdraws
 * {@link ConsumptionResult#foodConsumed()} afterwards.
 */
public class ConsumptionEngine {

    public static final double BASE_HAPPINESS = 50.0;

    public record Statistics(int total, int alive, int dead, int working, int idle,
                             double averageHappiness, double demandPerTick) {
    }

    private final double workingRate;
    private final double idleRate;
    private final double happinessPenalty;
    private final double healthPenalty;
    private final double maxHealth;

    private final Map<String, Settler> settlers = new LinkedHashMap<>();

    public ConsumptionEngine(double workingRate, double idleRate, double happinessPenalty,
                             double healthPenalty, double maxHealth) {
        if (workingRate < 0 || idleRate < 0) throw new IllegalArgumentException("Consumption rates must be >= 0");
        if (happinessPenalty < 0 || healthPenalty < 0) throw new IllegalArgumentException("Penalties must be >= 0");
        if (maxHealth <= 0) throw new IllegalArgumentException("maxHealth must be > 0");
        this.workingRate = workingRate;
        this.idleRate = idleRate;
        this.happinessPenalty = happinessPenalty;
        this.healthPenalty = healthPenalty;
        this.maxHealth = maxHealth;
    }

    // ==========================================================
    // ROSTER
    // ==========================================================

    public Settler registerSettler(String id, boolean working) {
        if (settlers.containsKey(id)) {
            throw new IllegalArgumentException("Settler already registered: " + id);
        }
        Settler s = new Settler(id, working, BASE_HAPPINESS, 0.0, maxHealth, true);
        settlers.put(id, s);
        return s.copy();
    }

    /** Re-inserts a settler exactly as given, e.g. when restoring a snapshot. */
    public void restoreSettler(Settler settler) {
        settlers.put(settler.getId(), settler.copy());
    }

    public boolean removeSettler(String id) {
        return settlers.remove(id) != null;
    }

    /**
     * @return false when the settler is unknown or dead
     */
    public boolean setWorking(String id, boolean working) {
        Settler s = settlers.get(id);
        if (s == null || !s.isAlive()) return false;
        s.setWorking(working);
        return true;
    }

    public Optional<Settler> getSettler(String id) {
        Settler s = settlers.get(id);
        return s == null ? Optional.empty() : Optional.of(s.copy());
    }

    public List<Settler> getSettlers() {
        List<Settler> out = new ArrayList<>(settlers.size());
        for (Settler s : settlers.values()) out.add(s.copy());
        return out;
    }

    public List<Settler> getAliveSettlers() {
        List<Settler> out = new ArrayList<>();
        for (Settler s : settlers.values()) {
            if (s.isAlive()) out.add(s.copy());
        }
        return out;
    }

    public int aliveCount() {
        int n = 0;
        for (Settler s : settlers.values()) if (s.isAlive()) n++;
        return n;
    }

    public void clear() {
        settlers.clear();
    }

    // ==========================================================
    // TICK
    // ==========================================================

    public double demandPerTick() {
        double demand = 0.0;
        for (Settler s : settlers.values()) {
            if (!s.isAlive()) continue;
            demand += s.isWorking() ? workingRate : idleRate;
        }
        return demand;
    }

    /**
     * Charges every living settler's upkeep against {@code foodAvailable}.
     * When demand exceeds the food, all living settlers take the same happiness and health
     * penalty and the whole reserve is eaten.
     */
    public ConsumptionResult runTick(double foodAvailable) {
        double food = Math.max(0.0, foodAvailable);

        List<Settler> living = new ArrayList<>();
        for (Settler s : settlers.values()) {
            if (s.isAlive()) living.add(s);
        }

        double demand = demandPerTick();
        boolean starving = demand > food;
        double consumed = starving ? food : demand;
        double remaining = Math.max(0.0, food - consumed);

        List<String> affected = new ArrayList<>();
        List<String> deaths = new ArrayList<>();

        if (starving) {
            for (Settler s : living) {
                s.setHappiness(s.getHappiness() - happinessPenalty);
                s.damage(healthPenalty);
                affected.add(s.getId());
                if (!s.isAlive()) deaths.add(s.getId());
            }
            System.err.println("⚠️ [Consumption] Starvation: demand " + round(demand) + " food, had " + round(food)
                    + ". " + affected.size() + " settler(s) affected, " + deaths.size() + " died.");
        } else if (!living.isEmpty()) {
            double foodPerSettler = remaining / living.size();
            for (Settler s : living) {
                s.setHappiness(welfareHappiness(foodPerSettler, s.isWorking()));
            }
        }

        int alive = living.size() - deaths.size();
        int working = 0;
        for (Settler s : living) {
            if (s.isAlive() && s.isWorking()) working++;
        }

        return new ConsumptionResult(demand, consumed, remaining, starving, affected, deaths,
                alive, working, alive - working);
    }

    /**
     * Happiness of a fed settler: base 50, adjusted by the food reserve per head and by whether the
     * settler has work. Clamped to 0..100.
     */
    static double welfareHappiness(double foodPerSettler, boolean working) {
        double h = BASE_HAPPINESS;
        if (foodPerSettler > 50) h += 5;
        else if (foodPerSettler > 10) h += 0;
        else if (foodPerSettler > 1) h -= 3;
        else h -= 10;

        h += working ? 2 : -1;
        return Settler.clamp(h, 0, 100);
    }

    public Statistics getStatistics() {
        int alive = 0, working = 0;
        double happinessSum = 0.0;
        for (Settler s : settlers.values()) {
            if (!s.isAlive()) continue;
            alive++;
            if (s.isWorking()) working++;
            happinessSum += s.getHappiness();
        }
        return new Statistics(settlers.size(), alive, settlers.size() - alive, working, alive - working,
                alive == 0 ? 0.0 : happinessSum / alive, demandPerTick());
    }

    private static String round(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
