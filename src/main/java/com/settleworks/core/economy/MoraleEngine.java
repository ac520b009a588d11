package com.settleworks.core.economy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Composite settlement morale.
 * Four factors (happiness, housing, food reserve, expansion) weighted 40/30/20/10, plus the flat
 * bonus of morale buildings, clamped to [-100, 100]; the production multiplier is {@code 1 + morale / 1000}.
 */
public class MoraleEngine {

    public static final double WEIGHT_HAPPINESS = 0.40;
    public static final double WEIGHT_HOUSING = 0.30;
    public static final double WEIGHT_FOOD = 0.20;
    public static final double WEIGHT_EXPANSION = 0.10;

    private static final double MINUTES_PER_DAY = 1440.0;
    private static final int HISTORY_LIMIT = 100;

    public record Statistics(double current, double average, double min, double max, String trend, int samples) {
    }

    private final double dailyFoodPerSettler;
    private final Deque<Double> history = new ArrayDeque<>();
    private MoraleSnapshot last = MoraleSnapshot.neutral();

    public MoraleEngine(double dailyFoodPerSettler) {
        if (dailyFoodPerSettler < 0) throw new IllegalArgumentException("dailyFoodPerSettler must be >= 0");
        this.dailyFoodPerSettler = dailyFoodPerSettler;
    }

    public MoraleSnapshot computeMorale(Collection<Settler> settlers, double foodAvailable,
                                        int housingCapacity, int expansionCount) {
        return computeMorale(settlers, foodAvailable, housingCapacity, expansionCount, 0.0);
    }

    /**
     * Dead settlers are ignored. With no living settler the morale is 0.
     *
     * @param buildingBonus flat morale added by structures such as campfires
     */
    public MoraleSnapshot computeMorale(Collection<Settler> settlers, double foodAvailable,
                                        int housingCapacity, int expansionCount, double buildingBonus) {
        List<Settler> alive = new ArrayList<>();
        for (Settler s : settlers) {
            if (s.isAlive()) alive.add(s);
        }

        MoraleSnapshot snap;
        if (alive.isEmpty()) {
            snap = MoraleSnapshot.neutral();
        } else {
            double happiness = happinessFactor(alive);
            double housing = housingFactor(alive.size(), housingCapacity);
            double food = foodFactor(alive.size(), foodAvailable);
            double expansion = expansionFactor(expansionCount);

            double composite = happiness * WEIGHT_HAPPINESS
                    + housing * WEIGHT_HOUSING
                    + food * WEIGHT_FOOD
                    + expansion * WEIGHT_EXPANSION
                    + buildingBonus;
            double morale = Math.max(-100.0, Math.min(100.0, composite));

            snap = new MoraleSnapshot(morale, happiness, housing, food, expansion, buildingBonus, toMultiplier(morale), describe(morale));
        }

        last = snap;
        history.addLast(snap.morale());
        while (history.size() > HISTORY_LIMIT) history.removeFirst();
        return snap;
    }

    // ==========================================================
    // FACTORS
    // ==========================================================

    static double happinessFactor(List<Settler> alive) {
        if (alive.isEmpty()) return 0.0;
        double sum = 0.0;
        for (Settler s : alive) sum += s.getHappiness();
        double avg = sum / alive.size();
        return (avg / 100.0) * 100.0 - 50.0;
    }

    /** Rewards 50..85% occupancy, peaking at +50 at 85%. */
    static double housingFactor(int population, int housingCapacity) {
        if (housingCapacity <= 0) return -50.0;

        double occupancy = (double) population / housingCapacity * 100.0;
        double factor;
        if (occupancy < 50.0) {
            factor = -50.0;
        } else if (occupancy <= 85.0) {
            factor = (occupancy - 50.0) * (100.0 / 35.0) - 50.0;
        } else {
            factor = 50.0 - (occupancy - 85.0) * (75.0 / 15.0);
        }
        return Math.max(-50.0, Math.min(50.0, factor));
    }

    double foodFactor(int population, double foodAvailable) {
        if (population == 0) return 50.0;

        double dailyConsumption = population * dailyFoodPerSettler * MINUTES_PER_DAY;
        if (dailyConsumption <= 0) return 50.0;

        double days = foodAvailable / dailyConsumption;
        if (days < 0.5) return -50.0;
        if (days < 7.0) return ((days - 0.5) / 6.5) * 100.0 - 50.0;
        return 50.0;
    }

    static double expansionFactor(int expansionCount) {
        return Math.min(Math.max(0, expansionCount) * 10.0, 50.0);
    }

    public static double toMultiplier(double morale) {
        return 1.0 + morale / 1000.0;
    }

    public static String describe(double morale) {
        if (morale > 50) return "Excellent";
        if (morale > 25) return "Very Good";
        if (morale > 0) return "Good";
        if (morale > -25) return "Fair";
        if (morale > -50) return "Poor";
        return "Terrible";
    }

    // ==========================================================
    // STATE
    // ==========================================================

    public double getMoraleMultiplier() {
        return last.multiplier();
    }

    public MoraleSnapshot getLast() {
        return last;
    }

    /** Seeds the engine after a restore, without touching history. */
    public void setLast(MoraleSnapshot snapshot) {
        this.last = snapshot != null ? snapshot : MoraleSnapshot.neutral();
    }

    public Statistics getStatistics() {
        if (history.isEmpty()) {
            return new Statistics(0.0, 0.0, 0.0, 0.0, "stable", 0);
        }
        double sum = 0.0, min = Double.MAX_VALUE, max = -Double.MAX_VALUE;
        for (double m : history) {
            sum += m;
            min = Math.min(min, m);
            max = Math.max(max, m);
        }
        return new Statistics(last.morale(), sum / history.size(), min, max, trend(), history.size());
    }

    private String trend() {
        if (history.size() < 2) return "stable";
        Double[] values = history.toArray(new Double[0]);
        double delta = values[values.length - 1] - values[values.length - 2];
        if (delta > 0.5) return "rising";
        if (delta < -0.5) return "falling";
        return "stable";
    }
}
