package com.settleworks.core.economy;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MoraleEngineTest {

    private final MoraleEngine engine = new MoraleEngine(0.5);

    private static Settler settler(String id, double happiness) {
        return new Settler(id, true, happiness, 0, 100, true);
    }

    @Test
    void noLivingSettlersMeansNeutralMorale() {
        MoraleSnapshot snap = engine.computeMorale(List.of(new Settler("dead", false, 90, 80, 0, false)), 500, 10, 3);

        assertEquals(0.0, snap.morale(), 1e-9);
        assertEquals(1.0, engine.getMoraleMultiplier(), 1e-9);
    }

    @Test
    void housingFactorBreakpoints() {
        assertEquals(-50.0, MoraleEngine.housingFactor(3, 0), 1e-9);
        assertEquals(-50.0, MoraleEngine.housingFactor(4, 10), 1e-9);
        assertEquals(-50.0, MoraleEngine.housingFactor(5, 10), 1e-9);
        assertEquals(0.0, MoraleEngine.housingFactor(135, 200), 1e-9);
        assertEquals(50.0, MoraleEngine.housingFactor(17, 20), 1e-9);
        assertEquals(-25.0, MoraleEngine.housingFactor(10, 10), 1e-9);
        assertEquals(-50.0, MoraleEngine.housingFactor(30, 10), 1e-9);
    }

    @Test
    void foodFactorIsMeasuredInDaysOfReserve() {
        // one settler eats 0.5 * 1440 = 720 per day
        assertEquals(50.0, engine.foodFactor(0, 0), 1e-9);
        assertEquals(-50.0, engine.foodFactor(1, 359), 1e-9);
        assertEquals(-50.0, engine.foodFactor(1, 360), 1e-9);
        assertEquals(0.0, engine.foodFactor(1, 720 * 3.75), 1e-9);
        assertEquals(50.0, engine.foodFactor(1, 720 * 7), 1e-9);
        assertEquals(50.0, engine.foodFactor(1, 720 * 30), 1e-9);
    }

    @Test
    void expansionFactorSaturatesAtFifty() {
        assertEquals(0.0, MoraleEngine.expansionFactor(0), 1e-9);
        assertEquals(30.0, MoraleEngine.expansionFactor(3), 1e-9);
        assertEquals(50.0, MoraleEngine.expansionFactor(12), 1e-9);
        assertEquals(0.0, MoraleEngine.expansionFactor(-2), 1e-9);
    }

    @Test
    void compositeUsesFixedWeights() {
        // happiness 75 -> +25, housing 17/20 -> +50, food 7 days -> +50, expansion 2 -> +20
        List<Settler> settlers = new ArrayList<>();
        for (int i = 0; i < 17; i++) settlers.add(settler("s" + i, 75));

        MoraleSnapshot snap = engine.computeMorale(settlers, 17 * 720 * 7, 20, 2);

        assertEquals(25 * 0.4 + 50 * 0.3 + 50 * 0.2 + 20 * 0.1, snap.morale(), 1e-9);
        assertEquals(1.037, snap.multiplier(), 1e-9);
        assertEquals("Very Good", snap.description());
    }

    @Test
    void buildingBonusIsAddedOnTopOfTheComposite() {
        List<Settler> settlers = List.of(settler("a", 50), settler("b", 50));

        double plain = new MoraleEngine(0.5).computeMorale(settlers, 720, 4, 0).morale();
        MoraleSnapshot boosted = engine.computeMorale(settlers, 720, 4, 0, 10);

        assertEquals(plain + 10, boosted.morale(), 1e-9);
        assertEquals(10.0, boosted.buildingBonus(), 1e-9);
        assertEquals(100.0, engine.computeMorale(settlers, 720, 4, 0, 500).morale(), 1e-9);
    }

    @Test
    void moraleAndMultiplierStayInRangeForExtremeInputs() {
        double[] happiness = {0, 50, 100};
        int[] housing = {0, 1, 2, 50};
        double[] food = {0, 100, 1e9};
        int[] expansions = {0, 5, 100};

        for (double h : happiness) {
            for (int cap : housing) {
                for (double f : food) {
                    for (int e : expansions) {
                        MoraleSnapshot snap = engine.computeMorale(List.of(settler("a", h), settler("b", h)), f, cap, e);
                        assertTrue(snap.morale() >= -100 && snap.morale() <= 100, "morale " + snap.morale());
                        assertTrue(snap.multiplier() >= 0.9 && snap.multiplier() <= 1.1, "multiplier " + snap.multiplier());
                    }
                }
            }
        }
    }

    @Test
    void descriptionsFollowThresholds() {
        assertEquals("Excellent", MoraleEngine.describe(51));
        assertEquals("Good", MoraleEngine.describe(0.1));
        assertEquals("Fair", MoraleEngine.describe(0));
        assertEquals("Poor", MoraleEngine.describe(-49));
        assertEquals("Terrible", MoraleEngine.describe(-50));
    }

    @Test
    void statisticsTrackHistory() {
        engine.computeMorale(List.of(settler("a", 100)), 0, 0, 0);
        engine.computeMorale(List.of(settler("a", 0)), 0, 0, 0);

        MoraleEngine.Statistics stats = engine.getStatistics();
        assertEquals(2, stats.samples());
        assertEquals("falling", stats.trend());
        assertEquals(stats.current(), stats.min(), 1e-9);
    }
}
