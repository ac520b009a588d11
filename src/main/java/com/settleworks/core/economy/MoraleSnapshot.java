package com.settleworks.core.economy;

public record MoraleSnapshot(
        double morale,
        double happinessFactor,
        double housingFactor,
        double foodFactor,
        double expansionFactor,
        double buildingBonus,
        double multiplier,
        String description
) {

    public static MoraleSnapshot neutral() {
        return new MoraleSnapshot(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 1.0, MoraleEngine.describe(0.0));
    }
}
