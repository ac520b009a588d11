package com.settleworks.core.progression;

/**
 * Ordered progression stages. Ordinal order is the advancement order.
 */
public enum Tier {
    SURVIVAL,
    PERMANENT,
    TOWN,
    CASTLE;

    public boolean isAfter(Tier other) {
        return ordinal() > other.ordinal();
    }

    /** Next tier, or null when already at the last one. */
    public Tier next() {
        Tier[] all = values();
        return ordinal() + 1 < all.length ? all[ordinal() + 1] : null;
    }

    /** Steps from {@code from} to this tier (negative when behind). */
    public int stepsFrom(Tier from) {
        return ordinal() - from.ordinal();
    }
}
