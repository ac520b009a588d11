package com.settleworks.core.domain.effects;

/**
 * Locational bonus radiating from a COMPLETE structure. The origin's current position is the
 * effect's centre; the effect itself never stores a copy of it.
 */
public sealed interface Effect permits Effect.ProductionAura, Effect.DefenseZone, Effect.TradeZone {

    String id();

    String originId();

    double radius();

    double multiplier();

    default boolean reaches(double distance) {
        return distance <= radius();
    }

    record ProductionAura(String id, String originId, double radius, double multiplier) implements Effect {
    }

    record DefenseZone(String id, String originId, double radius, double multiplier) implements Effect {
    }

    record TradeZone(String id, String originId, double radius, double multiplier) implements Effect {
    }
}
