package com.settleworks.core.economy;

/**
 * Settler welfare record. Only the consumption engine mutates it; everyone else receives copies.
 */
public final class Settler {

    private final String id;
    private boolean working;
    private double happiness;
    private double morale;
    private double health;
    private boolean alive;

    public Settler(String id, boolean working, double happiness, double morale, double health, boolean alive) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Settler id is required");
        this.id = id;
        this.working = working;
        this.happiness = clamp(happiness, 0, 100);
        this.morale = clamp(morale, -100, 100);
        this.health = Math.max(0, health);
        this.alive = alive;
    }

    public String getId() { return id; }
    public boolean isWorking() { return working; }
    public double getHappiness() { return happiness; }
    public double getMorale() { return morale; }
    public double getHealth() { return health; }
    public boolean isAlive() { return alive; }

    void setWorking(boolean working) {
        this.working = working;
    }

    void setHappiness(double happiness) {
        this.happiness = clamp(happiness, 0, 100);
        this.morale = clamp((this.happiness - 50) * 2, -100, 100);
    }

    /** Applies damage; reaching zero marks the settler dead. */
    void damage(double amount) {
        health = Math.max(0, health - amount);
        if (health <= 0) {
            alive = false;
            working = false;
        }
    }

    public Settler copy() {
        return new Settler(id, working, happiness, morale, health, alive);
    }

    static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    @Override
    public String toString() {
        return "Settler{" + id + (alive ? "" : ", dead") + (working ? ", working" : ", idle")
                + ", happiness=" + happiness + ", health=" + health + "}";
    }
}
