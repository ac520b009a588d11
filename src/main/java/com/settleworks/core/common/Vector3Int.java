package com.settleworks.core.common;

/**
 * Dimensioni di un ingombro (larghezza su x, altezza su y, profondità su z).
 */
public record Vector3Int(int x, int y, int z) {

    public static Vector3Int one() { return new Vector3Int(1, 1, 1); }

    public int volume() {
        return x * y * z;
    }

    public boolean isPositive() {
        return x > 0 && y > 0 && z > 0;
    }
}
