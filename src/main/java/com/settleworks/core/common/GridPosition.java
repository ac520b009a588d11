package com.settleworks.core.common;

/**
 * Value Object immutabile che rappresenta una cella intera nel mondo dell'insediamento.
 * Usato come chiave nelle mappe di occupazione del GridIndex, quindi l'uguaglianza è per valore.
 */
public record GridPosition(int x, int y, int z) {

    public static GridPosition of(int x, int y, int z) {
        return new GridPosition(x, y, z);
    }

    public GridPosition add(int dx, int dy, int dz) {
        return new GridPosition(x + dx, y + dy, z + dz);
    }

    public GridPosition add(Vector3Int vec) {
        return new GridPosition(x + vec.x(), y + vec.y(), z + vec.z());
    }

    /**
     * Distanza euclidea da un punto nello spazio continuo (centri delle aure, query per raggio).
     */
    public double distanceTo(double px, double py, double pz) {
        double dx = x - px;
        double dy = y - py;
        double dz = z - pz;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
