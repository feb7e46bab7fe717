package com.qubi.eeg.core.model;

/**
 * {@code saturated} se dispara con una sola muestra fuera de [low, high]; los
 * porcentajes sólo indican la severidad para el reporte.
 */
public record SaturationResult(
        double belowPct,     // % de muestras estrictamente bajo lowThreshV
        double abovePct,     // % de muestras estrictamente sobre highThreshV
        boolean saturated
) {
    public enum Direction { ABOVE, BELOW }

    public static SaturationResult neutral() {
        return new SaturationResult(0.0, 0.0, false);
    }

    public double totalPct() { return Math.max(belowPct, abovePct); }

    public Direction dominantDirection() {
        return abovePct > belowPct ? Direction.ABOVE : Direction.BELOW;
    }
}
