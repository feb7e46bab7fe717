package com.qubi.eeg.core.model;

/**
 * Componente DC lenta del canal y su rango.
 * {@code rangeV = driftSignal[maxIndex] - driftSignal[minIndex]}, nunca negativo.
 */
public record DriftResult(
        double[] driftSignal,   // mismo largo que la serie de entrada
        double rangeV,
        int minIndex,           // primera ocurrencia del mínimo
        int maxIndex            // primera ocurrencia del máximo
) {
    public DriftResult {
        driftSignal = driftSignal.clone();
    }

    @Override public double[] driftSignal() { return driftSignal.clone(); }

    public static DriftResult neutral(int length) {
        return new DriftResult(new double[length], 0.0, 0, 0);
    }
}
