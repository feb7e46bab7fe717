package com.qubi.eeg.core.dsp;

import java.util.Arrays;

/** Función de transferencia b(z)/a(z) normalizada con a[0] = 1. */
public record IirCoefficients(double[] b, double[] a) {

    public IirCoefficients {
        if (b.length == 0 || a.length == 0) throw new IllegalArgumentException("empty coefficients");
        if (a[0] == 0.0) throw new IllegalArgumentException("a[0] must be non-zero");
        double a0 = a[0];
        b = Arrays.stream(b).map(v -> v / a0).toArray();    // copias: el record no comparte arreglos
        a = Arrays.stream(a).map(v -> v / a0).toArray();
    }

    @Override public double[] b() { return b.clone(); }
    @Override public double[] a() { return a.clone(); }

    /** max(len(a), len(b)): largo del filtro usado para el padding de filtfilt. */
    public int taps() { return Math.max(a.length, b.length); }

    @Override public String toString() {
        return "IirCoefficients[b=" + Arrays.toString(b) + ", a=" + Arrays.toString(a) + "]";
    }
}
