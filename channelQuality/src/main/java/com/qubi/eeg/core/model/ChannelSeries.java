package com.qubi.eeg.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Un canal de la grabación: nombre único dentro del lote, muestras en voltios y
 * frecuencia de muestreo. Las muestras se copian al construir y al leer, así que
 * ninguna etapa puede mutar la serie de otra.
 */
public final class ChannelSeries {
    private final String name;
    private final double[] samples;       // voltios
    private final double samplingRateHz;

    public ChannelSeries(String name, double[] samples, double samplingRateHz) {
        this.name = Objects.requireNonNull(name, "name");
        this.samples = Objects.requireNonNull(samples, "samples").clone();
        if (!(samplingRateHz > 0) || Double.isInfinite(samplingRateHz))
            throw new IllegalArgumentException("samplingRateHz must be positive: " + samplingRateHz);
        this.samplingRateHz = samplingRateHz;
    }

    public String name() { return name; }
    public double samplingRateHz() { return samplingRateHz; }
    public int length() { return samples.length; }
    public double sample(int i) { return samples[i]; }

    /** Copia defensiva de las muestras. */
    public double[] samples() { return samples.clone(); }

    /** Misma identidad de canal con otras muestras (p.ej. la versión filtrada). */
    public ChannelSeries withSamples(double[] newSamples) {
        return new ChannelSeries(name, newSamples, samplingRateHz);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelSeries other)) return false;
        return name.equals(other.name)
                && Double.compare(samplingRateHz, other.samplingRateHz) == 0
                && Arrays.equals(samples, other.samples);
    }

    @Override public int hashCode() {
        return 31 * Objects.hash(name, samplingRateHz) + Arrays.hashCode(samples);
    }

    @Override public String toString() {
        return "ChannelSeries[" + name + ", n=" + samples.length + ", fs=" + samplingRateHz + "]";
    }
}
