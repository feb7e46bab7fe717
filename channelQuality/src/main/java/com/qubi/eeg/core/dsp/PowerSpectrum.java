package com.qubi.eeg.core.dsp;

/** Densidad espectral de un solo lado: psd[k] corresponde a freqs[k]. */
public record PowerSpectrum(double[] freqs, double[] psd, int segmentLength, int segmentCount) {

    /** Índices (inclusive en ambos bordes) cuyo bin cae en [lowHz, highHz]. */
    public int[] binsBetween(double lowHz, double highHz) {
        int count = 0;
        for (double f : freqs) if (f >= lowHz && f <= highHz) count++;
        int[] out = new int[count];
        int j = 0;
        for (int i = 0; i < freqs.length; i++) {
            if (freqs[i] >= lowHz && freqs[i] <= highHz) out[j++] = i;
        }
        return out;
    }
}
