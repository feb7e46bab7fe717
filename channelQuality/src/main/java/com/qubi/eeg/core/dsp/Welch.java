package com.qubi.eeg.core.dsp;

import com.qubi.eeg.core.error.InsufficientDataException;

/**
 * Estimación de PSD por el método de Welch: ventana Hann periódica, 50% de
 * solapamiento, FFT de 2·nperseg puntos, detrend lineal por segmento y escala
 * de densidad (V²/Hz).
 */
public final class Welch {
    private Welch(){}

    public static final int MIN_SEGMENT = 1024;
    public static final int MAX_SEGMENT = 8192;

    /** clamp(len/8, 1024, 8192), sin superar el largo de la serie. */
    public static int segmentLength(int seriesLength) {
        int nperseg = Math.min(Math.max(seriesLength / 8, MIN_SEGMENT), MAX_SEGMENT);
        return Math.min(nperseg, seriesLength);
    }

    public static PowerSpectrum estimate(double[] x, double samplingRateHz) {
        if (x.length == 0) throw new InsufficientDataException("cannot estimate a spectrum from 0 samples");
        int nperseg = segmentLength(x.length);
        int noverlap = nperseg / 2;
        int nfft = 2 * nperseg;
        int step = nperseg - noverlap;
        int segments = (x.length - noverlap) / step;

        double[] window = hann(nperseg);
        double windowPower = 0;
        for (double v : window) windowPower += v * v;
        double scale = 1.0 / (samplingRateHz * windowPower);

        int bins = nfft / 2 + 1;
        double[] psd = new double[bins];
        double[] segment = new double[nperseg];
        for (int s = 0; s < segments; s++) {
            System.arraycopy(x, s * step, segment, 0, nperseg);
            detrendLinear(segment);
            for (int i = 0; i < nperseg; i++) segment[i] *= window[i];

            double[] power = Fourier.oneSidedPower(segment, nfft);
            for (int k = 0; k < bins; k++) psd[k] += power[k];
        }

        for (int k = 0; k < bins; k++) {
            psd[k] = psd[k] * scale / segments;
            // un solo lado: se duplica todo salvo DC y Nyquist (nfft es par)
            if (k > 0 && k < bins - 1) psd[k] *= 2.0;
        }

        double[] freqs = new double[bins];
        for (int k = 0; k < bins; k++) freqs[k] = k * samplingRateHz / nfft;
        return new PowerSpectrum(freqs, psd, nperseg, segments);
    }

    /** Ventana Hann periódica (la usada para análisis espectral). */
    static double[] hann(int n) {
        double[] w = new double[n];
        if (n == 1) { w[0] = 1.0; return w; }
        for (int i = 0; i < n; i++) w[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / n);
        return w;
    }

    /** Resta la recta de mínimos cuadrados sobre el índice de muestra, in place. */
    static void detrendLinear(double[] v) {
        int n = v.length;
        if (n == 1) { v[0] = 0.0; return; }
        double meanT = (n - 1) / 2.0;
        double meanV = 0;
        for (double d : v) meanV += d;
        meanV /= n;
        double sxy = 0, sxx = 0;
        for (int i = 0; i < n; i++) {
            double dt = i - meanT;
            sxy += dt * (v[i] - meanV);
            sxx += dt * dt;
        }
        double slope = sxy / sxx;
        for (int i = 0; i < n; i++) v[i] -= meanV + slope * (i - meanT);
    }
}
