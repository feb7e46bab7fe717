package com.qubi.eeg.core.model;

public record SnrResult(
        double snr,             // pico alfa / piso de ruido, adimensional
        double peakFreqHz,      // frecuencia del bin máximo en 8-12 Hz
        double peakAmplitude,   // densidad en ese bin (V²/Hz)
        double noiseFloor,      // media de la densidad en 80-100 Hz (V²/Hz)
        double[] freqs,
        double[] psd
) {
    private static final double[] NONE = new double[0];

    public SnrResult {
        freqs = freqs.clone();
        psd = psd.clone();
    }

    @Override public double[] freqs() { return freqs.clone(); }
    @Override public double[] psd() { return psd.clone(); }

    /** SNR nulo pero conservando el espectro calculado, si lo hubo. */
    public static SnrResult degenerate(double[] freqs, double[] psd) {
        return new SnrResult(0.0, 0.0, 0.0, 0.0, freqs, psd);
    }

    public static SnrResult neutral() {
        return degenerate(NONE, NONE);
    }
}
