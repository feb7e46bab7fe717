package com.qubi.eeg.analyzers;

import com.qubi.eeg.core.dsp.PowerSpectrum;
import com.qubi.eeg.core.error.ComputationException;
import com.qubi.eeg.core.dsp.Welch;
import com.qubi.eeg.core.model.ChannelSeries;
import com.qubi.eeg.core.model.SnrResult;
import com.qubi.eeg.core.spi.ChannelAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SNR alfa: máximo de la PSD de Welch en 8-12 Hz (un solo bin, el pico que se ve
 * en el gráfico) sobre la media de la PSD en 80-100 Hz.
 * <p>
 * Si una banda no tiene bins (serie muy corta o fs baja) o el piso es cero,
 * devuelve SNR 0 en vez de fallar. Un espectro no finito sí es un fallo.
 */
public class SpectralSnrAnalyzer implements ChannelAnalyzer<SnrResult> {
    private static final Logger log = LoggerFactory.getLogger(SpectralSnrAnalyzer.class);

    public static final double ALPHA_LOW_HZ = 8.0;
    public static final double ALPHA_HIGH_HZ = 12.0;
    public static final double NOISE_LOW_HZ = 80.0;
    public static final double NOISE_HIGH_HZ = 100.0;

    @Override public String metric() { return "alpha-snr"; }

    @Override public SnrResult analyze(ChannelSeries series) {
        if (series.length() == 0) return SnrResult.neutral();

        PowerSpectrum spectrum = Welch.estimate(series.samples(), series.samplingRateHz());
        double[] freqs = spectrum.freqs();
        double[] psd = spectrum.psd();
        for (double v : psd) {
            if (!Double.isFinite(v))
                throw new ComputationException("power spectrum is not finite (non-finite samples?)");
        }

        int[] alpha = spectrum.binsBetween(ALPHA_LOW_HZ, ALPHA_HIGH_HZ);
        int[] noise = spectrum.binsBetween(NOISE_LOW_HZ, NOISE_HIGH_HZ);
        if (alpha.length == 0 || noise.length == 0) {
            log.debug("[snr] {}: no bins in alpha ({}) or noise ({}) band, nperseg={}",
                    series.name(), alpha.length, noise.length, spectrum.segmentLength());
            return SnrResult.degenerate(freqs, psd);
        }

        int peak = alpha[0];
        for (int i : alpha) if (psd[i] > psd[peak]) peak = i;

        double floor = 0;
        for (int i : noise) floor += psd[i];
        floor /= noise.length;

        if (!(floor > 0)) return SnrResult.degenerate(freqs, psd);
        return new SnrResult(psd[peak] / floor, freqs[peak], psd[peak], floor, freqs, psd);
    }

    @Override public SnrResult fallback(ChannelSeries series) {
        return SnrResult.neutral();
    }
}
