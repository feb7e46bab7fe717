package com.qubi.eeg.core.model;

import com.qubi.eeg.core.error.ConfigurationException;

import java.util.Locale;

public record FilterConfig(
        boolean lowpassEnabled,
        double lowpassCutoffHz,   // ej. 40
        boolean notchEnabled,
        double notchFreqHz,       // ej. 60 (red eléctrica)
        double notchQ,            // mayor Q => notch más angosto
        double samplingRateHz
) {
    public static FilterConfig disabled(double samplingRateHz) {
        return new FilterConfig(false, 40.0, false, 60.0, 30.0, samplingRateHz);
    }

    public boolean anyEnabled() { return lowpassEnabled || notchEnabled; }

    public double nyquistHz() { return samplingRateHz / 2.0; }

    /** Sólo se validan los filtros habilitados. */
    public void validate() {
        if (!anyEnabled()) return;
        if (!(samplingRateHz > 0))
            throw new ConfigurationException("sampling rate must be positive: " + samplingRateHz);
        if (lowpassEnabled && !(lowpassCutoffHz > 0 && lowpassCutoffHz < nyquistHz()))
            throw new ConfigurationException(String.format(Locale.ROOT,
                    "low-pass cutoff %.3f Hz outside (0, %.3f) Hz", lowpassCutoffHz, nyquistHz()));
        if (notchEnabled && !(notchFreqHz > 0 && notchFreqHz < nyquistHz()))
            throw new ConfigurationException(String.format(Locale.ROOT,
                    "notch frequency %.3f Hz outside (0, %.3f) Hz", notchFreqHz, nyquistHz()));
        if (notchEnabled && !(notchQ > 0))
            throw new ConfigurationException("notch Q must be positive: " + notchQ);
    }
}
