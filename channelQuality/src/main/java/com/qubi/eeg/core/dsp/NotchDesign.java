package com.qubi.eeg.core.dsp;

import com.qubi.eeg.core.error.ConfigurationException;

import java.util.Locale;

/** Notch IIR de segundo orden; ancho de banda a -3 dB = f0 / Q. */
public final class NotchDesign {
    private NotchDesign(){}

    public static IirCoefficients notch(double notchFreqHz, double q, double samplingRateHz) {
        double nyquist = samplingRateHz / 2.0;
        if (!(notchFreqHz > 0 && notchFreqHz < nyquist))
            throw new ConfigurationException(String.format(Locale.ROOT,
                    "notch frequency %.4f Hz outside (0, %.4f) Hz", notchFreqHz, nyquist));
        if (!(q > 0)) throw new ConfigurationException("notch Q must be positive: " + q);

        double w0 = Math.PI * notchFreqHz / nyquist;
        double bw = w0 / q;
        double beta = Math.tan(bw / 2.0);
        double gain = 1.0 / (1.0 + beta);
        double cos = Math.cos(w0);

        double[] b = { gain, -2.0 * gain * cos, gain };
        double[] a = { 1.0, -2.0 * gain * cos, 2.0 * gain - 1.0 };
        return new IirCoefficients(b, a);
    }
}
