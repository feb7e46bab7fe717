package com.qubi.eeg.filters;

import com.qubi.eeg.core.dsp.NotchDesign;
import com.qubi.eeg.core.dsp.ZeroPhaseFilter;
import com.qubi.eeg.core.model.FilterConfig;
import com.qubi.eeg.core.spi.SignalFilter;

import java.util.Locale;

/** Notch de red eléctrica (50/60 Hz) aplicado sin fase. */
public class NotchFilter implements SignalFilter {
    private final double notchFreqHz;
    private final double q;

    public NotchFilter(double notchFreqHz, double q) {
        this.notchFreqHz = notchFreqHz;
        this.q = q;
    }

    @Override public boolean supports(FilterConfig config) {
        return config.notchEnabled();
    }

    @Override public double[] apply(double[] samples, double samplingRateHz) {
        return ZeroPhaseFilter.filtfilt(NotchDesign.notch(notchFreqHz, q, samplingRateHz), samples);
    }

    @Override public String describe() {
        return String.format(Locale.ROOT, "Notch: %.1f Hz (Q=%.1f)", notchFreqHz, q);
    }
}
