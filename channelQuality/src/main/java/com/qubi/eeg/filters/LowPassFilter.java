package com.qubi.eeg.filters;

import com.qubi.eeg.core.dsp.Butterworth;
import com.qubi.eeg.core.dsp.ZeroPhaseFilter;
import com.qubi.eeg.core.model.FilterConfig;
import com.qubi.eeg.core.spi.SignalFilter;

import java.util.Locale;

/** Butterworth pasa bajos de 4° orden aplicado sin fase. */
public class LowPassFilter implements SignalFilter {
    public static final int ORDER = 4;

    private final double cutoffHz;

    public LowPassFilter(double cutoffHz) {
        this.cutoffHz = cutoffHz;
    }

    @Override public boolean supports(FilterConfig config) {
        return config.lowpassEnabled();
    }

    @Override public double[] apply(double[] samples, double samplingRateHz) {
        return ZeroPhaseFilter.filtfilt(Butterworth.lowPass(ORDER, cutoffHz, samplingRateHz), samples);
    }

    @Override public String describe() {
        return String.format(Locale.ROOT, "Low-pass: %.1f Hz", cutoffHz);
    }
}
