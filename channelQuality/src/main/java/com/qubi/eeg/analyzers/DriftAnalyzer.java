package com.qubi.eeg.analyzers;

import com.qubi.eeg.core.dsp.Butterworth;
import com.qubi.eeg.core.dsp.ZeroPhaseFilter;
import com.qubi.eeg.core.model.ChannelSeries;
import com.qubi.eeg.core.model.DriftResult;
import com.qubi.eeg.core.spi.ChannelAnalyzer;

/**
 * Deriva DC: pasa bajos Butterworth de 2° orden a 0.1 Hz sin fase, y los
 * extremos (índice incluido) de la curva resultante.
 */
public class DriftAnalyzer implements ChannelAnalyzer<DriftResult> {
    public static final double CUTOFF_HZ = 0.1;
    public static final int ORDER = 2;

    @Override public String metric() { return "drift"; }

    @Override public DriftResult analyze(ChannelSeries series) {
        double[] drift = ZeroPhaseFilter.filtfilt(
                Butterworth.lowPass(ORDER, CUTOFF_HZ, series.samplingRateHz()), series.samples());

        int minIdx = 0, maxIdx = 0;
        for (int i = 1; i < drift.length; i++) {
            if (drift[i] < drift[minIdx]) minIdx = i;
            if (drift[i] > drift[maxIdx]) maxIdx = i;
        }
        return new DriftResult(drift, drift[maxIdx] - drift[minIdx], minIdx, maxIdx);
    }

    @Override public DriftResult fallback(ChannelSeries series) {
        return DriftResult.neutral(series.length());
    }
}
