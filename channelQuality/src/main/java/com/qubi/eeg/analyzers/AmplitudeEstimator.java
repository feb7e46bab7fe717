package com.qubi.eeg.analyzers;

import com.qubi.eeg.core.dsp.Butterworth;
import com.qubi.eeg.core.dsp.ZeroPhaseFilter;
import com.qubi.eeg.core.model.AmplitudeResult;
import com.qubi.eeg.core.model.ChannelSeries;
import com.qubi.eeg.core.model.SampleWindow;
import com.qubi.eeg.core.spi.ChannelAnalyzer;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;

/**
 * Amplitud AC pico a pico robusta a espigas y a deriva lenta.
 * <ol>
 *   <li>pasa altos Butterworth de 4° orden a 0.5 Hz, sin fase;</li>
 *   <li>pico a pico = percentil 99.5 - percentil 0.5 (descarta el 1% extremo);</li>
 *   <li>con más de 5 s de señal: mediana de las ventanas consecutivas de 5 s.
 *       La ventana final incompleta se descarta.</li>
 * </ol>
 */
public class AmplitudeEstimator implements ChannelAnalyzer<AmplitudeResult> {
    public static final double HIGHPASS_HZ = 0.5;
    public static final int ORDER = 4;
    public static final double WINDOW_SECONDS = 5.0;
    public static final double UPPER_PERCENTILE = 99.5;
    public static final double LOWER_PERCENTILE = 0.5;

    @Override public String metric() { return "amplitude"; }

    @Override public AmplitudeResult analyze(ChannelSeries series) {
        double[] ac = ZeroPhaseFilter.filtfilt(
                Butterworth.highPass(ORDER, HIGHPASS_HZ, series.samplingRateHz()), series.samples());
        int windowSize = (int) Math.floor(WINDOW_SECONDS * series.samplingRateHz());

        if (ac.length <= windowSize) {
            double pkPk = robustPeakToPeak(ac);
            int start = Math.max(0, ac.length / 2 - windowSize / 4);
            int end = Math.min(ac.length, start + windowSize / 2);
            return new AmplitudeResult(pkPk, new SampleWindow(start, end), 0);
        }

        int windows = ac.length / windowSize;
        double[] perWindow = new double[windows];
        for (int w = 0; w < windows; w++) {
            int from = w * windowSize;
            perWindow[w] = robustPeakToPeak(Arrays.copyOfRange(ac, from, from + windowSize));
        }
        double median = new Median().withEstimationType(EstimationType.R_7).evaluate(perWindow);

        int best = 0;
        for (int w = 1; w < windows; w++) {
            if (Math.abs(perWindow[w] - median) < Math.abs(perWindow[best] - median)) best = w;
        }
        return new AmplitudeResult(median,
                new SampleWindow(best * windowSize, (best + 1) * windowSize), windows);
    }

    @Override public AmplitudeResult fallback(ChannelSeries series) {
        return AmplitudeResult.neutral();
    }

    /** P99.5 - P0.5 con interpolación lineal entre rangos. */
    static double robustPeakToPeak(double[] values) {
        Percentile p = new Percentile().withEstimationType(EstimationType.R_7);
        p.setData(values);
        return p.evaluate(UPPER_PERCENTILE) - p.evaluate(LOWER_PERCENTILE);
    }
}
