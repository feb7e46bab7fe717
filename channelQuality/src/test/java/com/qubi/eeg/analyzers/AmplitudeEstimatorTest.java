package com.qubi.eeg.analyzers;

import com.qubi.eeg.Signals;
import com.qubi.eeg.core.dsp.Butterworth;
import com.qubi.eeg.core.dsp.ZeroPhaseFilter;
import com.qubi.eeg.core.error.InsufficientDataException;
import com.qubi.eeg.core.model.AmplitudeResult;
import com.qubi.eeg.core.model.ChannelSeries;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AmplitudeEstimatorTest {

    private static final double FS = 250.0;
    private static final int WINDOW = 1250;       // 5 s

    private final AmplitudeEstimator estimator = new AmplitudeEstimator();

    private AmplitudeResult analyze(double[] x) {
        return estimator.analyze(new ChannelSeries("Oz", x, FS));
    }

    @Test
    void alphaSinePeakToPeakIgnoresDcOffset() {
        double a = 50e-6;
        double[] x = Signals.offset(Signals.sine(10.0, a, FS, 60.0), 1.65);

        AmplitudeResult r = analyze(x);

        assertEquals(12, r.windowCount());
        assertEquals(2 * a, r.amplitudeV(), 0.01 * 2 * a);
        assertEquals(WINDOW, r.representativeWindow().length());
    }

    @Test
    void scalingTheSignalScalesTheAmplitude() {
        double[] x = Signals.gaussian(20e-6, Signals.samples(FS, 40.0), 21L);
        double k = 3.7;

        double base = analyze(x).amplitudeV();
        double scaled = analyze(Signals.scale(x, k)).amplitudeV();

        assertEquals(k * base, scaled, 1e-9 * k * base);
    }

    @Test
    void trailingPartialWindowIsDropped() {
        double[] x = Signals.gaussian(20e-6, Signals.samples(FS, 62.0), 5L);

        AmplitudeResult r = analyze(x);

        assertEquals(12, r.windowCount());
        assertTrue(r.representativeWindow().endIndex() <= 12 * WINDOW);
        assertEquals(0, r.representativeWindow().startIndex() % WINDOW);
    }

    @Test
    void representativeWindowIsTheOneClosestToTheMedian() {
        // cinco bloques de 5 s con amplitud 1..5: la mediana es el bloque 3
        double[] x = new double[5 * WINDOW];
        for (int w = 0; w < 5; w++) {
            double[] block = Signals.sine(10.0, (w + 1) * 10e-6, FS, 5.0);
            System.arraycopy(block, 0, x, w * WINDOW, WINDOW);
        }

        AmplitudeResult r = analyze(x);

        assertEquals(5, r.windowCount());
        assertEquals(2 * WINDOW, r.representativeWindow().startIndex());
        assertEquals(3 * WINDOW, r.representativeWindow().endIndex());
        assertEquals(60e-6, r.amplitudeV(), 0.02 * 60e-6);
    }

    @Test
    void isolatedArtifactBurstBarelyMovesTheMedian() {
        double[] clean = Signals.gaussian(20e-6, Signals.samples(FS, 60.0), 77L);
        double[] dirty = clean.clone();
        double[] burst = Signals.gaussian(20e-3, 250, 78L);       // 1 s, x1000
        System.arraycopy(burst, 0, dirty, 17 * 250, burst.length);

        double reference = analyze(clean).amplitudeV();
        double withBurst = analyze(dirty).amplitudeV();

        assertEquals(reference, withBurst, 0.15 * reference);
    }

    @Test
    void shortRecordingUsesWholeSeriesAndCentredWindow() {
        double[] x = Signals.sine(10.0, 30e-6, FS, 3.0);         // 750 muestras <= 1250

        AmplitudeResult r = analyze(x);

        assertEquals(0, r.windowCount());
        assertEquals(750 / 2 - WINDOW / 4, r.representativeWindow().startIndex());
        assertEquals(750 / 2 - WINDOW / 4 + WINDOW / 2, r.representativeWindow().endIndex());
        // serie completa, transitorio de arranque del pasa altos incluido
        double[] ac = ZeroPhaseFilter.filtfilt(
                Butterworth.highPass(AmplitudeEstimator.ORDER, AmplitudeEstimator.HIGHPASS_HZ, FS), x);
        assertEquals(AmplitudeEstimator.robustPeakToPeak(ac), r.amplitudeV(), 1e-15);
        assertTrue(r.amplitudeV() >= 0.98 * 60e-6);
    }

    @Test
    void robustPeakToPeakUsesLinearPercentiles() {
        double[] v = new double[201];
        for (int i = 0; i < v.length; i++) v[i] = i;              // 0..200
        // P99.5 = 199, P0.5 = 1
        assertEquals(198.0, AmplitudeEstimator.robustPeakToPeak(v), 1e-9);
    }

    @Test
    void tooShortSeriesIsInsufficient() {
        assertThrows(InsufficientDataException.class, () -> analyze(new double[10]));
    }
}
