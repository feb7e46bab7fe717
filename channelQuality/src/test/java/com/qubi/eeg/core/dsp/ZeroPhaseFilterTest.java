package com.qubi.eeg.core.dsp;

import com.qubi.eeg.Signals;
import com.qubi.eeg.core.error.ComputationException;
import com.qubi.eeg.core.error.InsufficientDataException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ZeroPhaseFilterTest {

    private static final double FS = 1000.0;

    @Test
    void outputLengthMatchesInput() {
        IirCoefficients lp = Butterworth.lowPass(4, 40.0, FS);
        for (int n : new int[]{16, 17, 100, 1001, 5000}) {
            double[] x = Signals.gaussian(1.0, n, n);
            assertEquals(n, ZeroPhaseFilter.filtfilt(lp, x).length, "largo para n=" + n);
        }
    }

    @Test
    void symmetricPulseKeepsItsPeakIndex() {
        int n = 1001, center = 500;
        double sigma = 20.0;
        double[] x = new double[n];
        for (int i = 0; i < n; i++) x[i] = Math.exp(-0.5 * Math.pow((i - center) / sigma, 2));

        double[] y = ZeroPhaseFilter.filtfilt(Butterworth.lowPass(4, 40.0, FS), x);

        int peak = 0;
        for (int i = 1; i < n; i++) if (y[i] > y[peak]) peak = i;
        assertTrue(Math.abs(peak - center) <= 1, "pico desplazado a " + peak);
    }

    @Test
    void constantSignalPassesUnchangedThroughLowPass() {
        double[] x = Signals.constant(1.65, 500);
        double[] y = ZeroPhaseFilter.filtfilt(Butterworth.lowPass(2, 0.1, FS), x);
        for (double v : y) assertEquals(1.65, v, 1e-9);
    }

    @Test
    void rejectsSeriesNotLongerThanPadding() {
        IirCoefficients lp = Butterworth.lowPass(4, 40.0, FS);
        assertEquals(15, ZeroPhaseFilter.padLength(lp));

        assertThrows(InsufficientDataException.class, () -> ZeroPhaseFilter.filtfilt(lp, new double[15]));
        assertDoesNotThrow(() -> ZeroPhaseFilter.filtfilt(lp, new double[16]));
    }

    @Test
    void steadyStateStateAbsorbsStepInput() {
        IirCoefficients c = Butterworth.lowPass(4, 40.0, FS);
        double[] zi = ZeroPhaseFilter.steadyStateState(c.b(), c.a());

        double[] y = ZeroPhaseFilter.lfilter(c.b(), c.a(), Signals.constant(1.0, 50), zi);
        for (double v : y) assertEquals(1.0, v, 1e-9);
    }

    @Test
    void oddExtensionMirrorsAroundEndpoints() {
        double[] ext = ZeroPhaseFilter.oddExtension(new double[]{1, 2, 4, 7, 11}, 2);
        assertArrayEquals(new double[]{-2, 0, 1, 2, 4, 7, 11, 15, 18}, ext, 1e-12);
    }

    @Test
    void poleOnTheUnitCircleHasNoSteadyState() {
        // a = [1, -1]: integrador puro, (I - Aᵀ) es singular
        assertThrows(ComputationException.class,
                () -> ZeroPhaseFilter.steadyStateState(new double[]{1.0, 0.0}, new double[]{1.0, -1.0}));
    }
}
