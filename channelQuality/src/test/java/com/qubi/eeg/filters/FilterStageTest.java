package com.qubi.eeg.filters;

import com.qubi.eeg.Signals;
import com.qubi.eeg.core.model.ChannelSeries;
import com.qubi.eeg.core.model.FilterConfig;
import com.qubi.eeg.core.model.FilterOutcome;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterStageTest {

    private static final double FS = 1000.0;

    private static ChannelSeries channel(String name, double[] x) {
        return new ChannelSeries(name, x, FS);
    }

    @Test
    void noFiltersEnabledIsANoOp() {
        List<ChannelSeries> batch = List.of(channel("Fp1", Signals.gaussian(1, 2000, 1L)));
        FilterOutcome out = new FilterStage(FilterConfig.disabled(FS)).apply(batch);

        assertFalse(out.applied());
        assertEquals(batch, out.series());
        assertTrue(out.warnings().isEmpty());
    }

    @Test
    void lowPassRemovesHighFrequencyAndKeepsAlpha() {
        double[] alpha = Signals.sine(10.0, 1.0, FS, 4.0);
        double[] hum = Signals.sine(150.0, 1.0, FS, 4.0);
        FilterConfig cfg = new FilterConfig(true, 40.0, false, 60.0, 30.0, FS);

        FilterOutcome out = new FilterStage(cfg).apply(List.of(channel("O1", Signals.plus(alpha, hum))));

        assertTrue(out.applied());
        double[] y = out.series().get(0).samples();
        double[] residual = new double[y.length];
        for (int i = 0; i < y.length; i++) residual[i] = y[i] - alpha[i];
        assertTrue(Signals.rms(residual, 500, 3500) < 0.01, "quedó componente de 150 Hz");
    }

    @Test
    void notchSuppressesMainsHum() {
        double[] alpha = Signals.sine(10.0, 1.0, FS, 10.0);
        double[] mains = Signals.sine(60.0, 0.5, FS, 10.0);
        FilterConfig cfg = new FilterConfig(false, 40.0, true, 60.0, 30.0, FS);

        double[] y = new FilterStage(cfg).apply(List.of(channel("Cz", Signals.plus(alpha, mains))))
                .series().get(0).samples();

        double[] residual = new double[y.length];
        for (int i = 0; i < y.length; i++) residual[i] = y[i] - alpha[i];
        assertTrue(Signals.rms(residual, 3000, 7000) < 0.02, "quedó componente de 60 Hz");
    }

    @Test
    void lowPassRunsBeforeNotchAndLengthIsPreserved() {
        FilterConfig cfg = new FilterConfig(true, 40.0, true, 50.0, 30.0, FS);
        FilterStage stage = new FilterStage(cfg);

        assertEquals("Low-pass: 40.0 Hz, Notch: 50.0 Hz (Q=30.0)", stage.describe());
        assertEquals(List.of(LowPassFilter.class, NotchFilter.class),
                stage.activeFilters().stream().map(Object::getClass).toList());

        FilterOutcome out = stage.apply(List.of(
                channel("A", Signals.gaussian(1, 777, 1L)),
                channel("B", Signals.gaussian(1, 3000, 2L))));
        assertEquals(777, out.series().get(0).length());
        assertEquals(3000, out.series().get(1).length());
        assertEquals("A", out.series().get(0).name());
    }

    @Test
    void invalidCutoffSkipsFilteringForTheWholeBatch() {
        double[] raw = Signals.gaussian(1, 2000, 5L);
        FilterConfig cfg = new FilterConfig(true, 600.0, true, 60.0, 30.0, FS);   // > Nyquist

        FilterOutcome out = new FilterStage(cfg).apply(List.of(channel("Fp1", raw), channel("Fp2", raw)));

        assertFalse(out.applied());
        assertEquals(1, out.warnings().size(), "se reporta una sola vez por lote");
        assertArrayEquals(raw, out.series().get(0).samples());
    }

    @Test
    void channelThatCannotBeFilteredStaysRaw() {
        FilterConfig cfg = new FilterConfig(true, 40.0, false, 60.0, 30.0, FS);
        double[] tiny = {1, 2, 3, 4, 5};
        double[] ok = Signals.gaussian(1, 1000, 9L);

        FilterOutcome out = new FilterStage(cfg).apply(List.of(channel("short", tiny), channel("ok", ok)));

        assertTrue(out.applied());
        assertArrayEquals(tiny, out.series().get(0).samples());
        assertFalse(Arrays.equals(ok, out.series().get(1).samples()));
        assertEquals(1, out.warnings().size());
        assertTrue(out.warnings().get(0).startsWith("short:"));
    }

    @Test
    void channelWithDifferentSamplingRateIsLeftUnfiltered() {
        FilterConfig cfg = new FilterConfig(true, 40.0, false, 60.0, 30.0, FS);
        double[] x = Signals.gaussian(1, 1000, 4L);

        FilterOutcome out = new FilterStage(cfg).apply(List.of(new ChannelSeries("T3", x, 500.0)));

        assertArrayEquals(x, out.series().get(0).samples());
        assertEquals(1, out.warnings().size());
    }

    @Test
    void inputBatchIsNotModified() {
        double[] x = Signals.gaussian(1, 1000, 8L);
        ChannelSeries original = channel("Pz", x);
        FilterConfig cfg = new FilterConfig(true, 40.0, true, 60.0, 30.0, FS);

        new FilterStage(cfg).apply(List.of(original));

        assertArrayEquals(x, original.samples());
    }
}
