package com.qubi.eeg.config;

import com.qubi.eeg.core.error.ConfigurationException;
import com.qubi.eeg.core.model.FilterConfig;
import com.qubi.eeg.core.model.ThresholdConfig;
import com.qubi.eeg.core.runtime.SignalQualityEngine;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisConfigTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void classpathDefaults() {
        AnalysisConfig cfg = AnalysisConfig.defaults();

        assertEquals(new FilterConfig(false, 40.0, false, 60.0, 30.0, 1000.0), cfg.toFilterConfig());
        assertEquals(ThresholdConfig.defaults(), cfg.toThresholdConfig());
        assertEquals(1, cfg.workerThreads);
        assertEquals("REF", cfg.referenceMarker);
    }

    @Test
    void overridesFromFileKeepUnsetDefaults() throws Exception {
        AnalysisConfig cfg;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("analysis-override.yaml")) {
            assertNotNull(in, "analysis-override.yaml no encontrado en el classpath");
            cfg = AnalysisConfig.load(in);
        }

        FilterConfig f = cfg.toFilterConfig();
        assertTrue(f.lowpassEnabled());
        assertEquals(30.0, f.lowpassCutoffHz());
        assertTrue(f.notchEnabled());
        assertEquals(50.0, f.notchFreqHz());
        assertEquals(30.0, f.notchQ(), "Q no está en el archivo");
        assertEquals(250.0, f.samplingRateHz());

        ThresholdConfig t = cfg.toThresholdConfig();
        assertEquals(0.053, t.lowThreshV());
        assertEquals(3.247, t.highThreshV());
        assertEquals(1.0, t.lowAmplitudeThreshMv());

        assertEquals(4, cfg.workerThreads);
        assertEquals("(REF)", cfg.referenceMarker);
    }

    @Test
    void emptyDocumentYieldsDefaults() {
        AnalysisConfig cfg = AnalysisConfig.load(yaml(""));
        assertEquals(ThresholdConfig.defaults(), cfg.toThresholdConfig());
        assertNull(cfg.workerThreads);
    }

    @Test
    void malformedYamlIsAConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> AnalysisConfig.load(yaml("filtering: [lowpassEnabled: true\n  - :")));
        assertThrows(ConfigurationException.class,
                () -> AnalysisConfig.load(yaml("thresholds:\n  lowThreshV: abc\n")));
    }

    @Test
    void engineFromConfig() {
        AnalysisConfig cfg = AnalysisConfig.load(yaml("workerThreads: 2\nfiltering:\n  samplingRateHz: 250\n"));
        try (SignalQualityEngine engine = SignalQualityEngine.fromConfig(cfg)) {
            assertNotNull(engine);
        }
        cfg.workerThreads = null;
        try (SignalQualityEngine engine = SignalQualityEngine.fromConfig(cfg)) {
            assertNotNull(engine);
        }
    }
}
