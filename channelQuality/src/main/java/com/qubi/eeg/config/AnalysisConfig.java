package com.qubi.eeg.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.qubi.eeg.core.error.ConfigurationException;
import com.qubi.eeg.core.model.FilterConfig;
import com.qubi.eeg.core.model.ThresholdConfig;

import java.io.IOException;
import java.io.InputStream;

/**
 * Configuración resuelta que entrega la capa externa (CLI/dashboard) al motor.
 * Se lee de YAML; las claves ausentes conservan los valores por defecto.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisConfig {
    public static final String DEFAULT_RESOURCE = "signal-quality.yaml";

    public FilteringConfig filtering = new FilteringConfig();
    public ThresholdsConfig thresholds = new ThresholdsConfig();

    /** Workers para el análisis por canal. */
    public Integer workerThreads;              // default: 1 (secuencial, orden determinista)
    /** Marca de canal de referencia (exento de LOW_AMPLITUDE). */
    public String referenceMarker = "REF";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FilteringConfig {
        public boolean lowpassEnabled = false;
        public double lowpassCutoffHz = 40.0;
        public boolean notchEnabled = false;
        public double notchFreqHz = 60.0;      // 50 en redes europeas
        public double notchQ = 30.0;
        public double samplingRateHz = 1000.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ThresholdsConfig {
        public double lowThreshV = 0.053;
        public double highThreshV = 3.247;
        public double lowAmplitudeThreshMv = 0.5;
    }

    public FilterConfig toFilterConfig() {
        return new FilterConfig(filtering.lowpassEnabled, filtering.lowpassCutoffHz,
                filtering.notchEnabled, filtering.notchFreqHz, filtering.notchQ, filtering.samplingRateHz);
    }

    public ThresholdConfig toThresholdConfig() {
        return new ThresholdConfig(thresholds.lowThreshV, thresholds.highThreshV, thresholds.lowAmplitudeThreshMv);
    }

    public static AnalysisConfig load(InputStream yaml) {
        try {
            ObjectMapper om = new ObjectMapper(new YAMLFactory());
            JsonNode root = om.readTree(yaml);
            if (root == null || root.isMissingNode() || root.isNull()) return new AnalysisConfig();   // documento vacío
            return om.treeToValue(root, AnalysisConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Error loading analysis configuration", e);
        }
    }

    /** Lee {@value #DEFAULT_RESOURCE} del classpath. */
    public static AnalysisConfig defaults() {
        try (InputStream in = AnalysisConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) return new AnalysisConfig();
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Error reading " + DEFAULT_RESOURCE, e);
        }
    }
}
