package com.qubi.eeg.core.runtime;

import com.qubi.eeg.core.model.*;

import java.util.Objects;

/**
 * Etiqueta cada canal a partir de métricas ya calculadas; sólo compara contra
 * umbrales. Los canales de referencia no cuentan para LOW_AMPLITUDE, pero sí
 * para SATURATED.
 */
public class QualityClassifier {
    public static final String DEFAULT_REFERENCE_MARKER = "REF";

    private final ThresholdConfig thresholds;
    private final String referenceMarker;

    public QualityClassifier(ThresholdConfig thresholds) {
        this(thresholds, DEFAULT_REFERENCE_MARKER);
    }

    public QualityClassifier(ThresholdConfig thresholds, String referenceMarker) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.referenceMarker = Objects.requireNonNull(referenceMarker, "referenceMarker");
    }

    public boolean isReference(String channel) {
        return !referenceMarker.isEmpty() && channel.contains(referenceMarker);
    }

    public QualityLabel label(String channel, double amplitudeV, boolean saturated) {
        boolean low = !isReference(channel) && amplitudeV * 1000.0 < thresholds.lowAmplitudeThreshMv();
        return QualityLabel.of(saturated, low);
    }

    public QualityRecord classify(String channel,
                                  MetricOutcome<DriftResult> drift,
                                  MetricOutcome<AmplitudeResult> amplitude,
                                  MetricOutcome<SnrResult> snr,
                                  MetricOutcome<SaturationResult> saturation) {
        return QualityRecord.builder()
                .channel(channel)
                .drift(drift)
                .amplitude(amplitude)
                .snr(snr)
                .saturation(saturation)
                .reference(isReference(channel))
                .label(label(channel, amplitude.value().amplitudeV(), saturation.value().saturated()))
                .build();
    }
}
