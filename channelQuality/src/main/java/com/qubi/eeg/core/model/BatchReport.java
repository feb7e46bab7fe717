package com.qubi.eeg.core.model;

import java.time.Instant;
import java.util.*;
import java.util.function.ToDoubleFunction;

/**
 * Salida de un análisis de lote: un {@link QualityRecord} por canal, en el orden
 * de entrada, más los agregados de saturación y filtrado.
 */
public record BatchReport(
        List<QualityRecord> records,
        SaturationSummary saturation,
        FilterOutcome filtering,
        ThresholdConfig thresholds,
        List<String> warnings,
        Instant generatedAt
) {
    public BatchReport {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
        Objects.requireNonNull(saturation, "saturation");
        Objects.requireNonNull(filtering, "filtering");
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(generatedAt, "generatedAt");
    }

    /** Vista nombre -> registro que conserva el orden de entrada. */
    public Map<String, QualityRecord> byChannel() {
        Map<String, QualityRecord> out = new LinkedHashMap<>();
        for (QualityRecord r : records) out.put(r.channel(), r);
        return Collections.unmodifiableMap(out);
    }

    public Optional<QualityRecord> record(String channel) {
        return records.stream().filter(r -> r.channel().equals(channel)).findFirst();
    }

    public List<String> channelsLabelled(QualityLabel label) {
        return records.stream().filter(r -> r.label() == label).map(QualityRecord::channel).toList();
    }

    public List<String> lowAmplitudeChannels() {
        return records.stream().filter(r -> r.label().isLowAmplitude()).map(QualityRecord::channel).toList();
    }

    /** Saturados ∪ baja amplitud, en orden de entrada. */
    public List<String> problematicChannels() {
        return records.stream().filter(r -> r.label() != QualityLabel.NORMAL).map(QualityRecord::channel).toList();
    }

    public MetricSummary amplitudeSummary() { return summarize(QualityRecord::amplitudeV); }
    public MetricSummary driftSummary() { return summarize(QualityRecord::driftRangeV); }
    public MetricSummary snrSummary() { return summarize(QualityRecord::alphaSnr); }

    /** Sólo canales con pico alfa identificado (frecuencia > 0). */
    public MetricSummary alphaPeakFrequencySummary() {
        return MetricSummary.of(records.stream()
                .mapToDouble(QualityRecord::alphaPeakFreqHz)
                .filter(f -> f > 0)
                .toArray());
    }

    private MetricSummary summarize(ToDoubleFunction<QualityRecord> metric) {
        return MetricSummary.of(records.stream().mapToDouble(metric).toArray());
    }
}
