package com.qubi.eeg.core.model;

import java.util.Objects;

/** Registro final por canal: las cuatro métricas más la etiqueta de calidad. */
public final class QualityRecord {
    // --- obligatorios ---
    private final String channel;
    private final QualityLabel label;

    // --- métricas (calculadas o por defecto) ---
    private final MetricOutcome<DriftResult> drift;
    private final MetricOutcome<AmplitudeResult> amplitude;
    private final MetricOutcome<SnrResult> snr;
    private final MetricOutcome<SaturationResult> saturation;

    private final boolean reference;      // exento del criterio LOW_AMPLITUDE

    private QualityRecord(Builder b) {
        this.channel = Objects.requireNonNull(b.channel, "channel");
        this.label = Objects.requireNonNull(b.label, "label");
        this.drift = Objects.requireNonNull(b.drift, "drift");
        this.amplitude = Objects.requireNonNull(b.amplitude, "amplitude");
        this.snr = Objects.requireNonNull(b.snr, "snr");
        this.saturation = Objects.requireNonNull(b.saturation, "saturation");
        this.reference = b.reference;
    }

    // --- getters ---
    public String channel() { return channel; }
    public QualityLabel label() { return label; }
    public MetricOutcome<DriftResult> drift() { return drift; }
    public MetricOutcome<AmplitudeResult> amplitude() { return amplitude; }
    public MetricOutcome<SnrResult> snr() { return snr; }
    public MetricOutcome<SaturationResult> saturation() { return saturation; }
    public boolean reference() { return reference; }

    // --- atajos para ranking/reportes ---
    public double amplitudeV() { return amplitude.value().amplitudeV(); }
    public double driftRangeV() { return drift.value().rangeV(); }
    public double alphaSnr() { return snr.value().snr(); }
    public double alphaPeakFreqHz() { return snr.value().peakFreqHz(); }

    /** true si alguna de las métricas se tuvo que completar con valores por defecto. */
    public boolean hasDefaultedMetrics() {
        return !drift.isComputed() || !amplitude.isComputed() || !snr.isComputed() || !saturation.isComputed();
    }

    @Override public String toString() {
        return "QualityRecord[" + channel + ", " + label + "]";
    }

    // --- builder ---
    public static Builder builder() { return new Builder(); }
    public static final class Builder {
        private String channel;
        private QualityLabel label;
        private MetricOutcome<DriftResult> drift;
        private MetricOutcome<AmplitudeResult> amplitude;
        private MetricOutcome<SnrResult> snr;
        private MetricOutcome<SaturationResult> saturation;
        private boolean reference;

        public Builder channel(String c){ this.channel = c; return this; }
        public Builder label(QualityLabel l){ this.label = l; return this; }
        public Builder drift(MetricOutcome<DriftResult> d){ this.drift = d; return this; }
        public Builder amplitude(MetricOutcome<AmplitudeResult> a){ this.amplitude = a; return this; }
        public Builder snr(MetricOutcome<SnrResult> s){ this.snr = s; return this; }
        public Builder saturation(MetricOutcome<SaturationResult> s){ this.saturation = s; return this; }
        public Builder reference(boolean r){ this.reference = r; return this; }

        public QualityRecord build() { return new QualityRecord(this); }
    }
}
