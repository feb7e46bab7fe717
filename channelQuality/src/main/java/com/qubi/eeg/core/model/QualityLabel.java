package com.qubi.eeg.core.model;

public enum QualityLabel {
    NORMAL, SATURATED, LOW_AMPLITUDE, BOTH;

    public static QualityLabel of(boolean saturated, boolean lowAmplitude) {
        if (saturated && lowAmplitude) return BOTH;
        if (saturated) return SATURATED;
        if (lowAmplitude) return LOW_AMPLITUDE;
        return NORMAL;
    }

    public boolean isSaturated() { return this == SATURATED || this == BOTH; }
    public boolean isLowAmplitude() { return this == LOW_AMPLITUDE || this == BOTH; }
}
