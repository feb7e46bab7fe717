package com.qubi.eeg.core.model;

import com.qubi.eeg.core.error.ConfigurationException;

public record ThresholdConfig(
        double lowThreshV,            // saturación inferior, ej. 0.053 V
        double highThreshV,           // saturación superior, ej. 3.247 V
        double lowAmplitudeThreshMv   // amplitud AC mínima, ej. 0.5 mV
) {
    public static ThresholdConfig defaults() {
        return new ThresholdConfig(0.053, 3.247, 0.5);
    }

    public void validate() {
        if (!(highThreshV > lowThreshV))
            throw new ConfigurationException("high threshold " + highThreshV
                    + " V must be greater than low threshold " + lowThreshV + " V");
    }
}
