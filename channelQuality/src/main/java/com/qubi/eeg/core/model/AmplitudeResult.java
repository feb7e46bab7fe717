package com.qubi.eeg.core.model;

public record AmplitudeResult(
        double amplitudeV,                   // pico a pico robusto (percentil 99.5 - 0.5)
        SampleWindow representativeWindow,   // ventana para visualización
        int windowCount                      // ventanas de 5 s evaluadas (0 = serie corta)
) {
    public static AmplitudeResult neutral() {
        return new AmplitudeResult(0.0, SampleWindow.EMPTY, 0);
    }
}
