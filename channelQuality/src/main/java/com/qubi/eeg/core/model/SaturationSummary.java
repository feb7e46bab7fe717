package com.qubi.eeg.core.model;

import java.util.List;

public record SaturationSummary(
        List<String> belowChannels,     // canales con alguna muestra < low, en orden de entrada
        List<String> aboveChannels,     // canales con alguna muestra > high, en orden de entrada
        int saturatedCount,             // |below ∪ above|
        double overallSaturationPct     // media de max(below_pct, above_pct) sobre todos los canales
) {
    public SaturationSummary {
        belowChannels = List.copyOf(belowChannels);
        aboveChannels = List.copyOf(aboveChannels);
    }

    public static SaturationSummary empty() {
        return new SaturationSummary(List.of(), List.of(), 0, 0.0);
    }
}
