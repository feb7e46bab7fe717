package com.qubi.eeg.analyzers;

import com.qubi.eeg.core.model.ChannelSeries;
import com.qubi.eeg.core.model.SaturationResult;
import com.qubi.eeg.core.model.SaturationSummary;
import com.qubi.eeg.core.model.ThresholdConfig;

import java.util.*;

/**
 * Saturación sobre datos CRUDOS (el recorte del amplificador se ve antes de
 * cualquier filtro). Una sola muestra fuera de [low, high] basta para marcar el
 * canal; los porcentajes son sólo severidad.
 */
public class SaturationDetector {
    private final double lowThreshV;
    private final double highThreshV;

    public SaturationDetector(ThresholdConfig thresholds) {
        thresholds.validate();
        this.lowThreshV = thresholds.lowThreshV();
        this.highThreshV = thresholds.highThreshV();
    }

    public SaturationResult evaluate(ChannelSeries raw) {
        int n = raw.length();
        if (n == 0) return SaturationResult.neutral();
        int below = 0, above = 0;
        for (int i = 0; i < n; i++) {
            double v = raw.sample(i);
            if (v < lowThreshV) below++;
            else if (v > highThreshV) above++;
        }
        return new SaturationResult(100.0 * below / n, 100.0 * above / n, below > 0 || above > 0);
    }

    /** Agregados del lote a partir de los resultados por canal, en orden de entrada. */
    public static SaturationSummary summarize(Map<String, SaturationResult> perChannel) {
        if (perChannel.isEmpty()) return SaturationSummary.empty();
        List<String> below = new ArrayList<>();
        List<String> above = new ArrayList<>();
        Set<String> saturated = new LinkedHashSet<>();
        double total = 0;
        for (var e : perChannel.entrySet()) {
            SaturationResult r = e.getValue();
            if (r.belowPct() > 0) { below.add(e.getKey()); saturated.add(e.getKey()); }
            if (r.abovePct() > 0) { above.add(e.getKey()); saturated.add(e.getKey()); }
            total += r.totalPct();
        }
        return new SaturationSummary(below, above, saturated.size(), total / perChannel.size());
    }

    public SaturationSummary summarize(List<ChannelSeries> rawBatch) {
        Map<String, SaturationResult> perChannel = new LinkedHashMap<>();
        for (ChannelSeries ch : rawBatch) perChannel.put(ch.name(), evaluate(ch));
        return summarize(perChannel);
    }
}
