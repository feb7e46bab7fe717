package com.qubi.eeg.core.runtime;

import com.qubi.eeg.core.model.QualityRecord;
import com.qubi.eeg.core.model.RankedValue;

import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;

/** Rankings descendentes para los gráficos de barras del reporte. Empates: orden de entrada. */
public final class QualityRanking {
    private QualityRanking(){}

    public static List<RankedValue> byAmplitude(List<QualityRecord> records) {
        return rank(records, QualityRecord::amplitudeV);
    }

    public static List<RankedValue> byDriftRange(List<QualityRecord> records) {
        return rank(records, QualityRecord::driftRangeV);
    }

    public static List<RankedValue> bySnr(List<QualityRecord> records) {
        return rank(records, QualityRecord::alphaSnr);
    }

    /** Sólo canales saturados, por max(below_pct, above_pct). */
    public static List<RankedValue> bySaturation(List<QualityRecord> records) {
        return rank(records.stream().filter(r -> r.saturation().value().saturated()).toList(),
                r -> r.saturation().value().totalPct());
    }

    private static List<RankedValue> rank(List<QualityRecord> records, ToDoubleFunction<QualityRecord> metric) {
        // sort estable: los empates conservan el orden de entrada
        return records.stream()
                .map(r -> new RankedValue(r.channel(), metric.applyAsDouble(r)))
                .sorted(Comparator.comparingDouble(RankedValue::value).reversed())
                .toList();
    }
}
