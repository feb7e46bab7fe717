package com.qubi.eeg.core.model;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/** Estadística descriptiva de una métrica a través de los canales del lote. */
public record MetricSummary(
        int count,
        double mean,
        double median,
        double std,      // poblacional
        double min,
        double max
) {
    public static MetricSummary of(double[] values) {
        if (values.length == 0) return new MetricSummary(0, 0, 0, 0, 0, 0);
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        return new MetricSummary(
                values.length,
                stats.getMean(),
                stats.getPercentile(50),
                Math.sqrt(stats.getPopulationVariance()),
                stats.getMin(),
                stats.getMax());
    }
}
