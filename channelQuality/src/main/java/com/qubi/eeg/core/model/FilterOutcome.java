package com.qubi.eeg.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record FilterOutcome(
        @JsonIgnore List<ChannelSeries> series,   // mismo orden y largo que el lote de entrada
        boolean applied,              // false si no había filtros o la config era inválida
        FilterConfig config,
        List<String> warnings
) {
    public FilterOutcome {
        series = List.copyOf(series);
        warnings = List.copyOf(warnings);
    }
}
