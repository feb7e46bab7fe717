package com.qubi.eeg.filters;

import com.qubi.eeg.core.error.ConfigurationException;
import com.qubi.eeg.core.error.QualityAnalysisException;
import com.qubi.eeg.core.model.ChannelSeries;
import com.qubi.eeg.core.model.FilterConfig;
import com.qubi.eeg.core.model.FilterOutcome;
import com.qubi.eeg.core.spi.SignalFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Filtrado opcional del lote antes de las métricas: pasa bajos primero, notch
 * después, cada canal por separado. El lote original no se modifica.
 * <p>
 * Una configuración inválida se reporta una sola vez y el lote sigue sin
 * filtrar; un canal que no se puede filtrar queda crudo con su advertencia.
 */
public class FilterStage {
    private static final Logger log = LoggerFactory.getLogger(FilterStage.class);

    private final FilterConfig config;
    private final List<SignalFilter> filters;

    public FilterStage(FilterConfig config) {
        this(config, List.of(
                new LowPassFilter(config.lowpassCutoffHz()),
                new NotchFilter(config.notchFreqHz(), config.notchQ())));
    }

    public FilterStage(FilterConfig config, List<SignalFilter> chain) {
        this.config = Objects.requireNonNull(config, "config");
        this.filters = chain.stream().filter(f -> f.supports(config)).collect(Collectors.toUnmodifiableList());
    }

    public FilterConfig config() { return config; }

    public List<SignalFilter> activeFilters() { return filters; }

    public FilterOutcome apply(List<ChannelSeries> batch) {
        if (filters.isEmpty()) {
            log.info("[filter] no filters enabled - using raw data");
            return new FilterOutcome(batch, false, config, List.of());
        }
        try {
            config.validate();
        } catch (ConfigurationException e) {
            String warning = "Filtering skipped, using unfiltered data: " + e.getMessage();
            log.warn("[filter] {}", warning);
            return new FilterOutcome(batch, false, config, List.of(warning));
        }

        log.info("[filter] applying {} to {} channels", describe(), batch.size());
        List<ChannelSeries> out = new ArrayList<>(batch.size());
        List<String> warnings = new ArrayList<>();
        for (ChannelSeries ch : batch) {
            out.add(filterChannel(ch, warnings));
        }
        return new FilterOutcome(out, true, config, warnings);
    }

    public String describe() {
        return filters.stream().map(SignalFilter::describe).collect(Collectors.joining(", "));
    }

    private ChannelSeries filterChannel(ChannelSeries ch, List<String> warnings) {
        if (Double.compare(ch.samplingRateHz(), config.samplingRateHz()) != 0) {
            String warning = String.format("%s: sampling rate %s Hz differs from filter configuration %s Hz, left unfiltered",
                    ch.name(), ch.samplingRateHz(), config.samplingRateHz());
            log.warn("[filter] {}", warning);
            warnings.add(warning);
            return ch;
        }
        double[] cur = ch.samples();
        try {
            for (SignalFilter f : filters) cur = f.apply(cur, config.samplingRateHz());
        } catch (QualityAnalysisException e) {
            String warning = ch.name() + ": left unfiltered - " + e.getMessage();
            log.warn("[filter] {}", warning);
            warnings.add(warning);
            return ch;
        }
        return ch.withSamples(cur);
    }
}
