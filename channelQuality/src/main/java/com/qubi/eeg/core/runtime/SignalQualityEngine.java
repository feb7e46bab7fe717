package com.qubi.eeg.core.runtime;

import com.qubi.eeg.analyzers.AmplitudeEstimator;
import com.qubi.eeg.analyzers.DriftAnalyzer;
import com.qubi.eeg.analyzers.SaturationDetector;
import com.qubi.eeg.analyzers.SpectralSnrAnalyzer;
import com.qubi.eeg.config.AnalysisConfig;
import com.qubi.eeg.core.error.ConfigurationException;
import com.qubi.eeg.core.error.InsufficientDataException;
import com.qubi.eeg.core.error.QualityAnalysisException;
import com.qubi.eeg.core.model.*;
import com.qubi.eeg.core.spi.ChannelAnalyzer;
import com.qubi.eeg.filters.FilterStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orquesta un análisis de lote:
 * <ol>
 *   <li>FilterStage sobre todo el lote (barrera: termina antes de las métricas);</li>
 *   <li>saturación sobre los datos crudos;</li>
 *   <li>deriva, amplitud y SNR por canal sobre los datos filtrados (o crudos), en
 *       paralelo si hay más de un worker;</li>
 *   <li>clasificación y agregados, siempre en el orden de entrada.</li>
 * </ol>
 * Todo fallo es local al canal o a la etapa, salvo un lote vacío.
 */
public class SignalQualityEngine implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(SignalQualityEngine.class);

    // --- Config
    private final FilterStage filterStage;
    private final ThresholdConfig thresholds;
    private final QualityClassifier classifier;
    private final int workerThreads;

    // --- Analizadores (sin estado, compartidos entre workers)
    private final DriftAnalyzer driftAnalyzer = new DriftAnalyzer();
    private final AmplitudeEstimator amplitudeEstimator = new AmplitudeEstimator();
    private final SpectralSnrAnalyzer snrAnalyzer = new SpectralSnrAnalyzer();

    // --- Runtime
    private final ExecutorService workersPool;   // null => secuencial
    private volatile boolean closed;

    public SignalQualityEngine(FilterConfig filterConfig, ThresholdConfig thresholds) {
        this(filterConfig, thresholds, QualityClassifier.DEFAULT_REFERENCE_MARKER, 1);
    }

    public SignalQualityEngine(FilterConfig filterConfig, ThresholdConfig thresholds,
                               String referenceMarker, int workerThreads) {
        if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be >= 1: " + workerThreads);
        this.filterStage = new FilterStage(Objects.requireNonNull(filterConfig, "filterConfig"));
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.classifier = new QualityClassifier(thresholds, referenceMarker);
        this.workerThreads = workerThreads;
        this.workersPool = workerThreads > 1 ? newWorkersPool(workerThreads) : null;
    }

    public static SignalQualityEngine fromConfig(AnalysisConfig cfg) {
        return new SignalQualityEngine(cfg.toFilterConfig(), cfg.toThresholdConfig(),
                cfg.referenceMarker, cfg.workerThreads != null ? cfg.workerThreads : 1);
    }

    public BatchReport analyze(List<ChannelSeries> batch) {
        if (closed) throw new IllegalStateException("engine closed");
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) throw new InsufficientDataException("batch contains no channels - nothing to classify");
        requireUniqueNames(batch);

        long t0 = System.nanoTime();
        log.info("[start] analyzing {} channels workers={}", batch.size(), workerThreads);
        List<String> warnings = new ArrayList<>();

        FilterOutcome filtering = filterStage.apply(batch);
        warnings.addAll(filtering.warnings());

        List<MetricOutcome<SaturationResult>> saturation = detectSaturation(batch, warnings);
        List<ChannelMetrics> metrics = measureAll(filtering.series());

        List<QualityRecord> records = new ArrayList<>(batch.size());
        Map<String, SaturationResult> saturationByChannel = new LinkedHashMap<>();
        for (int i = 0; i < batch.size(); i++) {
            String name = batch.get(i).name();
            ChannelMetrics m = metrics.get(i);
            warnings.addAll(m.warnings());
            saturationByChannel.put(name, saturation.get(i).value());
            QualityRecord record = classifier.classify(name, m.drift(), m.amplitude(), m.snr(), saturation.get(i));
            log.debug("[classify] {} -> {}", name, record.label());
            records.add(record);
        }

        BatchReport report = new BatchReport(records, SaturationDetector.summarize(saturationByChannel),
                filtering, thresholds, warnings, Instant.now());
        log.info("[done] {} channels in {} ms saturated={} lowAmplitude={} warnings={}",
                records.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0),
                report.saturation().saturatedCount(), report.lowAmplitudeChannels().size(), warnings.size());
        return report;
    }

    @Override public void close() {
        closed = true;
        if (workersPool != null) workersPool.shutdownNow();
    }

    // --- Saturación (datos crudos)
    private List<MetricOutcome<SaturationResult>> detectSaturation(List<ChannelSeries> raw, List<String> warnings) {
        SaturationDetector detector;
        try {
            detector = new SaturationDetector(thresholds);
        } catch (ConfigurationException e) {
            String warning = "Saturation detection skipped: " + e.getMessage();
            log.warn("[saturation] {}", warning);
            warnings.add(warning);
            return raw.stream()
                    .map(ch -> MetricOutcome.defaulted(SaturationResult.neutral(), e.getMessage()))
                    .toList();
        }
        return raw.stream().map(ch -> MetricOutcome.computed(detector.evaluate(ch))).toList();
    }

    // --- Métricas por canal
    private record ChannelMetrics(
            MetricOutcome<DriftResult> drift,
            MetricOutcome<AmplitudeResult> amplitude,
            MetricOutcome<SnrResult> snr,
            List<String> warnings
    ) {}

    private List<ChannelMetrics> measureAll(List<ChannelSeries> series) {
        if (workersPool == null) return series.stream().map(this::measure).toList();

        List<Future<ChannelMetrics>> futures = new ArrayList<>(series.size());
        for (ChannelSeries ch : series) futures.add(workersPool.submit(() -> measure(ch)));

        List<ChannelMetrics> out = new ArrayList<>(series.size());
        try {
            for (Future<ChannelMetrics> f : futures) out.add(f.get());
        } catch (InterruptedException ie) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new QualityAnalysisException("analysis interrupted", ie);
        } catch (ExecutionException ee) {
            futures.forEach(f -> f.cancel(true));
            if (ee.getCause() instanceof RuntimeException re) throw re;
            throw new QualityAnalysisException("channel analysis failed", ee.getCause());
        }
        return out;
    }

    private ChannelMetrics measure(ChannelSeries ch) {
        List<String> warnings = new ArrayList<>(0);
        log.debug("[measure] {} n={} fs={}", ch.name(), ch.length(), ch.samplingRateHz());
        return new ChannelMetrics(
                attempt(driftAnalyzer, ch, warnings),
                attempt(amplitudeEstimator, ch, warnings),
                attempt(snrAnalyzer, ch, warnings),
                warnings);
    }

    private static <R> MetricOutcome<R> attempt(ChannelAnalyzer<R> analyzer, ChannelSeries ch, List<String> warnings) {
        try {
            return MetricOutcome.computed(analyzer.analyze(ch));
        } catch (QualityAnalysisException e) {
            String warning = ch.name() + ": " + analyzer.metric() + " defaulted - " + e.getMessage();
            log.warn("[{}] {}", analyzer.metric(), warning);
            warnings.add(warning);
            return MetricOutcome.defaulted(analyzer.fallback(ch), e.getMessage());
        }
    }

    private static void requireUniqueNames(List<ChannelSeries> batch) {
        Set<String> seen = new HashSet<>();
        for (ChannelSeries ch : batch) {
            if (!seen.add(ch.name())) throw new IllegalArgumentException("duplicate channel name in batch: " + ch.name());
        }
    }

    private static ExecutorService newWorkersPool(int threads) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "quality-workers-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
