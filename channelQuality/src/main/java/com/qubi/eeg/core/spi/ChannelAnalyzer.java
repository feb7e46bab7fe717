package com.qubi.eeg.core.spi;

import com.qubi.eeg.core.model.ChannelSeries;

/**
 * Métrica independiente por canal. Las implementaciones no guardan estado
 * mutable entre canales, así que pueden correr en paralelo.
 */
public interface ChannelAnalyzer<R> {
  /** Nombre corto para logs y advertencias, ej. "drift". */
  String metric();
  /** Calcula la métrica; lanza QualityAnalysisException si no se puede. */
  R analyze(ChannelSeries series);
  /** Valor neutro que se usa cuando analyze() falla para este canal. */
  R fallback(ChannelSeries series);
}
