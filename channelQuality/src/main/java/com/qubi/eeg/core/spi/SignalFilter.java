package com.qubi.eeg.core.spi;

import com.qubi.eeg.core.model.FilterConfig;

public interface SignalFilter {
  /** ¿Este filtro está habilitado en la configuración? */
  boolean supports(FilterConfig config);
  /** Devuelve una señal nueva del mismo largo, sin desfase. */
  double[] apply(double[] samples, double samplingRateHz);
  /** Descripción para el reporte, ej. "Low-pass: 40.0 Hz". */
  String describe();
}
