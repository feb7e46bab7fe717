package com.qubi.eeg.core.error;

/** Inestabilidad numérica (diseño de filtro, sistema singular, salida no finita). */
public class ComputationException extends QualityAnalysisException {
    public ComputationException(String message) { super(message); }
    public ComputationException(String message, Throwable cause) { super(message, cause); }
}
