package com.qubi.eeg.core.error;

/** Raíz de los errores de análisis; siempre acotados a una etapa o a un canal. */
public class QualityAnalysisException extends RuntimeException {
    public QualityAnalysisException(String message) { super(message); }
    public QualityAnalysisException(String message, Throwable cause) { super(message, cause); }
}
