package com.qubi.eeg.core.error;

/** La serie es más corta que la ventana mínima que necesita una etapa. */
public class InsufficientDataException extends QualityAnalysisException {
    public InsufficientDataException(String message) { super(message); }
}
