package com.qubi.eeg.core.error;

/** Cutoff, Q o umbrales inválidos. La etapa afectada se omite para todo el lote. */
public class ConfigurationException extends QualityAnalysisException {
    public ConfigurationException(String message) { super(message); }
    public ConfigurationException(String message, Throwable cause) { super(message, cause); }
}
