package com.qubi.eeg.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Resultado de una métrica por canal. Distingue "calculado como cero" de
 * "falló y se usó el valor por defecto".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricOutcome<T>(
        T value,
        Status status,
        String failure      // null si status == COMPUTED
) {
    public enum Status { COMPUTED, DEFAULTED }

    public MetricOutcome {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(status, "status");
    }

    public static <T> MetricOutcome<T> computed(T value) {
        return new MetricOutcome<>(value, Status.COMPUTED, null);
    }

    public static <T> MetricOutcome<T> defaulted(T fallback, String failure) {
        return new MetricOutcome<>(fallback, Status.DEFAULTED, failure);
    }

    public boolean isComputed() { return status == Status.COMPUTED; }
}
