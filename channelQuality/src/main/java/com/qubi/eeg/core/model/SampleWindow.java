package com.qubi.eeg.core.model;

/** Rango semiabierto [startIndex, endIndex) sobre el eje de muestras original. */
public record SampleWindow(int startIndex, int endIndex) {
    public static final SampleWindow EMPTY = new SampleWindow(0, 0);

    public int length() { return endIndex - startIndex; }
}
