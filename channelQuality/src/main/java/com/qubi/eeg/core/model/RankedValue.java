package com.qubi.eeg.core.model;

public record RankedValue(String channel, double value) {}
