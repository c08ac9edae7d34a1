package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived trust rating of a claim. Declared strongest first.
 */
public enum ConfidenceLevel {
    HIGH("high", "High confidence"),
    MEDIUM("medium", "Medium confidence"),
    LOW("low", "Low confidence");

    private final String label;
    private final String marker;

    ConfidenceLevel(String label, String marker) {
        this.label = label;
        this.marker = marker;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Marker printed next to findings in rendered reports. */
    public String marker() {
        return marker;
    }
}
