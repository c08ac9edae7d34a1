package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Requested research depth. Each level maps to a fixed number of subtopics.
 */
public enum Depth {

    QUICK("quick", 3),
    MEDIUM("medium", 5),
    DEEP("deep", 10);

    private final String label;
    private final int subtopicCount;

    Depth(String label, int subtopicCount) {
        this.label = label;
        this.subtopicCount = subtopicCount;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int subtopicCount() {
        return subtopicCount;
    }

    /**
     * @return the next shallower depth, or {@code null} for {@link #QUICK}
     */
    public Depth shallower() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }

    @JsonCreator
    public static Depth fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MEDIUM;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(d -> d.label.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown depth '" + label + "'; expected quick, medium or deep"));
    }
}
