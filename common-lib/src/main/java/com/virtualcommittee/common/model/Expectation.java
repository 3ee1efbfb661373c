package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Consensus expectation going into a catalyst. */
public enum Expectation {
    LOW("low"),
    NEUTRAL("neutral"),
    HIGH("high"),
    UNSPECIFIED("unspecified");

    private final String label;

    Expectation(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Case-insensitive; {@code null}, blank or unrecognised text maps to {@link #UNSPECIFIED}. */
    @JsonCreator
    public static Expectation fromLabel(String text) {
        if (text == null || text.isBlank()) return UNSPECIFIED;
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (Expectation e : values()) {
            if (e.label.equals(normalized)) return e;
        }
        return UNSPECIFIED;
    }
}
