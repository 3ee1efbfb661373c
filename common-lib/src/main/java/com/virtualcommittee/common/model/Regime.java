package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Macro market condition detected from volatility and breadth.
 */
public enum Regime {
    RISK_ON("risk_on"),
    RISK_OFF("risk_off"),
    NEUTRAL("neutral"),
    UNKNOWN("unknown");

    private final String label;

    Regime(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
