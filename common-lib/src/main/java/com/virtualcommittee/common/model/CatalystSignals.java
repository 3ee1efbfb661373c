package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CatalystSignals(
    @JsonProperty("catalystType")      String catalystType,
    @JsonProperty("daysToEvent")       int daysToEvent,
    @JsonProperty("historicalAvgMove") double historicalAvgMove,
    @JsonProperty("expectation")       Expectation expectation
) {
    /** Signals reported when no catalyst is known. */
    public static CatalystSignals none() {
        return new CatalystSignals("none", CatalystDescriptor.UNKNOWN_DAYS, 0.0, Expectation.UNSPECIFIED);
    }
}
