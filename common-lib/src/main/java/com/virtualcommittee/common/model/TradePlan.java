package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-supplied trade levels. Any {@code null} level is derived by the
 * aggregator from the ticker snapshot.
 */
public record TradePlan(
    @JsonProperty("entry")  Double entry,
    @JsonProperty("stop")   Double stop,
    @JsonProperty("target") Double target
) {
    public static TradePlan of(Double entry, Double stop, Double target) {
        return new TradePlan(entry, stop, target);
    }

    public static TradePlan none() {
        return new TradePlan(null, null, null);
    }
}
