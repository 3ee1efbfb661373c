package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Concrete trade levels attached to a decision. Prices and percentages are
 * rounded to 2dp; {@code positionNotional} is capped at leveraged capacity.
 */
public record TradeParameters(
    @JsonProperty("entry")            double entry,
    @JsonProperty("stop")             double stop,
    @JsonProperty("target")           double target,
    @JsonProperty("rrRatio")          double rrRatio,
    @JsonProperty("positionNotional") double positionNotional,
    @JsonProperty("stopPct")          double stopPct,
    @JsonProperty("targetPct")        double targetPct
) {
    public static TradeParameters zero() {
        return new TradeParameters(0, 0, 0, 0, 0, 0, 0);
    }
}
