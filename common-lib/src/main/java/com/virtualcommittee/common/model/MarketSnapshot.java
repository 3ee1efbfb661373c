package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Macro facts used by the regime detector.
 *
 * <p>{@code indexAbove200Ema} absent is read as {@code true} (assume an uptrend),
 * {@code breadthRatio} absent as {@code 1.0}. An absent {@code vix} makes the
 * regime {@link Regime#UNKNOWN}.
 */
public record MarketSnapshot(
    @JsonProperty("vix")              Double vix,
    @JsonProperty("indexChangePct")   Double indexChangePct,
    @JsonProperty("indexAbove200Ema") Boolean indexAbove200Ema,
    @JsonProperty("breadthRatio")     Double breadthRatio
) {
    public static MarketSnapshot of(Double vix, Double indexChangePct,
                                    Boolean indexAbove200Ema, Double breadthRatio) {
        return new MarketSnapshot(vix, indexChangePct, indexAbove200Ema, breadthRatio);
    }

    public static MarketSnapshot empty() {
        return new MarketSnapshot(null, null, null, null);
    }

    public boolean indexAbove200EmaOrDefault() {
        return indexAbove200Ema == null || indexAbove200Ema;
    }

    public double breadthRatioOrDefault() {
        return breadthRatio != null ? breadthRatio : 1.0;
    }
}
