package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param trendAligned price &gt; EMA20 &gt; EMA50 &gt; EMA200, all positive
 * @param momentum10d  % change over 10 periods (0 when unavailable)
 * @param aboveEma20   price above EMA20 (false when EMA20 unavailable)
 * @param emasGolden   EMA20 above EMA50 (false when either unavailable)
 */
public record SeykotaSignals(
    @JsonProperty("trendAligned") boolean trendAligned,
    @JsonProperty("momentum10d")  double momentum10d,
    @JsonProperty("aboveEma20")   boolean aboveEma20,
    @JsonProperty("emasGolden")   boolean emasGolden
) {}
