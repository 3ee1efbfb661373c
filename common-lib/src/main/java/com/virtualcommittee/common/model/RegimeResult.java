package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of the regime detector: label, partial score (0–15), one line of
 * reasoning and the sector bias for the adjustment step.
 */
public record RegimeResult(
    @JsonProperty("regime")     Regime regime,
    @JsonProperty("score")      int score,
    @JsonProperty("reasoning")  String reasoning,
    @JsonProperty("sectorBias") SectorBias sectorBias
) {
    public static final int MAX_SCORE = 15;

    public RegimeResult {
        sectorBias = sectorBias == null ? SectorBias.none() : sectorBias;
    }
}
