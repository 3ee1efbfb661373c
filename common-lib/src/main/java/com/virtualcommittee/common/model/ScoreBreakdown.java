package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-member contributions. {@code rawScore} is the plain sum of the five
 * members; {@code sectorAdjustment} is {@code finalScore - rawScore}.
 */
public record ScoreBreakdown(
    @JsonProperty("regime")           int regime,
    @JsonProperty("turtles")          int turtles,
    @JsonProperty("seykota")          int seykota,
    @JsonProperty("catalyst")         int catalyst,
    @JsonProperty("riskReward")       int riskReward,
    @JsonProperty("sectorAdjustment") int sectorAdjustment,
    @JsonProperty("rawScore")         int rawScore
) {
    public static ScoreBreakdown zero() {
        return new ScoreBreakdown(0, 0, 0, 0, 0, 0, 0);
    }
}
