package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param rrRatio           reward / risk, 2dp
 * @param stopAtrMultiple   stop distance in ATRs, 2dp (0 without ATR)
 * @param suggestedPosition notional for a 2% risk budget, capped at leveraged capacity
 * @param riskAmount        currency risked per trade (2% of capital)
 * @param stopPct           stop distance as % of entry, 2dp
 */
public record RiskRewardSignals(
    @JsonProperty("rrRatio")           double rrRatio,
    @JsonProperty("stopAtrMultiple")   double stopAtrMultiple,
    @JsonProperty("suggestedPosition") double suggestedPosition,
    @JsonProperty("riskAmount")        double riskAmount,
    @JsonProperty("stopPct")           double stopPct
) {
    public static RiskRewardSignals invalid(double riskAmount) {
        return new RiskRewardSignals(0.0, 0.0, 0.0, riskAmount, 0.0);
    }
}
