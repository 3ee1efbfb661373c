package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw member signals, kept for downstream consumers. Member entries are
 * {@code null} on a degenerate (unevaluated) decision.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommitteeSignals(
    @JsonProperty("regimeType") Regime regimeType,
    @JsonProperty("turtles")    TurtlesSignals turtles,
    @JsonProperty("seykota")    SeykotaSignals seykota,
    @JsonProperty("catalyst")   CatalystSignals catalyst,
    @JsonProperty("riskReward") RiskRewardSignals riskReward
) {
    public static CommitteeSignals unevaluated() {
        return new CommitteeSignals(Regime.UNKNOWN, null, null, null, null);
    }
}
