package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate committee output for one instrument. Built once per evaluation
 * and never modified; owned by the caller that asked for it.
 */
public record CommitteeDecision(
    @JsonProperty("instrumentId")    String instrumentId,
    @JsonProperty("decision")        Decision decision,
    @JsonProperty("decisionReason")  String decisionReason,
    @JsonProperty("finalScore")      int finalScore,
    @JsonProperty("regime")          RegimeResult regime,
    @JsonProperty("breakdown")       ScoreBreakdown breakdown,
    @JsonProperty("reasoning")       CommitteeReasoning reasoning,
    @JsonProperty("tradeParameters") TradeParameters tradeParameters,
    @JsonProperty("signals")         CommitteeSignals signals
) {
    /**
     * SKIP with score 0 and an all-zero breakdown, used when the instrument was
     * not put before the committee (no price, screened out, evaluation failure).
     * The reason is also the single regime reasoning line.
     */
    public static CommitteeDecision skipped(String instrumentId, String reason) {
        return new CommitteeDecision(
            instrumentId,
            Decision.SKIP,
            reason,
            0,
            new RegimeResult(Regime.UNKNOWN, 0, reason, SectorBias.none()),
            ScoreBreakdown.zero(),
            new CommitteeReasoning(List.of(reason), List.of(), List.of(), List.of(), List.of()),
            TradeParameters.zero(),
            CommitteeSignals.unevaluated());
    }
}
