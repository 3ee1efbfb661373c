package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Risk/reward member output. Same shape as {@link EvaluatorResult} plus the
 * {@code hardReject} veto, which is independent of {@code score}.
 */
public record RiskRewardResult(
    @JsonProperty("score")      int score,
    @JsonProperty("maxScore")   int maxScore,
    @JsonProperty("reasoning")  List<String> reasoning,
    @JsonProperty("signals")    RiskRewardSignals signals,
    @JsonProperty("hardReject") boolean hardReject
) {
    public RiskRewardResult {
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
    }

    /** Zero score plus veto, for inputs the evaluator cannot price. */
    public static RiskRewardResult rejected(int maxScore, String reason, RiskRewardSignals signals) {
        return new RiskRewardResult(0, maxScore, List.of(reason), signals, true);
    }
}
