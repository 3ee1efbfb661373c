package com.virtualcommittee.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Scored opinion of one committee member.
 *
 * <p>{@code reasoning} keeps evaluation order; each line starts with a pass
 * ({@code ✓}), borderline ({@code ~}) or fail ({@code ✗}) tag. {@code signals}
 * is the member's fixed-shape record of raw derived metrics.
 *
 * @param <S> signals record type
 */
public record EvaluatorResult<S>(
    @JsonProperty("evaluator") String evaluator,
    @JsonProperty("score")     int score,
    @JsonProperty("maxScore")  int maxScore,
    @JsonProperty("reasoning") List<String> reasoning,
    @JsonProperty("signals")   S signals
) {
    public EvaluatorResult {
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
    }

    public static <S> EvaluatorResult<S> of(String evaluator, int score, int maxScore,
                                            List<String> reasoning, S signals) {
        return new EvaluatorResult<>(evaluator, score, maxScore, reasoning, signals);
    }
}
