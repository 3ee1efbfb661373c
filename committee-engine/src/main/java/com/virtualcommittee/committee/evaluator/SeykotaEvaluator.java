package com.virtualcommittee.committee.evaluator;

import com.virtualcommittee.common.model.EvaluatorResult;
import com.virtualcommittee.common.model.SeykotaSignals;
import com.virtualcommittee.common.model.TickerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.virtualcommittee.common.util.Reasons.borderline;
import static com.virtualcommittee.common.util.Reasons.fail;
import static com.virtualcommittee.common.util.Reasons.pass;

/**
 * Trend-following alignment check: are we trading with the tape?
 *
 * <pre>
 *   price vs EMA20     above → 6 | within 3% below → 3 | else 0
 *   EMA20 vs EMA50     above → 6 | else 0
 *   EMA50 vs EMA200    above → 4 | below → 0 | EMA200 missing, EMA50 present → 2
 *   10d momentum %     &gt;5 → 4 | &gt;2 → 3 | &gt;0 → 2 | &gt;−3 → 1 | else 0
 * </pre>
 * A moving average of 0 means "unavailable"; comparisons against it score 0.
 */
@Component
public class SeykotaEvaluator implements CommitteeMember {

    private static final Logger log = LoggerFactory.getLogger(SeykotaEvaluator.class);

    public static final int MAX_SCORE = 20;

    private static final double SUPPORT_ZONE_FACTOR = 0.97;

    @Override
    public String memberName() { return "seykota"; }

    @Override
    public int maxScore() { return MAX_SCORE; }

    public EvaluatorResult<SeykotaSignals> evaluate(TickerSnapshot ticker) {
        double price       = ticker.priceOrZero();
        double ema20       = ticker.ema20OrZero();
        double ema50       = ticker.ema50OrZero();
        double ema200      = ticker.ema200OrZero();
        double price10dAgo = ticker.price10dAgoOrPrice();

        int score = 0;
        List<String> reasoning = new ArrayList<>();

        // ── 1. Price vs short EMA (6) ───────────────────────────────────────
        if (price > 0 && ema20 > 0) {
            if (price > ema20) {
                score += 6;
                reasoning.add(pass("Price > EMA20 (+%.1f%%, short-term uptrend)",
                    (price - ema20) / ema20 * 100));
            } else if (price >= ema20 * SUPPORT_ZONE_FACTOR) {
                score += 3;
                reasoning.add(borderline("Price near EMA20 (key support)"));
            } else {
                reasoning.add(fail("Price < EMA20 (-%.1f%%, short-term weakness)",
                    (ema20 - price) / ema20 * 100));
            }
        } else {
            reasoning.add(fail("No EMA20 data"));
        }

        // ── 2. EMA20 / EMA50 structure (6) ──────────────────────────────────
        boolean golden = ema20 > 0 && ema50 > 0 && ema20 > ema50;
        if (ema20 > 0 && ema50 > 0) {
            if (golden) {
                score += 6;
                reasoning.add(pass("EMA20 > EMA50 (bullish structure)"));
            } else {
                reasoning.add(fail("EMA20 < EMA50 (bearish cross)"));
            }
        } else {
            reasoning.add(fail("No EMA data for structure"));
        }

        // ── 3. Long-term trend (4) ──────────────────────────────────────────
        if (ema50 > 0 && ema200 > 0) {
            if (ema50 > ema200) {
                score += 4;
                reasoning.add(pass("EMA50 > EMA200 (primary uptrend)"));
            } else {
                reasoning.add(fail("EMA50 < EMA200 (primary downtrend, trading against it)"));
            }
        } else if (ema50 > 0) {
            score += 2;
            reasoning.add(borderline("No EMA200 (assuming neutral long-term trend)"));
        } else {
            reasoning.add(fail("No long EMA data"));
        }

        // ── 4. 10-period momentum (4) ───────────────────────────────────────
        double momentum = (price > 0 && price10dAgo > 0)
            ? (price - price10dAgo) / price10dAgo * 100
            : 0.0;
        if (price > 0 && price10dAgo > 0) {
            if (momentum > 5) {
                score += 4;
                reasoning.add(pass("Strong momentum +%.1f%% over 10d", momentum));
            } else if (momentum > 2) {
                score += 3;
                reasoning.add(pass("Positive momentum +%.1f%% over 10d", momentum));
            } else if (momentum > 0) {
                score += 2;
                reasoning.add(borderline("Mild momentum +%.1f%% over 10d", momentum));
            } else if (momentum > -3) {
                score += 1;
                reasoning.add(borderline("Flat momentum %.1f%% over 10d", momentum));
            } else {
                reasoning.add(fail("Negative momentum %.1f%% over 10d", momentum));
            }
        } else {
            reasoning.add(fail("No momentum data"));
        }

        boolean allPositive = price > 0 && ema20 > 0 && ema50 > 0 && ema200 > 0;
        SeykotaSignals signals = new SeykotaSignals(
            allPositive && price > ema20 && ema20 > ema50 && ema50 > ema200,
            momentum,
            ema20 > 0 && price > ema20,
            golden);

        log.debug("[SeykotaEvaluator] price={} ema20={} ema50={} ema200={} momentum={} → score={}",
            price, ema20, ema50, ema200, momentum, score);
        return EvaluatorResult.of(memberName(), score, MAX_SCORE, reasoning, signals);
    }
}
