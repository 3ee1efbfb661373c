package com.virtualcommittee.committee.evaluator;

import com.virtualcommittee.common.model.EvaluatorResult;
import com.virtualcommittee.common.model.TickerSnapshot;
import com.virtualcommittee.common.model.TurtlesSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.virtualcommittee.common.util.Reasons.borderline;
import static com.virtualcommittee.common.util.Reasons.fail;
import static com.virtualcommittee.common.util.Reasons.pass;

/**
 * Turtle-style setup: 20-day breakout confirmed by volume, not yet extended,
 * with an ATR that allows a sensible stop.
 *
 * <pre>
 *   breakout      price &gt; high20d → 10 | price ≥ 0.98·high20d → 5 | else 0
 *   volume        ratio &gt; 1.5 → 8 | ratio &gt; 1.2 → 4 | else 0
 *   extension     (breakout only) &lt; 5% → 4 | &lt; 10% → 2 | else 0; no breakout → 2
 *   ATR % price   [2,6] → 3 | [1,2) or (6,8] → 1 | else 0
 * </pre>
 */
@Component
public class TurtlesEvaluator implements CommitteeMember {

    private static final Logger log = LoggerFactory.getLogger(TurtlesEvaluator.class);

    public static final int MAX_SCORE = 25;

    private static final double NEAR_BREAKOUT_FACTOR = 0.98;
    private static final double STRONG_VOLUME_RATIO  = 1.5;
    private static final double WEAK_VOLUME_RATIO    = 1.2;

    @Override
    public String memberName() { return "turtles"; }

    @Override
    public int maxScore() { return MAX_SCORE; }

    public EvaluatorResult<TurtlesSignals> evaluate(TickerSnapshot ticker) {
        double price     = ticker.priceOrZero();
        double high20d   = ticker.high20dOrPrice();
        double avgVolume = ticker.avgVolumeOrDefault();
        double volume    = ticker.volumeOrZero();
        double atr       = ticker.atrOrZero();

        int score = 0;
        List<String> reasoning = new ArrayList<>();

        // ── 1. 20-day breakout (10) ─────────────────────────────────────────
        // signed distance from the 20d high, % of the high
        double gapPct = high20d > 0 ? (price - high20d) / high20d * 100 : 0.0;
        boolean breakout = price > high20d;
        if (breakout) {
            score += 10;
            reasoning.add(pass("Breakout: price $%.2f > 20d high $%.2f (+%.1f%%)",
                price, high20d, gapPct));
        } else if (price >= high20d * NEAR_BREAKOUT_FACTOR) {
            score += 5;
            reasoning.add(borderline("Near breakout: only %.1f%% below 20d high", -gapPct));
        } else {
            reasoning.add(fail("No breakout: %.1f%% below 20d high", -gapPct));
        }

        // ── 2. Volume confirmation (8) ──────────────────────────────────────
        double volumeRatio = avgVolume > 0 ? volume / avgVolume : 1.0;
        if (volumeRatio > STRONG_VOLUME_RATIO) {
            score += 8;
            reasoning.add(pass("Volume %.1fx average (strong confirmation)", volumeRatio));
        } else if (volumeRatio > WEAK_VOLUME_RATIO) {
            score += 4;
            reasoning.add(borderline("Volume %.1fx average (weak confirmation)", volumeRatio));
        } else {
            reasoning.add(fail("Insufficient volume (%.1fx)", volumeRatio));
        }

        // ── 3. Extension above the breakout level (4) ───────────────────────
        if (breakout) {
            double extension = gapPct;
            if (extension < 5) {
                score += 4;
                reasoning.add(pass("Early entry: only %.1f%% above breakout", extension));
            } else if (extension < 10) {
                score += 2;
                reasoning.add(borderline("Somewhat extended: %.1f%% above breakout", extension));
            } else {
                reasoning.add(fail("Overextended: %.1f%% above breakout (chase risk)", extension));
            }
        } else {
            score += 2;
            reasoning.add(borderline("No extension risk (no active breakout)"));
        }

        // ── 4. ATR quality (3) ──────────────────────────────────────────────
        double atrPct = (price > 0 && atr > 0) ? atr / price * 100 : 0.0;
        if (price > 0 && atr > 0) {
            if (atrPct >= 2 && atrPct <= 6) {
                score += 3;
                reasoning.add(pass("ATR %.1f%%, manageable stop", atrPct));
            } else if (atrPct >= 1 && atrPct < 2) {
                score += 1;
                reasoning.add(borderline("ATR %.1f%%, little movement", atrPct));
            } else if (atrPct > 6 && atrPct <= 8) {
                score += 1;
                reasoning.add(borderline("ATR %.1f%%, volatile but manageable", atrPct));
            } else if (atrPct > 8) {
                reasoning.add(fail("ATR %.1f%%, too volatile", atrPct));
            } else {
                reasoning.add(fail("ATR %.1f%%, too quiet", atrPct));
            }
        } else {
            reasoning.add(fail("No ATR data"));
        }

        TurtlesSignals signals = new TurtlesSignals(
            breakout, volumeRatio > STRONG_VOLUME_RATIO, atrPct, volumeRatio);

        log.debug("[TurtlesEvaluator] price={} high20d={} volumeRatio={} atrPct={} → score={}",
            price, high20d, volumeRatio, atrPct, score);
        return EvaluatorResult.of(memberName(), score, MAX_SCORE, reasoning, signals);
    }
}
