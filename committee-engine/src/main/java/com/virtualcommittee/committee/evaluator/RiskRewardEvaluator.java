package com.virtualcommittee.committee.evaluator;

import com.virtualcommittee.common.config.CommitteeConfig;
import com.virtualcommittee.common.model.RiskRewardResult;
import com.virtualcommittee.common.model.RiskRewardSignals;
import com.virtualcommittee.common.model.TickerSnapshot;
import com.virtualcommittee.common.util.Rounding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.virtualcommittee.common.util.Reasons.borderline;
import static com.virtualcommittee.common.util.Reasons.fail;
import static com.virtualcommittee.common.util.Reasons.pass;

/**
 * Checks that an entry/stop/target triple carries a statistical edge and that
 * the position fits the account.
 *
 * <h3>Scoring</h3>
 * <pre>
 *   R:R             ≥4 → 8 | ≥3 → 6 | ≥2 → 3 | else 0
 *   stop structure  with ATR: multiple in [1.5,2.5] → 4 | [1,3] → 2 | else 0
 *                   without ATR: stop ≤ 7% of entry → 2 | else 0
 *   sizing          position for a 2% risk budget ≤ capital·leverage → 3
 *                   ≤ 1.2·capital·leverage → 1 | else 0
 * </pre>
 *
 * <h3>Hard reject</h3>
 * Set when R:R &lt; 3.0 or when the levels cannot be priced at all (non-positive
 * level, stop not below entry). The veto is independent of the score.
 */
@Component
public class RiskRewardEvaluator implements CommitteeMember {

    private static final Logger log = LoggerFactory.getLogger(RiskRewardEvaluator.class);

    public static final int MAX_SCORE = 15;
    public static final double MIN_REWARD_RISK = 3.0;

    private static final double SIZING_TOLERANCE   = 1.2;
    private static final double MAX_STOP_PCT_NO_ATR = 7.0;

    @Override
    public String memberName() { return "riskReward"; }

    @Override
    public int maxScore() { return MAX_SCORE; }

    public RiskRewardResult evaluate(TickerSnapshot ticker, double entry, double stop, double target,
                                     CommitteeConfig config) {
        if (!(entry > 0) || !(stop > 0) || !(target > 0)) {
            log.debug("[RiskRewardEvaluator] Invalid levels entry={} stop={} target={}", entry, stop, target);
            return RiskRewardResult.rejected(MAX_SCORE,
                fail("Invalid prices for R:R calculation"), RiskRewardSignals.invalid(0.0));
        }

        double maxRisk = config.maxRiskAmount();
        double risk    = entry - stop;
        double reward  = target - entry;

        if (risk <= 0) {
            log.debug("[RiskRewardEvaluator] Stop {} not below entry {}", stop, entry);
            return RiskRewardResult.rejected(MAX_SCORE,
                fail("Invalid stop loss (must be below entry)"), RiskRewardSignals.invalid(maxRisk));
        }

        double rr = reward / risk;
        double atr = ticker.atrOrZero();
        double price = ticker.hasPrice() ? ticker.priceOrZero() : entry;

        int score = 0;
        List<String> reasoning = new ArrayList<>();

        // ── 1. Reward:risk (8) ──────────────────────────────────────────────
        if (rr >= 4) {
            score += 8;
            reasoning.add(pass("Excellent R:R %.1f:1", rr));
        } else if (rr >= MIN_REWARD_RISK) {
            score += 6;
            reasoning.add(pass("Acceptable R:R %.1f:1 (required minimum)", rr));
        } else if (rr >= 2) {
            score += 3;
            reasoning.add(borderline("Marginal R:R %.1f:1 (below recommended minimum)", rr));
        } else {
            reasoning.add(fail("Insufficient R:R %.1f:1, do not trade", rr));
        }

        // ── 2. Stop structure (4) ───────────────────────────────────────────
        double stopPct = risk / entry * 100;
        if (atr > 0 && price > 0) {
            double stopInAtr = risk / atr;
            if (stopInAtr >= 1.5 && stopInAtr <= 2.5) {
                score += 4;
                reasoning.add(pass("Stop = %.1fx ATR (well structured)", stopInAtr));
            } else if (stopInAtr >= 1 && stopInAtr <= 3) {
                score += 2;
                reasoning.add(borderline("Stop = %.1fx ATR (acceptable)", stopInAtr));
            } else if (stopInAtr < 1) {
                reasoning.add(fail("Stop = %.1fx ATR (too tight, noise can take you out)", stopInAtr));
            } else {
                reasoning.add(fail("Stop = %.1fx ATR (too wide, excessive risk)", stopInAtr));
            }
        } else if (stopPct <= MAX_STOP_PCT_NO_ATR) {
            score += 2;
            reasoning.add(borderline("Stop %.1f%% without ATR data (assumed reasonable)", stopPct));
        } else {
            reasoning.add(fail("Stop %.1f%% without ATR data to validate it", stopPct));
        }

        // ── 3. Sizing (3) ───────────────────────────────────────────────────
        double capacity      = config.exposureCapacity();
        double shares        = maxRisk / risk;
        double positionValue = shares * entry;
        if (positionValue <= capacity) {
            score += 3;
            reasoning.add(pass("Viable sizing: %.0f exposure for %.0f risk", positionValue, maxRisk));
        } else if (positionValue <= capacity * SIZING_TOLERANCE) {
            score += 1;
            reasoning.add(borderline("Tight sizing: %.0f (limit %.0f)", positionValue, capacity));
        } else {
            reasoning.add(fail("Sizing exceeds capacity: would need %.0f (limit %.0f)", positionValue, capacity));
        }

        boolean hardReject = rr < MIN_REWARD_RISK;

        RiskRewardSignals signals = new RiskRewardSignals(
            Rounding.twoDecimals(rr),
            atr > 0 ? Rounding.twoDecimals(risk / atr) : 0.0,
            positionValue > 0 ? Math.min(positionValue, capacity) : 0.0,
            maxRisk,
            Rounding.twoDecimals(stopPct));

        log.debug("[RiskRewardEvaluator] entry={} stop={} target={} rr={} position={} → score={} hardReject={}",
            entry, stop, target, rr, positionValue, score, hardReject);
        return new RiskRewardResult(score, MAX_SCORE, reasoning, signals, hardReject);
    }
}
