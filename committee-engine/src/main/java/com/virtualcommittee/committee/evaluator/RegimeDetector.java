package com.virtualcommittee.committee.evaluator;

import com.virtualcommittee.common.model.MarketSnapshot;
import com.virtualcommittee.common.model.Regime;
import com.virtualcommittee.common.model.RegimeResult;
import com.virtualcommittee.common.model.SectorBias;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Classifies the macro regime from VIX, the broad index's 200 EMA position and
 * breadth, and scores how friendly it is to new longs.
 *
 * <p>Rules, in priority order:
 * <ol>
 *   <li>vix absent                               → UNKNOWN, 10, no bias</li>
 *   <li>vix &lt; 18 AND index above 200 EMA       → RISK_ON, 15, boost growth/cyclicals</li>
 *   <li>vix &gt; 25 OR (vix &gt; 20 AND index below) → RISK_OFF, 5 (0 when vix ≥ 30), defensive bias</li>
 *   <li>otherwise                                → NEUTRAL, 10, no bias</li>
 * </ol>
 * Breadth ≥ 1.2 only changes the RISK_ON wording; the score is already at its ceiling.
 */
@Component
public class RegimeDetector implements CommitteeMember {

    private static final Logger log = LoggerFactory.getLogger(RegimeDetector.class);

    public static final int MAX_SCORE = RegimeResult.MAX_SCORE;

    private static final double CALM_VIX     = 18.0;
    private static final double ELEVATED_VIX = 20.0;
    private static final double STRESSED_VIX = 25.0;
    private static final double PANIC_VIX    = 30.0;
    private static final double EXPANSIVE_BREADTH = 1.2;

    private static final int BOOST_POINTS    = 5;
    private static final int PENALTY_POINTS  = 10;

    private static final SectorBias RISK_ON_BIAS = new SectorBias(
        List.of("tech", "consumer_discretionary", "semiconductors"), List.of());
    private static final SectorBias RISK_OFF_BIAS = new SectorBias(
        List.of("utilities", "healthcare", "staples"),
        List.of("tech", "growth", "small_caps"));

    @Override
    public String memberName() { return "regime"; }

    @Override
    public int maxScore() { return MAX_SCORE; }

    public RegimeResult detect(MarketSnapshot market) {
        MarketSnapshot snapshot = market != null ? market : MarketSnapshot.empty();
        Double vix = snapshot.vix();
        if (vix == null) {
            log.debug("[RegimeDetector] No VIX in snapshot, regime unknown");
            return new RegimeResult(Regime.UNKNOWN, 10,
                "No VIX data, assuming neutral conditions", SectorBias.none());
        }

        boolean indexUptrend = snapshot.indexAbove200EmaOrDefault();
        double breadth = snapshot.breadthRatioOrDefault();

        RegimeResult result;
        if (vix < CALM_VIX && indexUptrend) {
            String reasoning = breadth >= EXPANSIVE_BREADTH
                ? format("Low VIX (%.1f), index above 200 EMA, expansive breadth (%.2f). Ideal for breakouts.", vix, breadth)
                : format("Low VIX (%.1f), market in an uptrend. Good backdrop for longs.", vix);
            result = new RegimeResult(Regime.RISK_ON, MAX_SCORE, reasoning, RISK_ON_BIAS);
        } else if (vix > STRESSED_VIX || (vix > ELEVATED_VIX && !indexUptrend)) {
            boolean panic = vix >= PANIC_VIX;
            result = new RegimeResult(Regime.RISK_OFF, panic ? 0 : 5,
                format("%s VIX (%.1f), market in defensive mode. Trend following in safe havens only.",
                    panic ? "Extreme" : "High", vix),
                RISK_OFF_BIAS);
        } else {
            result = new RegimeResult(Regime.NEUTRAL, 10,
                format("Moderate VIX (%.1f), mixed conditions. High-conviction setups only.", vix),
                SectorBias.none());
        }

        log.debug("[RegimeDetector] vix={} indexUptrend={} breadth={} → regime={} score={}",
            vix, indexUptrend, breadth, result.regime(), result.score());
        return result;
    }

    /**
     * Applies the regime's sector bias to a committee score.
     *
     * <pre>
     *   sector matches a boost entry    → min(score + 5, 100)
     *   sector matches a penalize entry → max(score − 10, 0)
     *   blank sector or no match        → score
     * </pre>
     * Boost is checked first. Matching is a case-insensitive substring test of each
     * bias entry inside {@code sector}.
     */
    public int applySectorAdjustment(int rawScore, String sector, RegimeResult regime) {
        if (sector == null || sector.isBlank() || regime == null) {
            return rawScore;
        }
        String sectorLower = sector.toLowerCase(Locale.ROOT);
        SectorBias bias = regime.sectorBias();

        if (matchesAny(sectorLower, bias.boost())) {
            return Math.min(rawScore + BOOST_POINTS, 100);
        }
        if (matchesAny(sectorLower, bias.penalize())) {
            return Math.max(rawScore - PENALTY_POINTS, 0);
        }
        return rawScore;
    }

    private static boolean matchesAny(String sectorLower, List<String> entries) {
        for (String entry : entries) {
            if (sectorLower.contains(entry.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
