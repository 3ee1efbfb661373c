package com.virtualcommittee.committee.evaluator;

import com.virtualcommittee.common.model.CatalystDescriptor;
import com.virtualcommittee.common.model.CatalystSignals;
import com.virtualcommittee.common.model.EvaluatorResult;
import com.virtualcommittee.common.model.Expectation;
import com.virtualcommittee.common.model.TickerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.virtualcommittee.common.util.Reasons.borderline;
import static com.virtualcommittee.common.util.Reasons.fail;
import static com.virtualcommittee.common.util.Reasons.pass;

/**
 * Scores the quality and timing of a known upcoming event.
 *
 * <pre>
 *   no catalyst     → 12 flat (technical-only weighting)
 *   type            taxonomy points, see {@link CatalystType} (0–8)
 *   timing (days)   [3,7] → 7 | [1,14] → 4 | (14,30) → 2 | ≥30 → 1 | &lt;1 → 2
 *   history (%)     ≥10 → 5 | ≥5 → 3 | &gt;0 → 1 | none → 2
 *   expectations    low + asymmetric type → 5 | neutral → 3 | high → 1 | other → 3
 * </pre>
 */
@Component
public class CatalystEvaluator implements CommitteeMember {

    private static final Logger log = LoggerFactory.getLogger(CatalystEvaluator.class);

    public static final int MAX_SCORE = 25;
    public static final int NO_CATALYST_SCORE = 12;

    /** Types where low expectations leave room for a positive surprise. Exact match. */
    private static final Set<String> ASYMMETRIC_TYPES =
        Set.of("earnings", "fda_decision", "fda", "product_launch");

    @Override
    public String memberName() { return "catalyst"; }

    @Override
    public int maxScore() { return MAX_SCORE; }

    public EvaluatorResult<CatalystSignals> evaluate(TickerSnapshot ticker, CatalystDescriptor catalyst) {
        if (catalyst == null) {
            log.debug("[CatalystEvaluator] No catalyst → neutral {}", NO_CATALYST_SCORE);
            return EvaluatorResult.of(memberName(), NO_CATALYST_SCORE, MAX_SCORE,
                List.of(borderline("No catalyst identified, scoring on technical setup")),
                CatalystSignals.none());
        }

        String type             = catalyst.normalizedType();
        int daysToEvent         = catalyst.daysToEventOrUnknown();
        Expectation expectation = catalyst.expectationOrUnspecified();
        double historical       = ticker.historicalReactionOrZero();

        int score = 0;
        List<String> reasoning = new ArrayList<>();

        // ── 1. Catalyst type (8) ────────────────────────────────────────────
        CatalystType matched = CatalystType.match(type);
        int typePoints = matched != null ? matched.points() : CatalystType.UNMATCHED_POINTS;
        score += typePoints;
        reasoning.add(typePoints >= 6
            ? pass("Catalyst: %s (%d/8 pts)", type, typePoints)
            : borderline("Catalyst: %s (%d/8 pts)", type, typePoints));

        // ── 2. Timing (7) ───────────────────────────────────────────────────
        if (daysToEvent >= 3 && daysToEvent <= 7) {
            score += 7;
            reasoning.add(pass("Optimal timing: %d days to event", daysToEvent));
        } else if (daysToEvent >= 1 && daysToEvent <= 14) {
            score += 4;
            reasoning.add(borderline("Acceptable timing: %d days to event", daysToEvent));
        } else if (daysToEvent > 14 && daysToEvent < 30) {
            score += 2;
            reasoning.add(borderline("Event somewhat distant: %d days (capital tied up)", daysToEvent));
        } else if (daysToEvent >= 30) {
            score += 1;
            reasoning.add(fail("Event far away: %d days", daysToEvent));
        } else {
            score += 2;
            reasoning.add(borderline("Event imminent or past (%d days)", daysToEvent));
        }

        // ── 3. Historical reaction (5) ──────────────────────────────────────
        if (historical >= 10) {
            score += 5;
            reasoning.add(pass("History: moves ~%.0f%% on similar events", historical));
        } else if (historical >= 5) {
            score += 3;
            reasoning.add(borderline("History: moves ~%.0f%% on similar events", historical));
        } else if (historical > 0) {
            score += 1;
            reasoning.add(fail("Low historical reactivity (%.0f%%)", historical));
        } else {
            score += 2;
            reasoning.add(borderline("No historical event-reaction data"));
        }

        // ── 4. Expectation asymmetry (5) ────────────────────────────────────
        if (expectation == Expectation.LOW && ASYMMETRIC_TYPES.contains(type)) {
            score += 5;
            reasoning.add(pass("Low expectations, room for a positive surprise"));
        } else if (expectation == Expectation.NEUTRAL) {
            score += 3;
            reasoning.add(borderline("Neutral expectations"));
        } else if (expectation == Expectation.HIGH) {
            score += 1;
            reasoning.add(fail("High expectations, limited upside and downside on a miss"));
        } else {
            score += 3;
            reasoning.add(borderline("Expectations unknown (assuming neutral)"));
        }

        CatalystSignals signals = new CatalystSignals(type, daysToEvent, historical, expectation);

        log.debug("[CatalystEvaluator] type={} matched={} days={} historical={} expectation={} → score={}",
            type, matched, daysToEvent, historical, expectation, score);
        return EvaluatorResult.of(memberName(), score, MAX_SCORE, reasoning, signals);
    }
}
