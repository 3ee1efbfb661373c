package com.virtualcommittee.committee.service;

import com.virtualcommittee.committee.evaluator.CatalystEvaluator;
import com.virtualcommittee.committee.evaluator.RegimeDetector;
import com.virtualcommittee.committee.evaluator.RiskRewardEvaluator;
import com.virtualcommittee.committee.evaluator.SeykotaEvaluator;
import com.virtualcommittee.committee.evaluator.TurtlesEvaluator;
import com.virtualcommittee.common.config.CommitteeConfig;
import com.virtualcommittee.common.model.CatalystDescriptor;
import com.virtualcommittee.common.model.CatalystSignals;
import com.virtualcommittee.common.model.CommitteeDecision;
import com.virtualcommittee.common.model.CommitteeReasoning;
import com.virtualcommittee.common.model.CommitteeSignals;
import com.virtualcommittee.common.model.Decision;
import com.virtualcommittee.common.model.EvaluatorResult;
import com.virtualcommittee.common.model.MarketSnapshot;
import com.virtualcommittee.common.model.RegimeResult;
import com.virtualcommittee.common.model.RiskRewardResult;
import com.virtualcommittee.common.model.ScoreBreakdown;
import com.virtualcommittee.common.model.SeykotaSignals;
import com.virtualcommittee.common.model.TickerSnapshot;
import com.virtualcommittee.common.model.TradeParameters;
import com.virtualcommittee.common.model.TradePlan;
import com.virtualcommittee.common.model.TurtlesSignals;
import com.virtualcommittee.common.util.Rounding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the five committee members on one instrument and turns their scores
 * into a single {@link CommitteeDecision}.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>No ticker or price ≤ 0 → {@link CommitteeDecision#skipped} ("No price data").</li>
 *   <li>Derive any missing trade level:
 *       entry = 0.995·price; stop = price − 2·ATR, or price·(1 − 10/8/6%) by beta ≥2 / ≥1.5 / lower;
 *       target = price·1.20 when day change &gt; 2%, else price·1.15.</li>
 *   <li>Score regime, turtles, seykota, catalyst and risk/reward.</li>
 *   <li>rawScore = Σ member scores; finalScore = clamp(sector-adjusted rawScore, 0, 100).</li>
 *   <li>Decide: hard reject → REJECT; ≥75 → BUY; ≥60 → WATCHLIST; else SKIP.</li>
 * </ol>
 *
 * <p>Stateless; one instance serves concurrent evaluations. Data problems never
 * throw out of {@link #evaluate}: each member absorbs missing fields with its
 * own neutral defaults.
 */
@Service
public class CommitteeAggregator {

    private static final Logger log = LoggerFactory.getLogger(CommitteeAggregator.class);

    public static final int BUY_THRESHOLD       = 75;
    public static final int WATCHLIST_THRESHOLD = 60;

    static final String NO_PRICE_REASON = "No price data";

    private static final double ENTRY_DISCOUNT         = 0.995;
    private static final double STOP_ATR_MULTIPLE      = 2.0;
    private static final double MOMENTUM_CHANGE_PCT    = 2.0;
    private static final double TARGET_PCT_MOMENTUM    = 20.0;
    private static final double TARGET_PCT_CONSERVATIVE = 15.0;

    private final RegimeDetector      regimeDetector;
    private final TurtlesEvaluator    turtlesEvaluator;
    private final SeykotaEvaluator    seykotaEvaluator;
    private final CatalystEvaluator   catalystEvaluator;
    private final RiskRewardEvaluator riskRewardEvaluator;

    public CommitteeAggregator(RegimeDetector regimeDetector,
                               TurtlesEvaluator turtlesEvaluator,
                               SeykotaEvaluator seykotaEvaluator,
                               CatalystEvaluator catalystEvaluator,
                               RiskRewardEvaluator riskRewardEvaluator) {
        this.regimeDetector      = regimeDetector;
        this.turtlesEvaluator    = turtlesEvaluator;
        this.seykotaEvaluator    = seykotaEvaluator;
        this.catalystEvaluator   = catalystEvaluator;
        this.riskRewardEvaluator = riskRewardEvaluator;
    }

    /** Evaluates with derived trade levels and {@link CommitteeConfig#defaults()}. */
    public CommitteeDecision evaluate(String instrumentId, TickerSnapshot ticker,
                                      MarketSnapshot market, CatalystDescriptor catalyst) {
        return evaluate(instrumentId, ticker, market, catalyst, TradePlan.none(), CommitteeConfig.defaults());
    }

    public CommitteeDecision evaluate(String instrumentId, TickerSnapshot ticker, MarketSnapshot market,
                                      CatalystDescriptor catalyst, TradePlan plan, CommitteeConfig config) {
        if (ticker == null || !ticker.hasPrice()) {
            log.info("[Committee] instrument={} has no price, skipping", instrumentId);
            return CommitteeDecision.skipped(instrumentId, NO_PRICE_REASON);
        }
        TradePlan suppliedPlan = plan != null ? plan : TradePlan.none();
        CommitteeConfig effectiveConfig = config != null ? config : CommitteeConfig.defaults();

        double price  = ticker.priceOrZero();
        double entry  = suppliedPlan.entry()  != null ? suppliedPlan.entry()  : price * ENTRY_DISCOUNT;
        double stop   = suppliedPlan.stop()   != null ? suppliedPlan.stop()   : deriveStop(ticker);
        double target = suppliedPlan.target() != null ? suppliedPlan.target() : deriveTarget(ticker);

        // ── members ─────────────────────────────────────────────────────────
        RegimeResult regime                       = regimeDetector.detect(market);
        EvaluatorResult<TurtlesSignals> turtles   = turtlesEvaluator.evaluate(ticker);
        EvaluatorResult<SeykotaSignals> seykota   = seykotaEvaluator.evaluate(ticker);
        EvaluatorResult<CatalystSignals> catalystResult = catalystEvaluator.evaluate(ticker, catalyst);
        RiskRewardResult riskReward =
            riskRewardEvaluator.evaluate(ticker, entry, stop, target, effectiveConfig);

        // ── scoring ─────────────────────────────────────────────────────────
        int rawScore = regime.score()
            + turtles.score()
            + seykota.score()
            + catalystResult.score()
            + riskReward.score();

        int adjusted   = regimeDetector.applySectorAdjustment(rawScore, ticker.sector(), regime);
        int finalScore = Math.max(0, Math.min(100, adjusted));
        int sectorAdjustment = finalScore - rawScore;

        Decision decision = decide(riskReward.hardReject(), finalScore);
        String reason     = reasonFor(decision, finalScore);

        ScoreBreakdown breakdown = new ScoreBreakdown(
            regime.score(), turtles.score(), seykota.score(), catalystResult.score(), riskReward.score(),
            sectorAdjustment, rawScore);

        CommitteeReasoning reasoning = new CommitteeReasoning(
            List.of(regime.reasoning()),
            turtles.reasoning(),
            seykota.reasoning(),
            catalystResult.reasoning(),
            riskReward.reasoning());

        TradeParameters tradeParameters = new TradeParameters(
            Rounding.twoDecimals(entry),
            Rounding.twoDecimals(stop),
            Rounding.twoDecimals(target),
            riskReward.signals().rrRatio(),
            riskReward.signals().suggestedPosition(),
            riskReward.signals().stopPct(),
            entry > 0 ? Rounding.twoDecimals((target - entry) / entry * 100) : 0.0);

        CommitteeSignals signals = new CommitteeSignals(
            regime.regime(), turtles.signals(), seykota.signals(), catalystResult.signals(), riskReward.signals());

        log.info("[Committee] instrument={} regime={} raw={} sectorAdj={} final={} hardReject={} → decision={}",
            instrumentId, regime.regime(), rawScore, sectorAdjustment, finalScore, riskReward.hardReject(), decision);

        return new CommitteeDecision(instrumentId, decision, reason, finalScore, regime,
                                     breakdown, reasoning, tradeParameters, signals);
    }

    static Decision decide(boolean hardReject, int finalScore) {
        if (hardReject)                         return Decision.REJECT;
        if (finalScore >= BUY_THRESHOLD)        return Decision.BUY;
        if (finalScore >= WATCHLIST_THRESHOLD)  return Decision.WATCHLIST;
        return Decision.SKIP;
    }

    private static String reasonFor(Decision decision, int finalScore) {
        return switch (decision) {
            case REJECT    -> "R:R below 3:1, mandatory minimum not met";
            case BUY       -> "Score " + finalScore + "/100, high-conviction opportunity";
            case WATCHLIST -> "Score " + finalScore + "/100, monitor for a better entry";
            case SKIP      -> "Score " + finalScore + "/100, insufficient conviction";
        };
    }

    /** 2×ATR below price; without ATR a beta-keyed percentage stop. */
    private static double deriveStop(TickerSnapshot ticker) {
        double price = ticker.priceOrZero();
        double atr   = ticker.atrOrZero();
        if (atr > 0) {
            return price - atr * STOP_ATR_MULTIPLE;
        }
        double beta = ticker.betaOrDefault();
        double stopPct;
        if (beta >= 2.0)      stopPct = 10.0;
        else if (beta >= 1.5) stopPct = 8.0;
        else                  stopPct = 6.0;
        return price * (1 - stopPct / 100);
    }

    /** Wider target when the instrument is already moving (day change above 2%). */
    private static double deriveTarget(TickerSnapshot ticker) {
        double targetPct = ticker.changePctOrZero() > MOMENTUM_CHANGE_PCT
            ? TARGET_PCT_MOMENTUM
            : TARGET_PCT_CONSERVATIVE;
        return ticker.priceOrZero() * (1 + targetPct / 100);
    }
}
