package com.virtualcommittee.committee.evaluator;

import com.virtualcommittee.common.config.CommitteeConfig;
import com.virtualcommittee.common.model.RiskRewardResult;
import com.virtualcommittee.common.model.TickerSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * R:R, stop structure and sizing, plus the hard-reject veto.
 * Default config: 500 capital x5 → 10 risk budget, 2500 capacity.
 */
class RiskRewardEvaluatorTest {

    private final RiskRewardEvaluator evaluator = new RiskRewardEvaluator();
    private final CommitteeConfig config = CommitteeConfig.defaults();

    private static final TickerSnapshot NO_ATR = TickerSnapshot.builder().price(100.0).build();

    @Nested
    @DisplayName("valid levels")
    class ValidLevelTests {

        @Test
        @DisplayName("100/95/115 without ATR → R:R 3.0 exactly, 6+2+3 = 11, no veto")
        void exactlyThreeToOne() {
            RiskRewardResult result = evaluator.evaluate(NO_ATR, 100, 95, 115, config);

            assertEquals(11, result.score());
            assertFalse(result.hardReject());
            assertEquals(3.0, result.signals().rrRatio());
            assertEquals(0.0, result.signals().stopAtrMultiple());
            assertEquals(5.0, result.signals().stopPct());
            assertEquals(200.0, result.signals().suggestedPosition(), 1e-9);
            assertEquals(10.0, result.signals().riskAmount(), 1e-9);
        }

        @Test
        @DisplayName("100/98/104 → R:R 2.0: scores 3+2+3 but vetoed")
        void twoToOne_hardReject() {
            RiskRewardResult result = evaluator.evaluate(NO_ATR, 100, 98, 104, config);

            assertEquals(8, result.score());
            assertTrue(result.hardReject());
            assertEquals(2.0, result.signals().rrRatio());
        }

        @Test
        @DisplayName("4:1 with a 2-ATR stop → 15/15")
        void perfectStructure_maxScore() {
            TickerSnapshot ticker = TickerSnapshot.builder().price(100.0).atr14(2.5).build();
            RiskRewardResult result = evaluator.evaluate(ticker, 100, 95, 120, config);

            assertEquals(15, result.score());
            assertFalse(result.hardReject());
            assertEquals(2.0, result.signals().stopAtrMultiple());
        }

        @Test
        @DisplayName("stop bands by ATR multiple: 0.5x → 0, 2.78x → 2")
        void stopBands() {
            TickerSnapshot wideAtr = TickerSnapshot.builder().price(100.0).atr14(10.0).build();
            TickerSnapshot tightAtr = TickerSnapshot.builder().price(100.0).atr14(1.8).build();
            // 8 (4:1) + stop + 3 sizing
            assertEquals(11, evaluator.evaluate(wideAtr, 100, 95, 120, config).score());
            assertEquals(13, evaluator.evaluate(tightAtr, 100, 95, 120, config).score());
        }

        @Test
        @DisplayName("stop wider than 7% without ATR earns no structure points")
        void wideStopWithoutAtr() {
            // R:R 30/8 = 3.75 → 6, stop 8% → 0, sizing 125 → 3
            assertEquals(9, evaluator.evaluate(NO_ATR, 100, 92, 130, config).score());
        }
    }

    @Nested
    @DisplayName("sizing")
    class SizingTests {

        @Test
        @DisplayName("very tight stop needs more than 1.2x capacity → 0 sizing, position capped")
        void overCapacity() {
            RiskRewardResult result = evaluator.evaluate(NO_ATR, 100, 99.9, 200, config);

            // 8 (R:R 1000) + 2 (0.1% stop, no ATR) + 0
            assertEquals(10, result.score());
            assertEquals(2500.0, result.signals().suggestedPosition(), 1e-9);
        }

        @Test
        @DisplayName("position within 1.2x capacity → 1")
        void withinTolerance() {
            CommitteeConfig small = CommitteeConfig.of(1000.0, 1);
            // risk 1.8 → 20/1.8 shares ≈ 1111 notional vs 1000 capacity
            RiskRewardResult result = evaluator.evaluate(NO_ATR, 100, 98.2, 110, small);
            assertEquals(11, result.score());
            assertEquals(1000.0, result.signals().suggestedPosition(), 1e-9);
        }

        @Test
        @DisplayName("capital and leverage flow into the risk budget")
        void configFlowsThrough() {
            RiskRewardResult result = evaluator.evaluate(NO_ATR, 100, 95, 115, CommitteeConfig.of(2000.0, 2));
            assertEquals(40.0, result.signals().riskAmount(), 1e-9);
            assertEquals(800.0, result.signals().suggestedPosition(), 1e-9);
        }
    }

    @Nested
    @DisplayName("invalid levels")
    class InvalidLevelTests {

        @Test
        @DisplayName("zero entry → 0 + veto, risk amount 0")
        void zeroEntry() {
            RiskRewardResult result = evaluator.evaluate(NO_ATR, 0, 95, 115, config);
            assertEquals(0, result.score());
            assertTrue(result.hardReject());
            assertEquals(0.0, result.signals().riskAmount());
            assertTrue(result.reasoning().get(0).startsWith("✗"));
        }

        @Test
        @DisplayName("NaN target is treated as invalid")
        void nanTarget() {
            RiskRewardResult result = evaluator.evaluate(NO_ATR, 100, 95, Double.NaN, config);
            assertEquals(0, result.score());
            assertTrue(result.hardReject());
        }

        @Test
        @DisplayName("stop above entry → 0 + veto, risk amount still reported")
        void stopAboveEntry() {
            RiskRewardResult result = evaluator.evaluate(NO_ATR, 100, 101, 115, config);
            assertEquals(0, result.score());
            assertTrue(result.hardReject());
            assertEquals(10.0, result.signals().riskAmount(), 1e-9);
            assertEquals(0.0, result.signals().rrRatio());
        }
    }
}
