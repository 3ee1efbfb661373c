package com.virtualcommittee.committee.evaluator;

import com.virtualcommittee.common.model.EvaluatorResult;
import com.virtualcommittee.common.model.TickerSnapshot;
import com.virtualcommittee.common.model.TurtlesSignals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Breakout / volume / extension / ATR scoring.
 */
class TurtlesEvaluatorTest {

    private final TurtlesEvaluator evaluator = new TurtlesEvaluator();

    private static TickerSnapshot.Builder base() {
        return TickerSnapshot.builder()
            .price(103.0).high20d(100.0)
            .avgVolume20d(1_000_000.0).volume(2_000_000.0)
            .atr14(3.09);
    }

    @Test
    @DisplayName("clean breakout on strong volume with 3% ATR → 25/25")
    void perfectSetup_maxScore() {
        EvaluatorResult<TurtlesSignals> result = evaluator.evaluate(base().build());

        assertEquals(25, result.score());
        assertEquals(TurtlesEvaluator.MAX_SCORE, result.maxScore());
        assertEquals("turtles", result.evaluator());
        assertTrue(result.signals().breakout());
        assertTrue(result.signals().volumeConfirmed());
        assertEquals(2.0, result.signals().volumeRatio(), 1e-9);
        assertEquals(3.0, result.signals().atrPct(), 1e-6);
        assertEquals(4, result.reasoning().size());
        assertTrue(result.reasoning().get(0).startsWith("✓ Breakout"));
    }

    @Test
    @DisplayName("flat at the 20d high with no volume or ATR → 7 (near-breakout 5 + no-extension 2)")
    void flatNoData_scoresSeven() {
        TickerSnapshot ticker = TickerSnapshot.builder().price(50.0).high20d(50.0).build();
        EvaluatorResult<TurtlesSignals> result = evaluator.evaluate(ticker);

        assertEquals(7, result.score());
        assertFalse(result.signals().breakout());
        assertFalse(result.signals().volumeConfirmed());
        assertEquals(0.0, result.signals().volumeRatio());
        assertEquals("✗ No ATR data", result.reasoning().get(3));
    }

    @Test
    @DisplayName("missing 20d high is treated as the price itself")
    void missingHigh_treatedAsPrice() {
        EvaluatorResult<TurtlesSignals> result = evaluator.evaluate(TickerSnapshot.builder().price(50.0).build());
        assertEquals(7, result.score());
        assertFalse(result.signals().breakout());
    }

    @Nested
    @DisplayName("extension")
    class ExtensionTests {

        @Test
        @DisplayName("7% above the high → 2 extension points")
        void somewhatExtended() {
            // 10 breakout + 8 volume + 2 extension + ATR 3.09/107 = 2.9% → 3
            assertEquals(23, evaluator.evaluate(base().price(107.0).build()).score());
        }

        @Test
        @DisplayName("12% above the high → 0 extension points")
        void overextended() {
            // 10 + 4 (1.3x) + 0 + ATR 7.84/112 = 7% → 1
            TickerSnapshot ticker = base().price(112.0).volume(1_300_000.0).atr14(7.84).build();
            assertEquals(15, evaluator.evaluate(ticker).score());
        }

        @Test
        @DisplayName("well below the high → no breakout points but the 2 no-extension points")
        void noBreakout() {
            TickerSnapshot ticker = base().price(90.0).atr14(2.7).build();
            // 0 + 8 + 2 + 3
            assertEquals(13, evaluator.evaluate(ticker).score());
        }
    }

    @Nested
    @DisplayName("volume and ATR bands")
    class BandTests {

        @Test
        @DisplayName("zero average volume → ratio 1.0, no volume points")
        void zeroAverageVolume() {
            EvaluatorResult<TurtlesSignals> result = evaluator.evaluate(base().avgVolume20d(0.0).build());
            assertEquals(1.0, result.signals().volumeRatio());
            assertEquals(17, result.score());
        }

        @Test
        @DisplayName("ATR 1.5% → 1, ATR 9% → 0, ATR 0.5% → 0")
        void atrBands() {
            assertEquals(23, evaluator.evaluate(base().atr14(1.545).build()).score());
            assertEquals(22, evaluator.evaluate(base().atr14(9.27).build()).score());
            assertEquals(22, evaluator.evaluate(base().atr14(0.515).build()).score());
        }
    }

    @Test
    @DisplayName("score always within [0, 25]")
    void scoreBounded() {
        double[] prices = {1, 49, 50, 51, 60, 200};
        double[] volumes = {0, 1_000_000, 5_000_000};
        double[] atrs = {0, 0.5, 2, 10};
        for (double p : prices) {
            for (double v : volumes) {
                for (double a : atrs) {
                    TickerSnapshot t = TickerSnapshot.builder()
                        .price(p).high20d(50.0).avgVolume20d(1_000_000.0).volume(v).atr14(a).build();
                    int score = evaluator.evaluate(t).score();
                    assertTrue(score >= 0 && score <= TurtlesEvaluator.MAX_SCORE);
                }
            }
        }
    }
}
