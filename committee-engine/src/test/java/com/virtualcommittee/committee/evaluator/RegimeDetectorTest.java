package com.virtualcommittee.committee.evaluator;

import com.virtualcommittee.common.model.MarketSnapshot;
import com.virtualcommittee.common.model.Regime;
import com.virtualcommittee.common.model.RegimeResult;
import com.virtualcommittee.common.model.SectorBias;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Regime classification from VIX / index trend / breadth, and the sector bias
 * adjustment applied to a committee score.
 */
class RegimeDetectorTest {

    private final RegimeDetector detector = new RegimeDetector();

    // ── detect() ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("detect()")
    class DetectTests {

        @Test
        @DisplayName("no VIX → UNKNOWN, 10, no bias")
        void noVix_returnsUnknown() {
            RegimeResult result = detector.detect(MarketSnapshot.of(null, 1.0, true, 1.5));
            assertEquals(Regime.UNKNOWN, result.regime());
            assertEquals(10, result.score());
            assertEquals(SectorBias.none(), result.sectorBias());
        }

        @Test
        @DisplayName("null snapshot behaves like a missing VIX")
        void nullSnapshot_returnsUnknown() {
            RegimeResult result = detector.detect(null);
            assertEquals(Regime.UNKNOWN, result.regime());
            assertEquals(10, result.score());
        }

        @Test
        @DisplayName("calm VIX + uptrend → RISK_ON 15 with growth boost")
        void calmUptrend_returnsRiskOn() {
            RegimeResult result = detector.detect(MarketSnapshot.of(15.0, 0.8, true, 1.3));
            assertEquals(Regime.RISK_ON, result.regime());
            assertEquals(15, result.score());
            assertTrue(result.sectorBias().boost().contains("tech"));
            assertTrue(result.sectorBias().penalize().isEmpty());
            assertTrue(result.reasoning().contains("breadth"));
        }

        @Test
        @DisplayName("narrow breadth changes only the wording of RISK_ON")
        void narrowBreadth_sameScore() {
            RegimeResult result = detector.detect(MarketSnapshot.of(15.0, 0.8, true, 1.0));
            assertEquals(Regime.RISK_ON, result.regime());
            assertEquals(15, result.score());
            assertFalse(result.reasoning().contains("breadth"));
        }

        @Test
        @DisplayName("missing trend flag is read as uptrend")
        void missingTrend_assumesUptrend() {
            assertEquals(Regime.RISK_ON, detector.detect(MarketSnapshot.of(12.0, null, null, null)).regime());
        }

        @Test
        @DisplayName("calm VIX below the 200 EMA → NEUTRAL")
        void calmDowntrend_returnsNeutral() {
            RegimeResult result = detector.detect(MarketSnapshot.of(15.0, -0.5, false, 0.9));
            assertEquals(Regime.NEUTRAL, result.regime());
            assertEquals(10, result.score());
        }

        @Test
        @DisplayName("VIX exactly 18 is not calm")
        void vix18_isNeutral() {
            assertEquals(Regime.NEUTRAL, detector.detect(MarketSnapshot.of(18.0, 0.0, true, 1.0)).regime());
        }

        @Test
        @DisplayName("VIX 22 above the 200 EMA → NEUTRAL")
        void elevatedUptrend_returnsNeutral() {
            assertEquals(Regime.NEUTRAL, detector.detect(MarketSnapshot.of(22.0, 0.0, true, 1.0)).regime());
        }

        @Test
        @DisplayName("VIX 22 below the 200 EMA → RISK_OFF 5")
        void elevatedDowntrend_returnsRiskOff() {
            RegimeResult result = detector.detect(MarketSnapshot.of(22.0, -1.0, false, 0.7));
            assertEquals(Regime.RISK_OFF, result.regime());
            assertEquals(5, result.score());
            assertTrue(result.sectorBias().penalize().contains("tech"));
            assertTrue(result.sectorBias().boost().contains("utilities"));
        }

        @Test
        @DisplayName("VIX 26 → RISK_OFF 5 regardless of trend")
        void stressedVix_returnsRiskOff() {
            RegimeResult result = detector.detect(MarketSnapshot.of(26.0, 0.5, true, 1.1));
            assertEquals(Regime.RISK_OFF, result.regime());
            assertEquals(5, result.score());
            assertTrue(result.reasoning().startsWith("High"));
        }

        @Test
        @DisplayName("VIX ≥ 30 → RISK_OFF 0")
        void panicVix_scoresZero() {
            RegimeResult result = detector.detect(MarketSnapshot.of(30.0, -3.0, false, 0.4));
            assertEquals(Regime.RISK_OFF, result.regime());
            assertEquals(0, result.score());
            assertTrue(result.reasoning().startsWith("Extreme"));
        }

        @Test
        @DisplayName("score always within [0, 15]")
        void scoreBounded() {
            double[] vixes = {5, 12, 17.9, 18, 20, 20.1, 25, 25.1, 29.9, 30, 80};
            for (double vix : vixes) {
                for (boolean up : new boolean[]{true, false}) {
                    int score = detector.detect(MarketSnapshot.of(vix, 0.0, up, 1.0)).score();
                    assertTrue(score >= 0 && score <= RegimeDetector.MAX_SCORE, "vix=" + vix + " up=" + up);
                }
            }
        }
    }

    // ── applySectorAdjustment() ───────────────────────────────────────────

    @Nested
    @DisplayName("applySectorAdjustment()")
    class SectorAdjustmentTests {

        private final RegimeResult riskOn  = detector.detect(MarketSnapshot.of(15.0, 0.5, true, 1.3));
        private final RegimeResult riskOff = detector.detect(MarketSnapshot.of(26.0, -1.0, false, 0.6));
        private final RegimeResult neutral = detector.detect(MarketSnapshot.of(19.0, 0.0, true, 1.0));

        @Test
        @DisplayName("boosted sector gains 5 (substring, case-insensitive)")
        void boostedSector_plusFive() {
            assertEquals(75, detector.applySectorAdjustment(70, "Technology", riskOn));
            assertEquals(75, detector.applySectorAdjustment(70, "Utilities", riskOff));
        }

        @Test
        @DisplayName("boost is capped at 100")
        void boost_cappedAt100() {
            assertEquals(100, detector.applySectorAdjustment(98, "Technology", riskOn));
        }

        @Test
        @DisplayName("penalized sector loses 10, floored at 0")
        void penalizedSector_minusTen() {
            assertEquals(60, detector.applySectorAdjustment(70, "Technology", riskOff));
            assertEquals(60, detector.applySectorAdjustment(70, "Biotech", riskOff));
            assertEquals(0, detector.applySectorAdjustment(5, "Technology", riskOff));
        }

        @Test
        @DisplayName("blank or unmatched sector, or neutral regime → unchanged")
        void noMatch_unchanged() {
            assertEquals(70, detector.applySectorAdjustment(70, null, riskOn));
            assertEquals(70, detector.applySectorAdjustment(70, "  ", riskOn));
            assertEquals(70, detector.applySectorAdjustment(70, "Energy", riskOn));
            assertEquals(70, detector.applySectorAdjustment(70, "Technology", neutral));
            assertEquals(70, detector.applySectorAdjustment(70, "Technology", null));
        }
    }
}
