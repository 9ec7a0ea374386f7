package com.oitracker.unit.analysis;

import static com.oitracker.unit.ChainFixtures.priced;
import static com.oitracker.unit.ChainFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.oitracker.analysis.AnalysisConfig;
import com.oitracker.analysis.PremiumMomentumAnalyzer;
import com.oitracker.domain.model.PremiumMomentum;
import com.oitracker.domain.model.Snapshot;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PremiumMomentumAnalyzer covering the ATM premium score and the
 * contradiction adjustment.
 */
class PremiumMomentumAnalyzerTest {

    private PremiumMomentumAnalyzer premiumMomentumAnalyzer;

    @BeforeEach
    void setUp() {
        premiumMomentumAnalyzer = new PremiumMomentumAnalyzer(new AnalysisConfig());
    }

    // ==============================
    // SCORE
    // ==============================

    @Nested
    @DisplayName("Premium momentum score")
    class Score {

        @Test
        @DisplayName("No previous snapshot gives a zero score")
        void noPrevious() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 110, 95));

            PremiumMomentum momentum = premiumMomentumAnalyzer.analyze(snapshot, 24000, Map.of(), 0.0);

            assertThat(momentum.getScore()).isZero();
            assertThat(momentum.getAdjustment()).isZero();
        }

        @Test
        @DisplayName("Calls up 10% and puts down 5% score 75")
        void callsOutpacingPuts() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 110, 95));

            PremiumMomentum momentum = premiumMomentumAnalyzer.analyze(
                    snapshot, 24000, Map.of(24000, priced(24000, 100, 100)), 0.0);

            assertThat(momentum.getCallChangePct()).isCloseTo(10.0, within(1e-9));
            assertThat(momentum.getPutChangePct()).isCloseTo(-5.0, within(1e-9));
            assertThat(momentum.getScore()).isCloseTo(75.0, within(1e-9));
        }

        @Test
        @DisplayName("Score is clamped to 100")
        void clamped() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 200, 100));

            PremiumMomentum momentum = premiumMomentumAnalyzer.analyze(
                    snapshot, 24000, Map.of(24000, priced(24000, 100, 100)), 0.0);

            assertThat(momentum.getScore()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("A side without a previous price counts as unchanged")
        void missingPreviousPrice() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 120, 95));

            PremiumMomentum momentum = premiumMomentumAnalyzer.analyze(
                    snapshot, 24000, Map.of(24000, priced(24000, 0, 100)), 0.0);

            assertThat(momentum.getCallChangePct()).isZero();
            assertThat(momentum.getScore()).isCloseTo(25.0, within(1e-9));
        }
    }

    // ==============================
    // ADJUSTMENT
    // ==============================

    @Nested
    @DisplayName("Contradiction adjustment")
    class Adjustment {

        @Test
        @DisplayName("Bullish premiums against bearish OI pull the score up by 30%")
        void bullishPremiumsBearishOi() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 110, 95));

            PremiumMomentum momentum = premiumMomentumAnalyzer.analyze(
                    snapshot, 24000, Map.of(24000, priced(24000, 100, 100)), -20.0);

            assertThat(momentum.getAdjustment()).isCloseTo(22.5, within(1e-9));
        }

        @Test
        @DisplayName("Bearish premiums against bullish OI pull the score down")
        void bearishPremiumsBullishOi() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 95, 110));

            PremiumMomentum momentum = premiumMomentumAnalyzer.analyze(
                    snapshot, 24000, Map.of(24000, priced(24000, 100, 100)), 20.0);

            assertThat(momentum.getAdjustment()).isCloseTo(-22.5, within(1e-9));
        }

        @Test
        @DisplayName("Premiums agreeing with OI are not adjusted")
        void agreeingNoAdjustment() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 110, 95));

            PremiumMomentum momentum = premiumMomentumAnalyzer.analyze(
                    snapshot, 24000, Map.of(24000, priced(24000, 100, 100)), 20.0);

            assertThat(momentum.getAdjustment()).isZero();
        }

        @Test
        @DisplayName("Weak combined score is not adjusted")
        void weakScoreNoAdjustment() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 110, 95));

            PremiumMomentum momentum = premiumMomentumAnalyzer.analyze(
                    snapshot, 24000, Map.of(24000, priced(24000, 100, 100)), -5.0);

            assertThat(momentum.getAdjustment()).isZero();
        }
    }
}
