package com.oitracker.unit.engine;

import static com.oitracker.unit.ChainFixtures.snapshot;
import static com.oitracker.unit.ChainFixtures.strike;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.oitracker.analysis.AnalysisConfig;
import com.oitracker.analysis.ConfidenceScorer;
import com.oitracker.analysis.ConfirmationEvaluator;
import com.oitracker.analysis.ForceCalculator;
import com.oitracker.analysis.IvSkewCalculator;
import com.oitracker.analysis.MarketRegimeDetector;
import com.oitracker.analysis.MaxPainCalculator;
import com.oitracker.analysis.OiAccelerationAnalyzer;
import com.oitracker.analysis.OiClusterDetector;
import com.oitracker.analysis.PremiumMomentumAnalyzer;
import com.oitracker.analysis.StrengthAggregator;
import com.oitracker.analysis.TrapDetector;
import com.oitracker.analysis.VerdictClassifier;
import com.oitracker.analysis.ZonePartitioner;
import com.oitracker.core.engine.TugOfWarEngine;
import com.oitracker.domain.enums.ConfirmationStatus;
import com.oitracker.domain.enums.Moneyness;
import com.oitracker.domain.enums.OiPhase;
import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.TradeDirection;
import com.oitracker.domain.enums.Verdict;
import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.MarketHistory;
import com.oitracker.domain.model.TradeSetupCandidate;
import com.oitracker.setup.TradeSetupBuilder;
import com.oitracker.unit.ChainFixtures;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TugOfWarEngine wired with its real scoring components, covering
 * directional chains, the single-strike case and degenerate input.
 */
class TugOfWarEngineTest {

    private TugOfWarEngine tugOfWarEngine;

    @BeforeEach
    void setUp() {
        tugOfWarEngine = engine(new AnalysisConfig());
    }

    /** Engine assembled from real components over the given configuration. */
    public static TugOfWarEngine engine(AnalysisConfig config) {
        ForceCalculator forceCalculator = new ForceCalculator(config);
        return new TugOfWarEngine(
                new ZonePartitioner(config),
                forceCalculator,
                new StrengthAggregator(config, forceCalculator),
                new MarketRegimeDetector(config),
                new OiAccelerationAnalyzer(config),
                new PremiumMomentumAnalyzer(config),
                new VerdictClassifier(config),
                new MaxPainCalculator(),
                new OiClusterDetector(config),
                new IvSkewCalculator(config),
                new ConfirmationEvaluator(config),
                new ConfidenceScorer(),
                new TrapDetector(config),
                new TradeSetupBuilder());
    }

    // ==============================
    // SINGLE STRIKE
    // ==============================

    @Nested
    @DisplayName("Single-strike chain")
    class SingleStrike {

        @Test
        @DisplayName("Heavier put writing at the only strike biases bullish")
        void biasesBullish() {
            Analysis analysis = tugOfWarEngine.analyze(ChainFixtures.singleAtmStrikeChain(), MarketHistory.empty());

            assertThat(analysis.getAtmStrike()).isEqualTo(24000);
            assertThat(analysis.getCombinedScore()).isCloseTo(14.08, within(0.01));
            assertThat(analysis.getVerdict()).isEqualTo(Verdict.SLIGHTLY_BULLISH);
            assertThat(analysis.getConfirmationStatus()).isEqualTo(ConfirmationStatus.NEUTRAL);
        }

        @Test
        @DisplayName("Candidate falls back to the ATM call")
        void atmCandidate() {
            Analysis analysis = tugOfWarEngine.analyze(ChainFixtures.singleAtmStrikeChain(), MarketHistory.empty());

            TradeSetupCandidate candidate = analysis.tradeSetup().orElseThrow();
            assertThat(candidate.getDirection()).isEqualTo(TradeDirection.BUY_CALL);
            assertThat(candidate.getMoneyness()).isEqualTo(Moneyness.ATM);
            assertThat(candidate.getEntryPremium()).isEqualByComparingTo("142.25");
            assertThat(candidate.getSlPremium()).isEqualByComparingTo("113.80");
            assertThat(candidate.getTarget1Premium()).isEqualByComparingTo("170.70");
            assertThat(candidate.getTarget2Premium()).isEqualByComparingTo("199.15");
        }
    }

    // ==============================
    // DIRECTIONAL CHAINS
    // ==============================

    @Nested
    @DisplayName("Directional chains")
    class DirectionalChains {

        @Test
        @DisplayName("Put writing below spot with call unwinding is strongly bullish")
        void bullishLadder() {
            Analysis analysis =
                    tugOfWarEngine.analyze(snapshot(24000.0, ChainFixtures.bullishLadder()), MarketHistory.empty());

            assertThat(analysis.getVerdict()).isEqualTo(Verdict.BULLS_STRONGLY_WINNING);
            assertThat(analysis.getStrength().getNetStrength()).isPositive();
            assertThat(analysis.getPcr()).isCloseTo(690_000.0 / 450_000.0, within(1e-9));
            assertThat(analysis.getOiAcceleration().getPhase()).isEqualTo(OiPhase.INSUFFICIENT_DATA);
            assertThat(analysis.getConfidence()).isBetween(0.0, 100.0);
        }

        @Test
        @DisplayName("Bullish candidate prefers the ITM call below ATM")
        void bullishItmCandidate() {
            Analysis analysis =
                    tugOfWarEngine.analyze(snapshot(24000.0, ChainFixtures.bullishLadder()), MarketHistory.empty());

            TradeSetupCandidate candidate = analysis.tradeSetup().orElseThrow();
            assertThat(candidate.getStrike()).isEqualTo(23950);
            assertThat(candidate.getOptionSide()).isEqualTo(OptionSide.CE);
            assertThat(candidate.getMoneyness()).isEqualTo(Moneyness.ITM);
            assertThat(candidate.getRiskPct()).isEqualByComparingTo("18");
            assertThat(candidate.getSlPremium()).isEqualByComparingTo("143.50");
        }

        @Test
        @DisplayName("Call writing above spot with put unwinding is strongly bearish")
        void bearishLadder() {
            Analysis analysis =
                    tugOfWarEngine.analyze(snapshot(24000.0, ChainFixtures.bearishLadder()), MarketHistory.empty());

            assertThat(analysis.getVerdict()).isEqualTo(Verdict.BEARS_STRONGLY_WINNING);
            TradeSetupCandidate candidate = analysis.tradeSetup().orElseThrow();
            assertThat(candidate.getDirection()).isEqualTo(TradeDirection.BUY_PUT);
            assertThat(candidate.getStrike()).isEqualTo(24050);
        }

        @Test
        @DisplayName("Mirrored chains score symmetrically")
        void mirroredChainsSymmetric() {
            Analysis bullish =
                    tugOfWarEngine.analyze(snapshot(24000.0, ChainFixtures.bullishLadder()), MarketHistory.empty());
            Analysis bearish =
                    tugOfWarEngine.analyze(snapshot(24000.0, ChainFixtures.bearishLadder()), MarketHistory.empty());

            assertThat(bearish.getCombinedScore()).isCloseTo(-bullish.getCombinedScore(), within(1e-6));
        }

        @Test
        @DisplayName("Rising price confirms a bullish chain")
        void risingPriceConfirms() {
            MarketHistory history = MarketHistory.builder()
                    .recentPrices(List.of(BigDecimal.valueOf(23800), BigDecimal.valueOf(23900)))
                    .build();

            Analysis analysis = tugOfWarEngine.analyze(snapshot(24000.0, ChainFixtures.bullishLadder()), history);

            assertThat(analysis.getConfirmationStatus()).isEqualTo(ConfirmationStatus.CONFIRMED);
            assertThat(analysis.getMarketRegime().getMomentum()).isPositive();
            assertThat(analysis.getVerdict().isBullish()).isTrue();
        }

        @Test
        @DisplayName("Analysis is deterministic for the same input")
        void deterministic() {
            Analysis first =
                    tugOfWarEngine.analyze(snapshot(24000.0, ChainFixtures.bullishLadder()), MarketHistory.empty());
            Analysis second =
                    tugOfWarEngine.analyze(snapshot(24000.0, ChainFixtures.bullishLadder()), MarketHistory.empty());

            assertThat(second.getCombinedScore()).isEqualTo(first.getCombinedScore());
            assertThat(second.getConfidence()).isEqualTo(first.getConfidence());
        }
    }

    // ==============================
    // DEGENERATE INPUT
    // ==============================

    @Nested
    @DisplayName("Degenerate input")
    class DegenerateInput {

        @Test
        @DisplayName("Empty chain is Neutral with no candidate")
        void emptyChain() {
            Analysis analysis = tugOfWarEngine.analyze(snapshot(24000.0, List.of()), MarketHistory.empty());

            assertThat(analysis.getVerdict()).isEqualTo(Verdict.NEUTRAL);
            assertThat(analysis.getCombinedScore()).isZero();
            assertThat(analysis.tradeSetup()).isEmpty();
            assertThat(analysis.maxPain()).isEmpty();
            assertThat(analysis.ivSkew()).isEmpty();
        }

        @Test
        @DisplayName("All-zero chain produces finite neutral values")
        void allZeroChain() {
            Analysis analysis = tugOfWarEngine.analyze(
                    snapshot(
                            24000.0,
                            strike(23950, 0, 0, 0, 0, 0, 0),
                            strike(24000, 0, 0, 0, 0, 0, 0),
                            strike(24050, 0, 0, 0, 0, 0, 0)),
                    null);

            assertThat(Double.isFinite(analysis.getCombinedScore())).isTrue();
            assertThat(Double.isFinite(analysis.getConfidence())).isTrue();
            assertThat(analysis.getVerdict()).isEqualTo(Verdict.NEUTRAL);
            assertThat(analysis.getPcr()).isZero();
            assertThat(analysis.getVolumePcr()).isZero();
        }
    }
}
