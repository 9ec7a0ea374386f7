package com.oitracker.unit.setup;

import static com.oitracker.unit.ChainFixtures.priced;
import static com.oitracker.unit.ChainFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;

import com.oitracker.domain.enums.Moneyness;
import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.TradeDirection;
import com.oitracker.domain.enums.Verdict;
import com.oitracker.domain.model.OiClusters;
import com.oitracker.domain.model.OiClusters.ClusterLevel;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeMetrics;
import com.oitracker.domain.model.TradeSetupCandidate;
import com.oitracker.setup.TradeSetupBuilder;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TradeSetupBuilder covering strike preference, IV-based stop loss and
 * target pricing.
 */
class TradeSetupBuilderTest {

    private TradeSetupBuilder tradeSetupBuilder;

    @BeforeEach
    void setUp() {
        tradeSetupBuilder = new TradeSetupBuilder();
    }

    private static StrikeMetrics withIv(int strike, double callLtp, double putLtp, String iv) {
        return StrikeMetrics.builder()
                .strike(strike)
                .callLtp(BigDecimal.valueOf(callLtp))
                .putLtp(BigDecimal.valueOf(putLtp))
                .callIv(new BigDecimal(iv))
                .putIv(new BigDecimal(iv))
                .build();
    }

    // ==============================
    // STRIKE SELECTION
    // ==============================

    @Nested
    @DisplayName("Strike selection")
    class StrikeSelection {

        @Test
        @DisplayName("Bullish verdict buys the ITM call below ATM")
        void bullishItmCall() {
            Snapshot snapshot =
                    snapshot(24000.0, priced(23950, 150, 70), priced(24000, 120, 110), priced(24050, 90, 140));

            TradeSetupCandidate candidate = tradeSetupBuilder
                    .build(Verdict.BULLS_WINNING, snapshot, 24000, OiClusters.empty())
                    .orElseThrow();

            assertThat(candidate.getDirection()).isEqualTo(TradeDirection.BUY_CALL);
            assertThat(candidate.getStrike()).isEqualTo(23950);
            assertThat(candidate.getOptionSide()).isEqualTo(OptionSide.CE);
            assertThat(candidate.getMoneyness()).isEqualTo(Moneyness.ITM);
        }

        @Test
        @DisplayName("Bearish verdict buys the ITM put above ATM")
        void bearishItmPut() {
            Snapshot snapshot =
                    snapshot(24000.0, priced(23950, 150, 70), priced(24000, 120, 110), priced(24050, 90, 140));

            TradeSetupCandidate candidate = tradeSetupBuilder
                    .build(Verdict.SLIGHTLY_BEARISH, snapshot, 24000, OiClusters.empty())
                    .orElseThrow();

            assertThat(candidate.getDirection()).isEqualTo(TradeDirection.BUY_PUT);
            assertThat(candidate.getStrike()).isEqualTo(24050);
            assertThat(candidate.getEntryPremium()).isEqualByComparingTo("140.00");
        }

        @Test
        @DisplayName("Unpriced ITM falls back to ATM")
        void fallsBackToAtm() {
            Snapshot snapshot =
                    snapshot(24000.0, priced(23950, 0, 70), priced(24000, 120, 110), priced(24050, 90, 140));

            TradeSetupCandidate candidate = tradeSetupBuilder
                    .build(Verdict.BULLS_WINNING, snapshot, 24000, OiClusters.empty())
                    .orElseThrow();

            assertThat(candidate.getStrike()).isEqualTo(24000);
            assertThat(candidate.getMoneyness()).isEqualTo(Moneyness.ATM);
        }

        @Test
        @DisplayName("Unpriced ITM and ATM fall back to OTM")
        void fallsBackToOtm() {
            Snapshot snapshot =
                    snapshot(24000.0, priced(23950, 0, 70), priced(24000, 0, 110), priced(24050, 90, 140));

            TradeSetupCandidate candidate = tradeSetupBuilder
                    .build(Verdict.BULLS_WINNING, snapshot, 24000, OiClusters.empty())
                    .orElseThrow();

            assertThat(candidate.getStrike()).isEqualTo(24050);
            assertThat(candidate.getMoneyness()).isEqualTo(Moneyness.OTM);
        }

        @Test
        @DisplayName("No priced candidate means no setup")
        void noPricedCandidate() {
            Snapshot snapshot =
                    snapshot(24000.0, priced(23950, 0, 70), priced(24000, 0, 110), priced(24050, 0, 140));

            assertThat(tradeSetupBuilder.build(Verdict.BULLS_WINNING, snapshot, 24000, OiClusters.empty()))
                    .isEmpty();
        }

        @Test
        @DisplayName("Neutral verdict never proposes a trade")
        void neutralVerdict() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 120, 110));

            assertThat(tradeSetupBuilder.build(Verdict.NEUTRAL, snapshot, 24000, OiClusters.empty()))
                    .isEmpty();
        }

        @Test
        @DisplayName("Strongest support and resistance are carried as references")
        void clusterReferences() {
            Snapshot snapshot = snapshot(24000.0, priced(24000, 120, 110));
            OiClusters clusters = OiClusters.builder()
                    .support(List.of(new ClusterLevel(23800, 900_000)))
                    .resistance(List.of(new ClusterLevel(24300, 800_000)))
                    .build();

            TradeSetupCandidate candidate =
                    tradeSetupBuilder.build(Verdict.BULLS_WINNING, snapshot, 24000, clusters).orElseThrow();

            assertThat(candidate.getSupportRef()).isEqualTo(23800);
            assertThat(candidate.getResistanceRef()).isEqualTo(24300);
        }
    }

    // ==============================
    // PRICING
    // ==============================

    @Nested
    @DisplayName("Pricing")
    class Pricing {

        @Test
        @DisplayName("Low IV uses a 15% stop with 1:1 and 1:2 targets")
        void lowIvPricing() {
            Snapshot snapshot = snapshot(24000.0, withIv(24000, 100, 100, "10.5"));

            TradeSetupCandidate candidate = tradeSetupBuilder
                    .build(Verdict.BULLS_WINNING, snapshot, 24000, OiClusters.empty())
                    .orElseThrow();

            assertThat(candidate.getEntryPremium()).isEqualByComparingTo("100.00");
            assertThat(candidate.getSlPremium()).isEqualByComparingTo("85.00");
            assertThat(candidate.getTarget1Premium()).isEqualByComparingTo("115.00");
            assertThat(candidate.getTarget2Premium()).isEqualByComparingTo("130.00");
            assertThat(candidate.getRiskPct()).isEqualByComparingTo("15");
            assertThat(candidate.getIvAtStrike()).isEqualByComparingTo("10.5");
        }

        @Test
        @DisplayName("Prices round half-up to two decimals")
        void rounding() {
            Snapshot snapshot = snapshot(24000.0, withIv(24000, 142.25, 100, "0"));

            TradeSetupCandidate candidate = tradeSetupBuilder
                    .build(Verdict.BULLS_WINNING, snapshot, 24000, OiClusters.empty())
                    .orElseThrow();

            assertThat(candidate.getSlPremium()).isEqualByComparingTo("113.80");
            assertThat(candidate.getTarget2Premium()).isEqualByComparingTo("199.15");
        }

        @Test
        @DisplayName("Stop-loss percentage widens with IV")
        void stopLossBuckets() {
            assertThat(TradeSetupBuilder.stopLossPct(null)).isEqualByComparingTo("20");
            assertThat(TradeSetupBuilder.stopLossPct(BigDecimal.ZERO)).isEqualByComparingTo("20");
            assertThat(TradeSetupBuilder.stopLossPct(new BigDecimal("11.9"))).isEqualByComparingTo("15");
            assertThat(TradeSetupBuilder.stopLossPct(new BigDecimal("12"))).isEqualByComparingTo("18");
            assertThat(TradeSetupBuilder.stopLossPct(new BigDecimal("15"))).isEqualByComparingTo("20");
            assertThat(TradeSetupBuilder.stopLossPct(new BigDecimal("18"))).isEqualByComparingTo("22");
            assertThat(TradeSetupBuilder.stopLossPct(new BigDecimal("22"))).isEqualByComparingTo("25");
            assertThat(TradeSetupBuilder.stopLossPct(new BigDecimal("35"))).isEqualByComparingTo("25");
        }
    }
}
