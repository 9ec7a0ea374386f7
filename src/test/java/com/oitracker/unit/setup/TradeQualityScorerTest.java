package com.oitracker.unit.setup;

import static org.assertj.core.api.Assertions.assertThat;

import com.oitracker.domain.enums.ConfirmationStatus;
import com.oitracker.domain.enums.Moneyness;
import com.oitracker.domain.enums.TradeDirection;
import com.oitracker.domain.enums.Verdict;
import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.PremiumMomentum;
import com.oitracker.domain.model.TradeSetupCandidate;
import com.oitracker.setup.TradeQualityScorer;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TradeQualityScorer.
 */
class TradeQualityScorerTest {

    private TradeQualityScorer tradeQualityScorer;

    @BeforeEach
    void setUp() {
        tradeQualityScorer = new TradeQualityScorer();
    }

    private static Analysis analysis(
            Verdict verdict, ConfirmationStatus confirmation, double confidence, double premiumScore) {
        return Analysis.builder()
                .verdict(verdict)
                .confirmationStatus(confirmation)
                .confidence(confidence)
                .premiumMomentum(PremiumMomentum.builder().score(premiumScore).build())
                .build();
    }

    private static TradeSetupCandidate candidate(TradeDirection direction, Moneyness moneyness, String riskPct) {
        return TradeSetupCandidate.builder()
                .direction(direction)
                .optionSide(direction.getOptionSide())
                .moneyness(moneyness)
                .riskPct(new BigDecimal(riskPct))
                .build();
    }

    @Test
    @DisplayName("Every criterion met scores 8")
    void allCriteria() {
        int score = tradeQualityScorer.score(
                analysis(Verdict.BULLS_WINNING, ConfirmationStatus.CONFIRMED, 70, 20),
                candidate(TradeDirection.BUY_CALL, Moneyness.ITM, "15.00"));

        assertThat(score).isEqualTo(8);
        assertThat(score).isLessThanOrEqualTo(TradeQualityScorer.MAX_SCORE);
    }

    @Test
    @DisplayName("No criterion met scores 0")
    void noCriteria() {
        int score = tradeQualityScorer.score(
                analysis(Verdict.SLIGHTLY_BULLISH, ConfirmationStatus.CONFLICT, 40, -20),
                candidate(TradeDirection.BUY_CALL, Moneyness.OTM, "20.00"));

        assertThat(score).isZero();
    }

    @Test
    @DisplayName("Very high confidence earns only one point")
    void veryHighConfidence() {
        int optimal = tradeQualityScorer.score(
                analysis(Verdict.SLIGHTLY_BULLISH, ConfirmationStatus.NEUTRAL, 80, 0),
                candidate(TradeDirection.BUY_CALL, Moneyness.ATM, "20.00"));
        int high = tradeQualityScorer.score(
                analysis(Verdict.SLIGHTLY_BULLISH, ConfirmationStatus.NEUTRAL, 90, 0),
                candidate(TradeDirection.BUY_CALL, Moneyness.ATM, "20.00"));

        assertThat(optimal).isEqualTo(2);
        assertThat(high).isEqualTo(1);
    }

    @Test
    @DisplayName("Premium momentum must align with the trade direction")
    void premiumAlignment() {
        int put = tradeQualityScorer.score(
                analysis(Verdict.SLIGHTLY_BEARISH, ConfirmationStatus.NEUTRAL, 0, -15),
                candidate(TradeDirection.BUY_PUT, Moneyness.ATM, "20.00"));
        int call = tradeQualityScorer.score(
                analysis(Verdict.SLIGHTLY_BULLISH, ConfirmationStatus.NEUTRAL, 0, -15),
                candidate(TradeDirection.BUY_CALL, Moneyness.ATM, "20.00"));

        assertThat(put).isEqualTo(1);
        assertThat(call).isZero();
    }
}
