package com.oitracker.unit.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.oitracker.analysis.AnalysisConfig;
import com.oitracker.analysis.MarketRegimeDetector;
import com.oitracker.domain.enums.MarketRegimeType;
import com.oitracker.domain.enums.SentimentDirection;
import com.oitracker.domain.model.MarketHistory;
import com.oitracker.domain.model.MarketRegime;
import java.math.BigDecimal;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MarketRegimeDetector covering momentum scaling and regime classification.
 */
class MarketRegimeDetectorTest {

    private MarketRegimeDetector marketRegimeDetector;

    @BeforeEach
    void setUp() {
        marketRegimeDetector = new MarketRegimeDetector(new AnalysisConfig());
    }

    private static MarketHistory prices(double... values) {
        return MarketHistory.builder()
                .recentPrices(Arrays.stream(values).mapToObj(BigDecimal::valueOf).toList())
                .build();
    }

    @Test
    @DisplayName("No history means zero momentum and a range-bound, flat market")
    void noHistory() {
        MarketRegime regime = marketRegimeDetector.detect(24000.0, MarketHistory.empty());

        assertThat(regime.getMomentum()).isZero();
        assertThat(regime.getRegime()).isEqualTo(MarketRegimeType.RANGE_BOUND);
        assertThat(regime.getPriceDirection()).isEqualTo(SentimentDirection.NEUTRAL);
    }

    @Test
    @DisplayName("Momentum is the window % change times 20")
    void momentumScaling() {
        MarketRegime regime = marketRegimeDetector.detect(24150.0, prices(24000, 24050, 24100));

        assertThat(regime.getPriceChangePct()).isCloseTo(0.625, within(1e-9));
        assertThat(regime.getMomentum()).isCloseTo(12.5, within(1e-9));
        assertThat(regime.getPriceDirection()).isEqualTo(SentimentDirection.BULLISH);
        assertThat(regime.getRegime()).isEqualTo(MarketRegimeType.RANGE_BOUND);
    }

    @Test
    @DisplayName("Momentum is clamped to 100")
    void momentumClamped() {
        MarketRegime regime = marketRegimeDetector.detect(24000.0, prices(20000));

        assertThat(regime.getMomentum()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Spot at the window high with strong momentum is trending up")
    void trendingUp() {
        MarketRegime regime = marketRegimeDetector.detect(24400.0, prices(24000, 24200));

        assertThat(regime.getRegime()).isEqualTo(MarketRegimeType.TRENDING_UP);
        assertThat(regime.getMomentum()).isGreaterThan(25.0);
    }

    @Test
    @DisplayName("Spot at the window low with strong negative momentum is trending down")
    void trendingDown() {
        MarketRegime regime = marketRegimeDetector.detect(24000.0, prices(24400, 24200));

        assertThat(regime.getRegime()).isEqualTo(MarketRegimeType.TRENDING_DOWN);
        assertThat(regime.getPriceDirection()).isEqualTo(SentimentDirection.BEARISH);
    }

    @Test
    @DisplayName("A narrow window is range-bound regardless of position")
    void narrowRangeIsRangeBound() {
        MarketRegime regime = marketRegimeDetector.detect(24020.0, prices(24000, 24010));

        assertThat(regime.getRangePct()).isLessThan(0.2);
        assertThat(regime.getRegime()).isEqualTo(MarketRegimeType.RANGE_BOUND);
    }

    @Test
    @DisplayName("Moves inside 0.05% count as flat")
    void flatMove() {
        MarketRegime regime = marketRegimeDetector.detect(24010.0, prices(24000));

        assertThat(regime.getPriceDirection()).isEqualTo(SentimentDirection.NEUTRAL);
        assertThat(regime.getMomentum()).isNotZero();
    }
}
