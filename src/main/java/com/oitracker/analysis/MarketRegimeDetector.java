package com.oitracker.analysis;

import com.oitracker.domain.enums.MarketRegimeType;
import com.oitracker.domain.enums.SentimentDirection;
import com.oitracker.domain.model.MarketHistory;
import com.oitracker.domain.model.MarketRegime;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Computes price momentum over the history window and classifies the regime.
 *
 * <p>momentum = clamp(((spot - oldest) / oldest) * 100 * 20, -100, 100).
 *
 * <p>The regime is trending only when all three hold: spot sits within 0.1% of the
 * window extreme, |momentum| exceeds 25 in that direction, and the window's high-low
 * range is wider than 0.2% of spot. Anything else is range-bound.
 */
@Component
public class MarketRegimeDetector {

    private final AnalysisConfig analysisConfig;

    public MarketRegimeDetector(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    public MarketRegime detect(double spot, MarketHistory history) {
        List<Double> window = new ArrayList<>();
        if (history != null && history.getRecentPrices() != null) {
            for (BigDecimal price : history.getRecentPrices()) {
                if (price != null && price.signum() > 0) {
                    window.add(price.doubleValue());
                }
            }
        }
        window.add(spot);

        double oldest = window.get(0);
        double priceChangePct = ScoreMath.pctChange(oldest, spot);
        double momentum = ScoreMath.clampScore(priceChangePct * analysisConfig.getMomentumMultiplier());

        double high = window.stream().mapToDouble(Double::doubleValue).max().orElse(spot);
        double low = window.stream().mapToDouble(Double::doubleValue).min().orElse(spot);
        double rangePct = ScoreMath.safeDivide(high - low, spot, 0.0) * 100.0;

        MarketRegimeType regime = classify(spot, momentum, high, low, rangePct);

        return MarketRegime.builder()
                .regime(regime)
                .momentum(momentum)
                .priceChangePct(priceChangePct)
                .priceDirection(priceDirection(priceChangePct))
                .windowHigh(high)
                .windowLow(low)
                .rangePct(rangePct)
                .build();
    }

    /** Direction of a raw % move; moves inside the flat threshold are NEUTRAL. */
    public SentimentDirection priceDirection(double priceChangePct) {
        double threshold = analysisConfig.getPriceFlatThresholdPct();
        if (priceChangePct > threshold) {
            return SentimentDirection.BULLISH;
        }
        if (priceChangePct < -threshold) {
            return SentimentDirection.BEARISH;
        }
        return SentimentDirection.NEUTRAL;
    }

    private MarketRegimeType classify(double spot, double momentum, double high, double low, double rangePct) {
        if (rangePct <= analysisConfig.getRegimeMinRangePct()) {
            return MarketRegimeType.RANGE_BOUND;
        }
        double proximity = analysisConfig.getRegimeProximityPct();
        double distanceFromHighPct = (high - spot) / spot * 100.0;
        double distanceFromLowPct = (spot - low) / spot * 100.0;

        if (distanceFromHighPct <= proximity && momentum > analysisConfig.getRegimeMomentumThreshold()) {
            return MarketRegimeType.TRENDING_UP;
        }
        if (distanceFromLowPct <= proximity && momentum < -analysisConfig.getRegimeMomentumThreshold()) {
            return MarketRegimeType.TRENDING_DOWN;
        }
        return MarketRegimeType.RANGE_BOUND;
    }
}
