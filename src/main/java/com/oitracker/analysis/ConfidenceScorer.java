package com.oitracker.analysis;

import com.oitracker.domain.enums.ConfirmationStatus;
import com.oitracker.domain.enums.SentimentDirection;
import com.oitracker.domain.model.ConfidenceInputs;
import com.oitracker.domain.model.ConfidenceScore;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Scores 0-100 how far the verdict can be trusted, independently of its direction.
 *
 * <p>Starts at 50 and adds one component per auxiliary signal:
 * <ul>
 *   <li>score magnitude: +25 (|score| &gt;= 40), +15 (&gt;= 25), +5 (&gt;= 10), else -10</li>
 *   <li>IV skew: +15 agreeing with the signal, -15 against it</li>
 *   <li>volume PCR: up to +-10 when option volume leans the signal's way</li>
 *   <li>max pain proximity: +10 (&lt; 0.5%), +5 (&lt; 1%), -5 (&gt; 2%)</li>
 *   <li>confirmation: +15 CONFIRMED, +10 REVERSAL_ALERT, -15 CONFLICT</li>
 *   <li>VIX: -20 (&gt; 25), -10 (&gt; 20), +5 (&lt; 12)</li>
 *   <li>futures OI: +-15 for buildup with/against the signal, -10 for covering or
 *       unwinding against it</li>
 * </ul>
 * The result is clamped to [0, 100].
 */
@Component
public class ConfidenceScorer {

    private static final double BASE = 50.0;

    public ConfidenceScore score(ConfidenceInputs inputs) {
        Map<String, Double> components = new LinkedHashMap<>();
        SentimentDirection signal = inputs.getSignalDirection() != null
                ? inputs.getSignalDirection()
                : SentimentDirection.NEUTRAL;

        components.put("scoreMagnitude", scoreMagnitude(inputs.getCombinedScore()));
        components.put("ivSkew", ivSkew(signal, inputs.getIvSkewDirection()));
        components.put("volumePcr", volumePcr(signal, inputs.getVolumePcr()));
        components.put("maxPain", maxPain(inputs.getSpotPrice(), inputs.getMaxPain()));
        components.put("confirmation", confirmation(inputs.getConfirmationStatus()));
        components.put("vix", vix(inputs.getVix()));
        components.put("futuresOi", futuresOi(signal, inputs.getFuturesOiChange(), inputs.getPriceDirection()));

        double total = BASE + components.values().stream().mapToDouble(Double::doubleValue).sum();
        return ConfidenceScore.builder()
                .score(ScoreMath.clamp(total, 0.0, 100.0))
                .components(components)
                .build();
    }

    double scoreMagnitude(double combinedScore) {
        double magnitude = Math.abs(combinedScore);
        if (magnitude >= 40) {
            return 25.0;
        } else if (magnitude >= 25) {
            return 15.0;
        } else if (magnitude >= 10) {
            return 5.0;
        }
        return -10.0;
    }

    double ivSkew(SentimentDirection signal, SentimentDirection skewDirection) {
        if (signal == SentimentDirection.NEUTRAL
                || skewDirection == null
                || skewDirection == SentimentDirection.NEUTRAL) {
            return 0.0;
        }
        return skewDirection == signal ? 15.0 : -15.0;
    }

    /** Low put/call volume backs a bullish call, high backs a bearish one. Zero PCR is "no data". */
    double volumePcr(SentimentDirection signal, double pcr) {
        if (pcr <= 0 || signal == SentimentDirection.NEUTRAL) {
            return 0.0;
        }
        double bullishPoints;
        if (pcr < 0.7) {
            bullishPoints = 10.0;
        } else if (pcr < 0.9) {
            bullishPoints = 5.0;
        } else if (pcr > 1.3) {
            bullishPoints = -10.0;
        } else if (pcr > 1.1) {
            bullishPoints = -5.0;
        } else {
            bullishPoints = 0.0;
        }
        return signal == SentimentDirection.BULLISH ? bullishPoints : -bullishPoints;
    }

    double maxPain(double spot, Integer maxPain) {
        if (maxPain == null || spot <= 0) {
            return 0.0;
        }
        double distancePct = Math.abs(spot - maxPain) / spot * 100.0;
        if (distancePct < 0.5) {
            return 10.0;
        } else if (distancePct < 1.0) {
            return 5.0;
        } else if (distancePct > 2.0) {
            return -5.0;
        }
        return 0.0;
    }

    double confirmation(ConfirmationStatus status) {
        if (status == null) {
            return 0.0;
        }
        return switch (status) {
            case CONFIRMED -> 15.0;
            case REVERSAL_ALERT -> 10.0;
            case CONFLICT -> -15.0;
            case NEUTRAL -> 0.0;
        };
    }

    /** VIX of zero means the index was unavailable. */
    double vix(double vix) {
        if (vix <= 0) {
            return 0.0;
        }
        if (vix > 25) {
            return -20.0;
        } else if (vix > 20) {
            return -10.0;
        } else if (vix < 12) {
            return 5.0;
        }
        return 0.0;
    }

    /**
     * Rising futures OI is a buildup in the direction price moved (strong); falling OI is
     * covering or unwinding against it (weak).
     */
    double futuresOi(SentimentDirection signal, long futuresOiChange, SentimentDirection priceDirection) {
        if (futuresOiChange == 0
                || signal == SentimentDirection.NEUTRAL
                || priceDirection == null
                || priceDirection == SentimentDirection.NEUTRAL) {
            return 0.0;
        }
        if (futuresOiChange > 0) {
            return priceDirection == signal ? 15.0 : -15.0;
        }
        // Falling OI: short covering when price rises, long unwinding when it falls.
        return priceDirection == signal ? 0.0 : -10.0;
    }
}
