package com.oitracker.analysis;

import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.SentimentDirection;
import com.oitracker.domain.enums.ZoneType;
import com.oitracker.domain.model.MarketRegime;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrengthScores;
import com.oitracker.domain.model.ZoneBreakdown;
import org.springframework.stereotype.Component;

/**
 * Combines zone forces and price momentum into the pre-adjustment combined score.
 *
 * <p>Strength ratios (each clamped to -100..100):
 * <ul>
 *   <li>put strength = (OTM_PUT / |ITM_CALL + OTM_CALL| - 1) * 50</li>
 *   <li>call strength = (OTM_CALL / |ITM_PUT + OTM_PUT| - 1) * 50</li>
 *   <li>net strength = put strength - call strength</li>
 * </ul>
 *
 * <p>Legacy zone scores: below-spot net force (OTM_PUT - ITM_CALL) and above-spot net
 * force (ITM_PUT - OTM_CALL), normalized by the larger magnitude and scaled to +-100.
 * When every zone is empty the ATM strike's put-minus-call force stands in for both.
 *
 * <p>zone average = 0.7 * legacy + 0.3 * net strength. The final mix with momentum
 * shifts weight to momentum (0.45) when OI and price disagree, 0.20 otherwise.
 */
@Component
public class StrengthAggregator {

    private final AnalysisConfig analysisConfig;
    private final ForceCalculator forceCalculator;

    public StrengthAggregator(AnalysisConfig analysisConfig, ForceCalculator forceCalculator) {
        this.analysisConfig = analysisConfig;
        this.forceCalculator = forceCalculator;
    }

    public StrengthScores strength(Snapshot snapshot, ZoneBreakdown breakdown) {
        double otmPut = breakdown.force(ZoneType.OTM_PUT);
        double itmCall = breakdown.force(ZoneType.ITM_CALL);
        double otmCall = breakdown.force(ZoneType.OTM_CALL);
        double itmPut = breakdown.force(ZoneType.ITM_PUT);

        double putStrength = 0.0;
        double callStrength = 0.0;
        double belowScore;
        double aboveScore;

        if (breakdown.isEmpty()) {
            double atmScore = atmFallbackScore(snapshot, breakdown);
            belowScore = atmScore;
            aboveScore = atmScore;
        } else {
            putStrength = strengthRatio(otmPut, itmCall + otmCall);
            callStrength = strengthRatio(otmCall, itmPut + otmPut);

            double belowNet = otmPut - itmCall;
            double aboveNet = itmPut - otmCall;
            double norm = Math.max(Math.abs(belowNet), Math.abs(aboveNet));
            belowScore = ScoreMath.clampScore(ScoreMath.safeDivide(belowNet, norm, 0.0) * 100.0);
            aboveScore = ScoreMath.clampScore(ScoreMath.safeDivide(aboveNet, norm, 0.0) * 100.0);
        }

        double netStrength = putStrength - callStrength;
        double legacyWeight = analysisConfig.getLegacyZoneWeight();
        double zoneAverage = legacyWeight * ((belowScore + aboveScore) / 2.0) + (1.0 - legacyWeight) * netStrength;

        return StrengthScores.builder()
                .putStrengthScore(putStrength)
                .callStrengthScore(callStrength)
                .netStrength(netStrength)
                .direction(strengthDirection(netStrength))
                .belowSpotScore(belowScore)
                .aboveSpotScore(aboveScore)
                .zoneAverage(zoneAverage)
                .build();
    }

    /**
     * Mixes the zone average with momentum.
     *
     * <p>Divergence means the OI-implied direction (sign of the zone average) disagrees with
     * a non-flat price move. With zero momentum the zone average is the score.
     */
    public Combination combine(double zoneAverage, MarketRegime regime) {
        double momentum = regime.getMomentum();
        SentimentDirection oiDirection = SentimentDirection.fromSign(zoneAverage);
        SentimentDirection priceDirection = regime.getPriceDirection();
        boolean divergent = oiDirection != SentimentDirection.NEUTRAL
                && priceDirection != SentimentDirection.NEUTRAL
                && oiDirection != priceDirection;

        if (momentum == 0.0) {
            return new Combination(zoneAverage, divergent, 1.0, 0.0);
        }

        double momentumWeight = divergent
                ? analysisConfig.getDivergenceMomentumWeight()
                : analysisConfig.getNormalMomentumWeight();
        double zoneWeight = 1.0 - momentumWeight;
        double score = zoneWeight * zoneAverage + momentumWeight * momentum;
        return new Combination(score, divergent, zoneWeight, momentumWeight);
    }

    SentimentDirection strengthDirection(double netStrength) {
        double threshold = analysisConfig.getStrengthDirectionThreshold();
        if (netStrength > threshold) {
            return SentimentDirection.BULLISH;
        }
        if (netStrength < -threshold) {
            return SentimentDirection.BEARISH;
        }
        return SentimentDirection.NEUTRAL;
    }

    private double strengthRatio(double numerator, double opposingForce) {
        double denominator = Math.abs(opposingForce);
        double ratio = numerator / (denominator == 0.0 ? 1.0 : denominator);
        return ScoreMath.clampScore((ratio - 1.0) * analysisConfig.getStrengthRatioScale());
    }

    private double atmFallbackScore(Snapshot snapshot, ZoneBreakdown breakdown) {
        int atm = breakdown.getAtmStrike();
        double putForce = forceCalculator.atmForce(snapshot, atm, OptionSide.PE, breakdown.getScale());
        double callForce = forceCalculator.atmForce(snapshot, atm, OptionSide.CE, breakdown.getScale());
        double norm = Math.max(Math.abs(putForce), Math.abs(callForce));
        return ScoreMath.clampScore(ScoreMath.safeDivide(putForce - callForce, norm, 0.0) * 100.0);
    }

    /** Result of mixing the zone average with momentum. */
    public record Combination(double score, boolean divergent, double zoneWeight, double momentumWeight) {}
}
