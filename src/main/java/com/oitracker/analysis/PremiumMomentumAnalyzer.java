package com.oitracker.analysis;

import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.model.PremiumMomentum;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeMetrics;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * ATM call/put premium change since the previous snapshot, and the score adjustment it
 * implies when premiums contradict the OI picture.
 *
 * <p>score = clamp((call %chg - put %chg) * 5, -100, 100). A side without a positive
 * price in either snapshot counts as 0% change.
 *
 * <p>Adjustment: combined &lt; -10 with score &gt; 20 adds score * 0.3 (bullish premiums
 * against bearish OI); combined &gt; 10 with score &lt; -20 adds score * 0.3 (a negative
 * number). Otherwise no adjustment.
 */
@Component
public class PremiumMomentumAnalyzer {

    private final AnalysisConfig analysisConfig;

    public PremiumMomentumAnalyzer(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    public PremiumMomentum analyze(
            Snapshot snapshot, int atmStrike, Map<Integer, StrikeMetrics> previousStrikes, double combinedScore) {
        StrikeMetrics current = snapshot.get(atmStrike);
        StrikeMetrics previous = previousStrikes != null ? previousStrikes.get(atmStrike) : null;
        if (current == null || previous == null) {
            return PremiumMomentum.none(atmStrike);
        }

        double callChangePct = sideChangePct(previous, current, OptionSide.CE);
        double putChangePct = sideChangePct(previous, current, OptionSide.PE);
        double score = ScoreMath.clampScore(
                (callChangePct - putChangePct) * analysisConfig.getPremiumMomentumMultiplier());

        return PremiumMomentum.builder()
                .atmStrike(atmStrike)
                .callChangePct(callChangePct)
                .putChangePct(putChangePct)
                .score(score)
                .adjustment(adjustment(combinedScore, score))
                .build();
    }

    double adjustment(double combinedScore, double premiumScore) {
        double scoreThreshold = analysisConfig.getPremiumContradictionScore();
        double momentumThreshold = analysisConfig.getPremiumContradictionMomentum();
        if (combinedScore < -scoreThreshold && premiumScore > momentumThreshold) {
            return premiumScore * analysisConfig.getPremiumAdjustmentFactor();
        }
        if (combinedScore > scoreThreshold && premiumScore < -momentumThreshold) {
            return premiumScore * analysisConfig.getPremiumAdjustmentFactor();
        }
        return 0.0;
    }

    private static double sideChangePct(StrikeMetrics previous, StrikeMetrics current, OptionSide side) {
        if (!previous.hasPrice(side) || !current.hasPrice(side)) {
            return 0.0;
        }
        return ScoreMath.pctChange(previous.ltp(side).doubleValue(), current.ltp(side).doubleValue());
    }
}
