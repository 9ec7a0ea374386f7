package com.oitracker.analysis;

import com.oitracker.domain.enums.SentimentDirection;
import com.oitracker.domain.enums.SignalStrength;
import com.oitracker.domain.enums.TrapType;
import com.oitracker.domain.enums.Verdict;
import com.oitracker.domain.model.OiClusters;
import com.oitracker.domain.model.OiClusters.ClusterLevel;
import com.oitracker.domain.model.TrapWarning;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Flags price moves that run straight into a wall of OI the writers are defending.
 *
 * <p>BULL_TRAP: price rising, verdict strongly bearish, any resistance cluster within 1%
 * above spot. BEAR_TRAP: price falling, verdict strongly bullish, any support cluster
 * within 1% below spot. When several clusters qualify the nearest one is reported.
 */
@Component
public class TrapDetector {

    private final AnalysisConfig analysisConfig;

    public TrapDetector(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    public Optional<TrapWarning> detect(
            SentimentDirection priceDirection, Verdict verdict, OiClusters clusters, double spot) {
        if (verdict.getStrength() != SignalStrength.STRONG || clusters == null || spot <= 0) {
            return Optional.empty();
        }

        if (priceDirection == SentimentDirection.BULLISH && verdict.isBearish()) {
            return nearestWithinProximity(clusters.getResistance(), spot, 1)
                    .map(resistance -> trap(
                            TrapType.BULL_TRAP,
                            resistance,
                            (resistance - spot) / spot * 100.0,
                            "Price rising into resistance at %d (%.2f%% away) while OI is strongly bearish"));
        }

        if (priceDirection == SentimentDirection.BEARISH && verdict.isBullish()) {
            return nearestWithinProximity(clusters.getSupport(), spot, -1)
                    .map(support -> trap(
                            TrapType.BEAR_TRAP,
                            support,
                            (spot - support) / spot * 100.0,
                            "Price falling into support at %d (%.2f%% away) while OI is strongly bullish"));
        }
        return Optional.empty();
    }

    /**
     * Closest cluster strike on the given side of spot (1 above, -1 below) that lies within
     * the trap proximity.
     */
    private Optional<Integer> nearestWithinProximity(List<ClusterLevel> levels, double spot, int side) {
        if (levels == null) {
            return Optional.empty();
        }
        double proximity = analysisConfig.getTrapProximityPct();
        Integer nearest = null;
        double nearestDistance = Double.MAX_VALUE;
        for (ClusterLevel level : levels) {
            double distancePct = side * (level.strike() - spot) / spot * 100.0;
            if (distancePct >= 0 && distancePct <= proximity && distancePct < nearestDistance) {
                nearest = level.strike();
                nearestDistance = distancePct;
            }
        }
        return Optional.ofNullable(nearest);
    }

    private static TrapWarning trap(TrapType type, int strike, double distancePct, String format) {
        return TrapWarning.builder()
                .type(type)
                .clusterStrike(strike)
                .distancePct(distancePct)
                .message(String.format(format, strike, distancePct))
                .build();
    }
}
