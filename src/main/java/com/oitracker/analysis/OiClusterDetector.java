package com.oitracker.analysis;

import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.model.OiClusters;
import com.oitracker.domain.model.OiClusters.ClusterLevel;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeMetrics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.springframework.stereotype.Component;

/**
 * Finds strikes where OI piles up: call OI above spot (resistance) and put OI below spot
 * (support).
 *
 * <p>A strike qualifies when its OI is at or above the 75th percentile of that side's OI
 * across the candidate strikes. Percentiles use the R-7 estimator (linear interpolation
 * between order statistics). The strongest five of each side are kept, OI descending.
 */
@Component
public class OiClusterDetector {

    private final AnalysisConfig analysisConfig;

    public OiClusterDetector(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    public OiClusters detect(Snapshot snapshot) {
        double spot = snapshot.spot();
        List<ClusterLevel> resistanceCandidates = new ArrayList<>();
        List<ClusterLevel> supportCandidates = new ArrayList<>();

        for (StrikeMetrics metrics : snapshot.getStrikes().values()) {
            if (metrics.getStrike() > spot && metrics.getCallOi() > 0) {
                resistanceCandidates.add(new ClusterLevel(metrics.getStrike(), metrics.oi(OptionSide.CE)));
            } else if (metrics.getStrike() < spot && metrics.getPutOi() > 0) {
                supportCandidates.add(new ClusterLevel(metrics.getStrike(), metrics.oi(OptionSide.PE)));
            }
        }

        return OiClusters.builder()
                .support(strongest(supportCandidates))
                .resistance(strongest(resistanceCandidates))
                .build();
    }

    private List<ClusterLevel> strongest(List<ClusterLevel> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        double[] values = candidates.stream().mapToDouble(ClusterLevel::oi).toArray();
        double threshold = new Percentile()
                .withEstimationType(EstimationType.R_7)
                .evaluate(values, analysisConfig.getClusterPercentile());

        return candidates.stream()
                .filter(level -> level.oi() >= threshold)
                .sorted(Comparator.comparingLong(ClusterLevel::oi).reversed())
                .limit(analysisConfig.getClusterSize())
                .toList();
    }
}
