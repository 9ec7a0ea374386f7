package com.oitracker.analysis;

import com.oitracker.domain.enums.Verdict;
import org.springframework.stereotype.Component;

/**
 * Maps a final combined score to a verdict. Pure function of the score and the two
 * thresholds (strong 40, moderate 15); exactly zero is Neutral.
 */
@Component
public class VerdictClassifier {

    private final AnalysisConfig analysisConfig;

    public VerdictClassifier(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    public Verdict classify(double combinedScore) {
        double strong = analysisConfig.getStrongThreshold();
        double moderate = analysisConfig.getModerateThreshold();

        if (combinedScore > strong) {
            return Verdict.BULLS_STRONGLY_WINNING;
        } else if (combinedScore > moderate) {
            return Verdict.BULLS_WINNING;
        } else if (combinedScore > 0) {
            return Verdict.SLIGHTLY_BULLISH;
        } else if (combinedScore < -strong) {
            return Verdict.BEARS_STRONGLY_WINNING;
        } else if (combinedScore < -moderate) {
            return Verdict.BEARS_WINNING;
        } else if (combinedScore < 0) {
            return Verdict.SLIGHTLY_BEARISH;
        }
        return Verdict.NEUTRAL;
    }
}
