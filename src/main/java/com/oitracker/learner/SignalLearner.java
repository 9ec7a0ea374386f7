package com.oitracker.learner;

import com.oitracker.domain.enums.Verdict;
import java.util.Optional;

/**
 * Source of the adaptive trading thresholds consulted by the creation gate.
 *
 * <p>Implementations may tune their answers from past outcomes; the gate only reads them.
 * {@link StaticSignalLearner} serves fixed values from configuration.
 */
public interface SignalLearner {

    /** True while the learner has suspended trading (e.g. after a losing streak). */
    boolean isPaused();

    /** Current confidence band and excluded sub-ranges. */
    ConfidenceThresholds getConfidenceThresholds();

    /** Whether setups for this verdict should be skipped because it has been underperforming. */
    LearnerDecision shouldSkipVerdict(Verdict verdict);

    /**
     * Overall go/no-go for a signal. Checks run in order (pause, band, exclusions, skipped
     * verdict) and the first one that refuses decides the answer.
     */
    default LearnerDecision shouldTrade(double confidence, Verdict verdict) {
        if (isPaused()) {
            return LearnerDecision.blocked(LearnerDecision.Block.PAUSED, "Trading paused by learner");
        }
        ConfidenceThresholds thresholds = getConfidenceThresholds();
        if (!thresholds.isWithinBand(confidence)) {
            return LearnerDecision.blocked(
                    LearnerDecision.Block.CONFIDENCE_OUT_OF_BAND,
                    String.format(
                            "Confidence %.1f outside band [%.0f, %.0f]",
                            confidence, thresholds.getMin(), thresholds.getMax()));
        }
        Optional<ConfidenceThresholds.Range> exclusion = thresholds.exclusionFor(confidence);
        if (exclusion.isPresent()) {
            return LearnerDecision.blocked(
                    LearnerDecision.Block.CONFIDENCE_EXCLUDED,
                    String.format("Confidence %.1f in excluded range %s", confidence, exclusion.get()));
        }
        LearnerDecision skip = shouldSkipVerdict(verdict);
        if (skip.answer()) {
            return LearnerDecision.blocked(LearnerDecision.Block.VERDICT_SKIPPED, skip.reason());
        }
        return LearnerDecision.yes("Signal within learned thresholds");
    }
}
