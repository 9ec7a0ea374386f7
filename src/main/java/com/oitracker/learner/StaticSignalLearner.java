package com.oitracker.learner;

import com.oitracker.domain.enums.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Learner that answers from {@link LearnerConfig}. Pausing at runtime is supported so an
 * operator (or an adaptive learner wrapping this one) can halt new setups mid-session.
 */
@Component
public class StaticSignalLearner implements SignalLearner {

    private static final Logger log = LoggerFactory.getLogger(StaticSignalLearner.class);

    private final LearnerConfig learnerConfig;

    public StaticSignalLearner(LearnerConfig learnerConfig) {
        this.learnerConfig = learnerConfig;
    }

    @Override
    public boolean isPaused() {
        return learnerConfig.isPaused();
    }

    public void setPaused(boolean paused) {
        if (learnerConfig.isPaused() != paused) {
            log.info("Learner trading {}", paused ? "paused" : "resumed");
        }
        learnerConfig.setPaused(paused);
    }

    @Override
    public ConfidenceThresholds getConfidenceThresholds() {
        return ConfidenceThresholds.builder()
                .min(learnerConfig.getMinConfidence())
                .max(learnerConfig.getMaxConfidence())
                .excludeRanges(learnerConfig.getExcludeRanges().stream()
                        .map(range -> new ConfidenceThresholds.Range(range.getFrom(), range.getTo()))
                        .toList())
                .build();
    }

    @Override
    public LearnerDecision shouldSkipVerdict(Verdict verdict) {
        if (learnerConfig.getSkippedVerdicts().contains(verdict)) {
            return LearnerDecision.yes("Verdict '" + verdict.getLabel() + "' flagged as underperforming");
        }
        return LearnerDecision.no("Verdict '" + verdict.getLabel() + "' not flagged");
    }
}
