package com.oitracker.learner;

/**
 * Answer to a yes/no question put to the learner, with the reason behind it.
 *
 * <p>{@code block} names which threshold refused a trade; it is null for every other answer.
 */
public record LearnerDecision(boolean answer, Block block, String reason) {

    /** Which learner threshold refused a trade. */
    public enum Block {
        PAUSED,
        CONFIDENCE_OUT_OF_BAND,
        CONFIDENCE_EXCLUDED,
        VERDICT_SKIPPED
    }

    public static LearnerDecision yes(String reason) {
        return new LearnerDecision(true, null, reason);
    }

    public static LearnerDecision no(String reason) {
        return new LearnerDecision(false, null, reason);
    }

    public static LearnerDecision blocked(Block block, String reason) {
        return new LearnerDecision(false, block, reason);
    }
}
