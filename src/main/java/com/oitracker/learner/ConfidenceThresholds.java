package com.oitracker.learner;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Confidence band the learner currently trusts: trades need min &lt;= confidence &lt;= max
 * and must fall outside every excluded sub-range.
 */
@Getter
@Builder
@ToString
public class ConfidenceThresholds {

    private final double min;

    private final double max;

    @Builder.Default
    private final List<Range> excludeRanges = Collections.emptyList();

    public boolean isWithinBand(double confidence) {
        return confidence >= min && confidence <= max;
    }

    /** The first excluded sub-range containing the confidence, if any. */
    public Optional<Range> exclusionFor(double confidence) {
        return excludeRanges.stream().filter(range -> range.contains(confidence)).findFirst();
    }

    /** Inclusive lower bound, exclusive upper bound. */
    public record Range(double from, double to) {

        public boolean contains(double value) {
            return value >= from && value < to;
        }

        @Override
        public String toString() {
            return String.format("[%.0f, %.0f)", from, to);
        }
    }
}
