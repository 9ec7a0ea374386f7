package com.oitracker.learner;

import com.oitracker.domain.enums.Verdict;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Fixed learner answers, read from {@code oi-tracker.learner}.
 *
 * <pre>
 * oi-tracker.learner.min-confidence=65
 * oi-tracker.learner.exclude-ranges[0].from=85
 * oi-tracker.learner.exclude-ranges[0].to=90
 * oi-tracker.learner.skipped-verdicts=SLIGHTLY_BEARISH
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "oi-tracker.learner")
public class LearnerConfig {

    private boolean paused = false;

    private double minConfidence = 65.0;

    private double maxConfidence = 100.0;

    private List<RangeProperties> excludeRanges = new ArrayList<>();

    /** Verdicts flagged as underperforming; setups for them are not created. */
    private List<Verdict> skippedVerdicts = new ArrayList<>();

    @Data
    public static class RangeProperties {
        private double from;
        private double to;
    }
}
