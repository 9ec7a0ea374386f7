package com.oitracker.domain.model;

import com.oitracker.domain.enums.SentimentDirection;
import lombok.Builder;
import lombok.Data;

/**
 * Zone strength ratios and the legacy below/above-spot scores, all in -100..100.
 */
@Data
@Builder
public class StrengthScores {

    private double putStrengthScore;
    private double callStrengthScore;

    /** putStrengthScore - callStrengthScore. */
    private double netStrength;

    /** BULLISH above +15 net strength, BEARISH below -15. */
    private SentimentDirection direction;

    private double belowSpotScore;
    private double aboveSpotScore;

    /** Blend of the legacy zone scores and net strength, before momentum. */
    private double zoneAverage;
}
