package com.oitracker.domain.enums;

/**
 * Discrete directional-sentiment label produced by the tug-of-war engine.
 *
 * <p>Each verdict carries its display label, its {@link SignalStrength}, and the
 * {@link SentimentDirection} it expresses. The classifier that maps a combined score
 * to a verdict lives in VerdictClassifier; this enum only describes the labels.
 */
public enum Verdict {
    BULLS_STRONGLY_WINNING("Bulls Strongly Winning", SignalStrength.STRONG, SentimentDirection.BULLISH),
    BULLS_WINNING("Bulls Winning", SignalStrength.MODERATE, SentimentDirection.BULLISH),
    SLIGHTLY_BULLISH("Slightly Bullish", SignalStrength.WEAK, SentimentDirection.BULLISH),
    NEUTRAL("Neutral", SignalStrength.NONE, SentimentDirection.NEUTRAL),
    SLIGHTLY_BEARISH("Slightly Bearish", SignalStrength.WEAK, SentimentDirection.BEARISH),
    BEARS_WINNING("Bears Winning", SignalStrength.MODERATE, SentimentDirection.BEARISH),
    BEARS_STRONGLY_WINNING("Bears Strongly Winning", SignalStrength.STRONG, SentimentDirection.BEARISH);

    private final String label;
    private final SignalStrength strength;
    private final SentimentDirection direction;

    Verdict(String label, SignalStrength strength, SentimentDirection direction) {
        this.label = label;
        this.strength = strength;
        this.direction = direction;
    }

    public String getLabel() {
        return label;
    }

    public SignalStrength getStrength() {
        return strength;
    }

    public SentimentDirection getDirection() {
        return direction;
    }

    public boolean isBullish() {
        return direction == SentimentDirection.BULLISH;
    }

    public boolean isBearish() {
        return direction == SentimentDirection.BEARISH;
    }

    /** True for the "Winning" family (moderate or strong), as opposed to "Slightly". */
    public boolean isWinning() {
        return strength == SignalStrength.MODERATE || strength == SignalStrength.STRONG;
    }
}
