package com.oitracker.domain.enums;

/**
 * Direction of a signal: the verdict itself, an auxiliary indicator (IV skew,
 * futures OI), or the underlying's price move over the history window.
 */
public enum SentimentDirection {
    BULLISH,
    BEARISH,
    NEUTRAL;

    /** Sign convention used by the scorers: +1 bullish, -1 bearish, 0 neutral. */
    public int sign() {
        return switch (this) {
            case BULLISH -> 1;
            case BEARISH -> -1;
            case NEUTRAL -> 0;
        };
    }

    public static SentimentDirection fromSign(double value) {
        if (value > 0) {
            return BULLISH;
        }
        if (value < 0) {
            return BEARISH;
        }
        return NEUTRAL;
    }

    public SentimentDirection opposite() {
        return switch (this) {
            case BULLISH -> BEARISH;
            case BEARISH -> BULLISH;
            case NEUTRAL -> NEUTRAL;
        };
    }
}
