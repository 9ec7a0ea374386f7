package com.oitracker.domain.enums;

/** Phase of OI acceleration compared to the prior window. */
public enum OiPhase {
    /** Both sides' OI-change magnitudes shrinking. */
    UNWINDING,
    /** Net acceleration strongly bullish (put writing up or call OI falling). */
    ACCUMULATION,
    /** Net acceleration strongly bearish (call writing up or put OI falling). */
    DISTRIBUTION,
    NEUTRAL,
    /** No prior window to compare against. */
    INSUFFICIENT_DATA
}
