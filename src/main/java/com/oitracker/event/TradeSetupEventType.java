package com.oitracker.event;

/**
 * Classifies the setup transition that triggered a {@link TradeSetupEvent}.
 */
public enum TradeSetupEventType {

    /** A new PENDING setup passed the creation gate. */
    CREATED,

    /** Premium came back into the entry band; the setup is live. */
    ACTIVATED,

    WON,

    LOST,

    /** Withdrawn while pending (direction flip or learner pause). */
    CANCELLED,

    /** Still pending at the market-close cutoff. */
    EXPIRED
}
