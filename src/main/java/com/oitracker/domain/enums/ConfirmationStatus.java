package com.oitracker.domain.enums;

/**
 * Agreement between the OI-implied direction and the actual price direction.
 */
public enum ConfirmationStatus {
    /** OI and price point the same way. */
    CONFIRMED,
    /** OI opposes price but premiums already side with OI. */
    REVERSAL_ALERT,
    /** OI opposes price with no premium support. */
    CONFLICT,
    /** Either OI or price is flat. */
    NEUTRAL
}
