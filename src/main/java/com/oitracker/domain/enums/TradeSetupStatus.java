package com.oitracker.domain.enums;

/**
 * Lifecycle states of a trade setup.
 *
 * <pre>
 * PENDING -> ACTIVE -> WON | LOST
 * PENDING -> CANCELLED | EXPIRED
 * </pre>
 *
 * <p>WON, LOST, CANCELLED and EXPIRED are absorbing: no transition leaves them.
 */
public enum TradeSetupStatus {
    PENDING(false),
    ACTIVE(false),
    WON(true),
    LOST(true),
    CANCELLED(true),
    EXPIRED(true);

    private final boolean terminal;

    TradeSetupStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
