package com.oitracker.lifecycle;

import java.math.BigDecimal;

/**
 * Unrealized P&L of a setup at the current premium.
 *
 * @param basis   activation premium for ACTIVE setups, entry premium for PENDING ones
 * @param current the premium the P&L was measured at
 * @param points  current - basis
 * @param pct     points as a percentage of basis
 */
public record LivePnl(BigDecimal basis, BigDecimal current, BigDecimal points, BigDecimal pct) {

    public static LivePnl zero() {
        return new LivePnl(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
