package com.oitracker.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome statistics over a lookback window of setups.
 *
 * <p>Win rate counts only WON and LOST setups: cancelled and expired setups never traded.
 */
@Data
@Builder
public class TradeSetupStats {

    private int total;
    private int won;
    private int lost;
    private int cancelled;
    private int expired;

    /** PENDING or ACTIVE; at most one. */
    private int live;

    /** won / (won + lost) in percent; zero when nothing resolved. */
    private BigDecimal winRate;

    private BigDecimal avgWinPct;
    private BigDecimal avgLossPct;

    /** Average P&L % over WON and LOST setups. */
    private BigDecimal avgPnlPct;
}
