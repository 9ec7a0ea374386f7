package com.oitracker.unit.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.domain.model.TradeSetupStats;
import com.oitracker.service.TradeSetupStatsCalculator;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TradeSetupStatsCalculator covering counts, win rate and P&L averages.
 */
class TradeSetupStatsCalculatorTest {

    private TradeSetupStatsCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new TradeSetupStatsCalculator();
    }

    private static TradeSetup setup(TradeSetupStatus status, String pnlPct) {
        return TradeSetup.builder()
                .status(status)
                .profitLossPct(pnlPct != null ? new BigDecimal(pnlPct) : null)
                .build();
    }

    @Test
    @DisplayName("Counts every status and excludes cancelled and expired from the win rate")
    void countsAndWinRate() {
        List<TradeSetup> setups = List.of(
                setup(TradeSetupStatus.WON, "20.00"),
                setup(TradeSetupStatus.WON, "10.00"),
                setup(TradeSetupStatus.LOST, "-18.00"),
                setup(TradeSetupStatus.CANCELLED, null),
                setup(TradeSetupStatus.EXPIRED, null),
                setup(TradeSetupStatus.ACTIVE, null));

        TradeSetupStats stats = calculator.calculate(setups);

        assertThat(stats.getTotal()).isEqualTo(6);
        assertThat(stats.getWon()).isEqualTo(2);
        assertThat(stats.getLost()).isEqualTo(1);
        assertThat(stats.getCancelled()).isEqualTo(1);
        assertThat(stats.getExpired()).isEqualTo(1);
        assertThat(stats.getLive()).isEqualTo(1);
        assertThat(stats.getWinRate()).isEqualByComparingTo("66.67");
    }

    @Test
    @DisplayName("Averages win, loss and overall P&L separately")
    void averages() {
        List<TradeSetup> setups = List.of(
                setup(TradeSetupStatus.WON, "20.00"),
                setup(TradeSetupStatus.WON, "10.00"),
                setup(TradeSetupStatus.LOST, "-18.00"));

        TradeSetupStats stats = calculator.calculate(setups);

        assertThat(stats.getAvgWinPct()).isEqualByComparingTo("15.00");
        assertThat(stats.getAvgLossPct()).isEqualByComparingTo("-18.00");
        assertThat(stats.getAvgPnlPct()).isEqualByComparingTo("4.00");
    }

    @Test
    @DisplayName("No resolved setups gives zero rates")
    void empty() {
        TradeSetupStats stats = calculator.calculate(List.of(setup(TradeSetupStatus.PENDING, null)));

        assertThat(stats.getWinRate()).isEqualByComparingTo("0");
        assertThat(stats.getAvgPnlPct()).isEqualByComparingTo("0");
        assertThat(stats.getLive()).isEqualTo(1);
    }
}
