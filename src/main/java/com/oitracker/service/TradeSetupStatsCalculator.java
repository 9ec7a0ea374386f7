package com.oitracker.service;

import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.domain.model.TradeSetupStats;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Aggregates setup outcomes into {@link TradeSetupStats}.
 */
@Component
public class TradeSetupStatsCalculator {

    public TradeSetupStats calculate(List<TradeSetup> setups) {
        int won = count(setups, TradeSetupStatus.WON);
        int lost = count(setups, TradeSetupStatus.LOST);
        int live = (int) setups.stream().filter(s -> !s.isTerminal()).count();

        List<BigDecimal> wins = pnlOf(setups, TradeSetupStatus.WON);
        List<BigDecimal> losses = pnlOf(setups, TradeSetupStatus.LOST);
        List<BigDecimal> resolved = new ArrayList<>(wins);
        resolved.addAll(losses);

        BigDecimal winRate = won + lost == 0
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(won * 100L).divide(BigDecimal.valueOf(won + lost), 2, RoundingMode.HALF_UP);

        return TradeSetupStats.builder()
                .total(setups.size())
                .won(won)
                .lost(lost)
                .cancelled(count(setups, TradeSetupStatus.CANCELLED))
                .expired(count(setups, TradeSetupStatus.EXPIRED))
                .live(live)
                .winRate(winRate)
                .avgWinPct(average(wins))
                .avgLossPct(average(losses))
                .avgPnlPct(average(resolved))
                .build();
    }

    private static int count(List<TradeSetup> setups, TradeSetupStatus status) {
        return (int) setups.stream().filter(s -> s.getStatus() == status).count();
    }

    private static List<BigDecimal> pnlOf(List<TradeSetup> setups, TradeSetupStatus status) {
        return setups.stream()
                .filter(s -> s.getStatus() == status && s.getProfitLossPct() != null)
                .map(TradeSetup::getProfitLossPct)
                .toList();
    }

    private static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), 2, RoundingMode.HALF_UP);
    }
}
