package com.oitracker.analysis;

import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeMetrics;
import java.util.Collection;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Max pain: the settlement strike at which option writers pay out the least intrinsic value.
 *
 * <p>payout(K) = sum over strikes s of callOi(s) * max(0, K - s) + putOi(s) * max(0, s - K).
 * Brute force over every strike as a candidate settlement; the lowest strike wins a tie.
 */
@Component
public class MaxPainCalculator {

    public Optional<Integer> calculate(Snapshot snapshot) {
        Collection<StrikeMetrics> strikes = snapshot.getStrikes().values();
        long totalOi = strikes.stream().mapToLong(m -> m.getCallOi() + m.getPutOi()).sum();
        if (strikes.isEmpty() || totalOi == 0) {
            return Optional.empty();
        }

        Integer maxPain = null;
        double minPayout = Double.MAX_VALUE;
        for (int settlement : snapshot.getStrikes().keySet()) {
            double payout = payoutAt(settlement, strikes);
            if (payout < minPayout) {
                minPayout = payout;
                maxPain = settlement;
            }
        }
        return Optional.ofNullable(maxPain);
    }

    double payoutAt(int settlement, Collection<StrikeMetrics> strikes) {
        double payout = 0.0;
        for (StrikeMetrics metrics : strikes) {
            int strike = metrics.getStrike();
            payout += (double) metrics.getCallOi() * Math.max(0, settlement - strike);
            payout += (double) metrics.getPutOi() * Math.max(0, strike - settlement);
        }
        return payout;
    }
}
