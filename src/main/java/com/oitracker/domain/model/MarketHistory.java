package com.oitracker.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Short rolling history supplied by the caller alongside each snapshot.
 *
 * <p>All lists are ordered oldest first and keyed by recency, not by timestamp. The
 * engine never stores any of this between invocations: the history provider owns it
 * and passes it in by value every tick.
 */
@Data
@Builder
public class MarketHistory {

    /** Recent spot prices, oldest first, excluding the current snapshot's spot. */
    @Builder.Default
    private List<BigDecimal> recentPrices = Collections.emptyList();

    /** Zone call/put OI-change totals of the last few snapshots, oldest first. */
    @Builder.Default
    private List<OiChangePair> priorOiChanges = Collections.emptyList();

    /** Strike metrics of the immediately preceding snapshot (premium momentum). */
    @Builder.Default
    private Map<Integer, StrikeMetrics> previousStrikes = Collections.emptyMap();

    /** India VIX; zero when unavailable. */
    @Builder.Default
    private BigDecimal vix = BigDecimal.ZERO;

    /** Change in near-month futures OI since the previous snapshot; zero when unavailable. */
    private long futuresOiChange;

    public static MarketHistory empty() {
        return MarketHistory.builder().build();
    }

    /**
     * The price {@code lookback} entries before the current snapshot, or the oldest one when
     * the window is shorter. Null when there is no history.
     */
    public BigDecimal priceBack(int lookback) {
        if (recentPrices == null || recentPrices.isEmpty()) {
            return null;
        }
        return recentPrices.get(Math.max(0, recentPrices.size() - Math.max(1, lookback)));
    }
}
