package com.oitracker.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * ATM premium change since the previous snapshot.
 *
 * <p>A call premium rising faster than the put premium is bullish price action in the
 * options themselves, independent of what writers are doing with OI.
 */
@Data
@Builder
public class PremiumMomentum {

    private int atmStrike;
    private double callChangePct;
    private double putChangePct;

    /** clamp((call% - put%) * 5, -100, 100). */
    private double score;

    /** Points added to the combined score when premiums contradict OI. */
    private double adjustment;

    public static PremiumMomentum none(int atmStrike) {
        return PremiumMomentum.builder().atmStrike(atmStrike).build();
    }
}
