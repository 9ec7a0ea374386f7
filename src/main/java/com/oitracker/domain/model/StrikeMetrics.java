package com.oitracker.domain.model;

import com.oitracker.domain.enums.OptionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-strike open interest, activity and pricing for both option sides, as captured
 * for one snapshot timestamp.
 *
 * <p>OI and volume are contract counts. OI change is signed (writers exiting show up
 * as negative change). Implied volatility is in percent. Last traded price is the
 * option premium.
 *
 * <p>Venues frequently omit IV, volume and last price for illiquid strikes. Those
 * fields are never null here: the builder defaults them to zero, which downstream code
 * reads as "unavailable" ({@link #hasPrice(OptionSide)}, {@link #hasIv(OptionSide)}).
 * Range validation (non-negative OI and volume) happens once in {@link Snapshot#of}.
 */
@Getter
@Builder
@ToString
public class StrikeMetrics {

    private final int strike;

    private final long callOi;
    private final long putOi;

    private final long callOiChange;
    private final long putOiChange;

    private final long callVolume;
    private final long putVolume;

    @Builder.Default
    private final BigDecimal callIv = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal putIv = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal callLtp = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal putLtp = BigDecimal.ZERO;

    public long oi(OptionSide side) {
        return side == OptionSide.CE ? callOi : putOi;
    }

    public long oiChange(OptionSide side) {
        return side == OptionSide.CE ? callOiChange : putOiChange;
    }

    public long volume(OptionSide side) {
        return side == OptionSide.CE ? callVolume : putVolume;
    }

    public BigDecimal iv(OptionSide side) {
        BigDecimal iv = side == OptionSide.CE ? callIv : putIv;
        return iv != null ? iv : BigDecimal.ZERO;
    }

    public BigDecimal ltp(OptionSide side) {
        BigDecimal ltp = side == OptionSide.CE ? callLtp : putLtp;
        return ltp != null ? ltp : BigDecimal.ZERO;
    }

    /** True when the side has a usable (positive) last traded price. */
    public boolean hasPrice(OptionSide side) {
        return ltp(side).signum() > 0;
    }

    public boolean hasIv(OptionSide side) {
        return iv(side).signum() > 0;
    }
}
