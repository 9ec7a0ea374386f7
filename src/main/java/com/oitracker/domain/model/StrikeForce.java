package com.oitracker.domain.model;

import com.oitracker.domain.enums.OptionSide;
import lombok.Builder;
import lombok.Data;

/**
 * Directional force computed for one side of one strike inside a zone.
 */
@Data
@Builder
public class StrikeForce {

    private int strike;
    private OptionSide side;
    private long oi;
    private long oiChange;
    private long volume;

    /** 0.5 (noise/stale), 1.0 (normal) or 1.5 (fresh, high turnover). */
    private double conviction;

    private double force;
}
