package com.oitracker.domain.model;

import com.oitracker.domain.enums.OiPhase;
import lombok.Builder;
import lombok.Data;

/**
 * Current zone OI-change totals compared with the average of the prior window.
 */
@Data
@Builder
public class OiAcceleration {

    private OiPhase phase;

    /** short_covering, profit_booking, accumulation, distribution or neutral. */
    private String label;

    private long currentCallChange;
    private long currentPutChange;
    private double priorCallChange;
    private double priorPutChange;

    private double callAcceleration;
    private double putAcceleration;

    /** putAcceleration - callAcceleration; positive is bullish. */
    private double netAcceleration;

    /** Points added to the combined score. */
    private double adjustment;
}
