package com.oitracker.domain.model;

import com.oitracker.domain.enums.MarketRegimeType;
import com.oitracker.domain.enums.SentimentDirection;
import lombok.Builder;
import lombok.Data;

/**
 * Price regime and momentum of the underlying over the history window.
 */
@Data
@Builder
public class MarketRegime {

    private MarketRegimeType regime;

    /** Scaled price momentum, -100..100. */
    private double momentum;

    /** Raw % change from the oldest price in the window to spot. */
    private double priceChangePct;

    /** Direction of the raw move; NEUTRAL inside the flat threshold. */
    private SentimentDirection priceDirection;

    private double windowHigh;
    private double windowLow;

    /** (high - low) / spot, in percent. */
    private double rangePct;

    public double getOiChangeWeight() {
        return regime.getOiChangeWeight();
    }

    public double getTotalOiWeight() {
        return regime.getTotalOiWeight();
    }
}
