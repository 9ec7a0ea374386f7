package com.oitracker.domain.enums;

/**
 * Price regime of the underlying over the history window.
 *
 * <p>The regime also carries the OI-change / total-OI blend that suits it: trends
 * are read from positioning (total OI), ranges from fresh activity (OI change).
 */
public enum MarketRegimeType {
    TRENDING_UP("trending_up", 0.30, 0.70),
    TRENDING_DOWN("trending_down", 0.30, 0.70),
    RANGE_BOUND("range_bound", 0.70, 0.30);

    private final String label;
    private final double oiChangeWeight;
    private final double totalOiWeight;

    MarketRegimeType(String label, double oiChangeWeight, double totalOiWeight) {
        this.label = label;
        this.oiChangeWeight = oiChangeWeight;
        this.totalOiWeight = totalOiWeight;
    }

    public String getLabel() {
        return label;
    }

    public double getOiChangeWeight() {
        return oiChangeWeight;
    }

    public double getTotalOiWeight() {
        return totalOiWeight;
    }
}
