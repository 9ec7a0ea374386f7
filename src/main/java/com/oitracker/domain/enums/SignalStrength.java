package com.oitracker.domain.enums;

/** Strength bucket attached to a verdict. */
public enum SignalStrength {
    STRONG("strong"),
    MODERATE("moderate"),
    WEAK("weak"),
    NONE("none");

    private final String label;

    SignalStrength(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
