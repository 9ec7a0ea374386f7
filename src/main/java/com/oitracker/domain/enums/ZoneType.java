package com.oitracker.domain.enums;

/**
 * The four strike zones around the ATM strike.
 *
 * <pre>
 * below spot:  OTM_PUT  (put side of the lower window)   ITM_CALL (call side of the lower window)
 * above spot:  OTM_CALL (call side of the upper window)  ITM_PUT  (put side of the upper window)
 * </pre>
 */
public enum ZoneType {
    OTM_PUT(OptionSide.PE, true),
    ITM_CALL(OptionSide.CE, true),
    OTM_CALL(OptionSide.CE, false),
    ITM_PUT(OptionSide.PE, false);

    private final OptionSide side;
    private final boolean belowSpot;

    ZoneType(OptionSide side, boolean belowSpot) {
        this.side = side;
        this.belowSpot = belowSpot;
    }

    public OptionSide getSide() {
        return side;
    }

    public boolean isBelowSpot() {
        return belowSpot;
    }
}
