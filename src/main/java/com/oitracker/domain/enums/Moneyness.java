package com.oitracker.domain.enums;

/** Moneyness of the selected strike relative to spot. */
public enum Moneyness {
    ITM,
    ATM,
    OTM
}
