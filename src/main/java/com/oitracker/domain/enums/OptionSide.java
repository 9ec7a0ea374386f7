package com.oitracker.domain.enums;

/** Option side as quoted on NSE: CE (call) or PE (put). */
public enum OptionSide {
    CE,
    PE
}
