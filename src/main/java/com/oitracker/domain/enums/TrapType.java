package com.oitracker.domain.enums;

public enum TrapType {
    BULL_TRAP,
    BEAR_TRAP
}
