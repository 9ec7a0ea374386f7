package com.oitracker.lifecycle;

import lombok.Builder;
import lombok.Getter;

/**
 * One failed creation-gate condition.
 *
 * <p>The code is machine-readable (RESOLUTION_COOLDOWN, REGIME_MISALIGNED, ...), the message
 * explains it with the values involved.
 */
@Getter
@Builder
public class GateViolation {

    private final String code;

    private final String message;

    public static GateViolation of(String code, String message) {
        return GateViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
