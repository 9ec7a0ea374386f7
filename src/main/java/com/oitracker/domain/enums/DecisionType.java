package com.oitracker.domain.enums;

/**
 * Classifies the kind of decision that was logged.
 *
 * <p>SETUP_GATE_EVALUATED vs SETUP_CREATED mirrors the evaluated/triggered split:
 * the gate runs every tick with no live setup, creation happens only when every
 * gate condition passes.
 */
public enum DecisionType {
    ANALYSIS_COMPLETED,
    SNAPSHOT_SKIPPED,
    SETUP_GATE_EVALUATED,
    SETUP_CREATED,
    SETUP_ACTIVATED,
    SETUP_WON,
    SETUP_LOST,
    SETUP_CANCELLED,
    SETUP_EXPIRED,
    SETUP_FORCE_CLOSED
}
