package com.oitracker.domain.enums;

/**
 * Severity level for decision log entries.
 *
 * <ul>
 *   <li>DEBUG -- routine evaluations (gate checked, nothing changed)</li>
 *   <li>INFO -- setups created, activated, won, expired</li>
 *   <li>WARNING -- losses, cancellations, skipped snapshots</li>
 * </ul>
 */
public enum DecisionSeverity {
    DEBUG,
    INFO,
    WARNING
}
