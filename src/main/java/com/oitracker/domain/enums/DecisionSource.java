package com.oitracker.domain.enums;

/**
 * Identifies which component produced a decision log entry, so the log can be
 * filtered by subsystem (e.g. only LIFECYCLE_MANAGER to review why no setup was
 * proposed on a given tick).
 */
public enum DecisionSource {
    TUG_OF_WAR_ENGINE,
    SETUP_BUILDER,
    LIFECYCLE_MANAGER,
    TICK_PROCESSOR
}
