package com.oitracker.domain.enums;

/**
 * The result of a decision evaluation.
 *
 * <ul>
 *   <li>TRIGGERED -- the condition was met and action was taken (setup created, transition applied)</li>
 *   <li>SKIPPED -- evaluated, nothing to do this tick</li>
 *   <li>REJECTED -- blocked by the creation gate</li>
 *   <li>INFO -- informational entry, no action involved</li>
 * </ul>
 */
public enum DecisionOutcome {
    TRIGGERED,
    SKIPPED,
    REJECTED,
    INFO
}
