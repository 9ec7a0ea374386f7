package com.oitracker.lifecycle;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Outcome of the creation gate: approved (no violations) or rejected with every failed
 * condition, not just the first. A rejection is an ordinary outcome, not an error.
 */
@Getter
public class GateResult {

    private final boolean approved;
    private final List<GateViolation> violations;

    private GateResult(boolean approved, List<GateViolation> violations) {
        this.approved = approved;
        this.violations = violations;
    }

    public static GateResult approved() {
        return new GateResult(true, Collections.emptyList());
    }

    public static GateResult rejected(List<GateViolation> violations) {
        return new GateResult(false, List.copyOf(violations));
    }

    public boolean isRejected() {
        return !approved;
    }

    public boolean hasViolation(String code) {
        return violations.stream().anyMatch(v -> v.getCode().equals(code));
    }

    public List<String> codes() {
        return violations.stream().map(GateViolation::getCode).toList();
    }
}
