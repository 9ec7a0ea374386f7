package com.oitracker.domain.model;

import com.oitracker.domain.enums.DecisionOutcome;
import com.oitracker.domain.enums.DecisionSeverity;
import com.oitracker.domain.enums.DecisionSource;
import com.oitracker.domain.enums.DecisionType;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Structured log entry for one automated decision: an analysis, a gate evaluation, a
 * setup creation or a lifecycle transition.
 *
 * <p>Key fields:
 * <ul>
 *   <li>{@code source} -- which component made the decision</li>
 *   <li>{@code sourceId} -- setup ID or snapshot timestamp, for correlation</li>
 *   <li>{@code dataContext} -- structured values at decision time (premiums, violations, scores)</li>
 * </ul>
 */
@Data
@Builder
public class DecisionRecord {

    private LocalDateTime timestamp;

    private DecisionSource source;

    private String sourceId;

    private DecisionType decisionType;

    private DecisionOutcome outcome;

    /** Human-readable explanation of why this decision was made. */
    private String reasoning;

    private Map<String, Object> dataContext;

    private DecisionSeverity severity;
}
