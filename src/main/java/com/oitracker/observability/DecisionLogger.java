package com.oitracker.observability;

import com.oitracker.domain.enums.DecisionOutcome;
import com.oitracker.domain.enums.DecisionSeverity;
import com.oitracker.domain.enums.DecisionSource;
import com.oitracker.domain.enums.DecisionType;
import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.DecisionRecord;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.event.DecisionLogEvent;
import com.oitracker.lifecycle.GateResult;
import com.oitracker.lifecycle.GateViolation;
import com.oitracker.lifecycle.SetupTransition;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Central decision log of the tracker.
 *
 * <p>Every analysis, gate evaluation, setup creation and lifecycle transition is captured as
 * a structured {@link DecisionRecord} with its reasoning and the values it was based on.
 * Records go to an in-memory ring buffer (last {@value #RING_BUFFER_SIZE}, newest first) and
 * are published as {@link DecisionLogEvent}s for any listener outside the core.
 *
 * <p>The specialized methods set source, type, outcome and severity; all of them delegate
 * to {@link #log}.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ApplicationEventPublisher applicationEventPublisher;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    public DecisionLogger(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Core logging method ----

    public DecisionRecord log(
            DecisionSource source,
            String sourceId,
            DecisionType decisionType,
            DecisionOutcome outcome,
            String reasoning,
            Map<String, Object> dataContext,
            DecisionSeverity severity) {

        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(LocalDateTime.now())
                .source(source)
                .sourceId(sourceId)
                .decisionType(decisionType)
                .outcome(outcome)
                .reasoning(reasoning)
                .dataContext(dataContext)
                .severity(severity)
                .build();

        persist(decisionRecord);

        return decisionRecord;
    }

    // ---- Analysis ----

    public void logAnalysis(Analysis analysis) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("spotPrice", analysis.getSpotPrice());
        context.put("atmStrike", analysis.getAtmStrike());
        context.put("combinedScore", analysis.getCombinedScore());
        context.put("confidence", analysis.getConfidence());
        context.put("regime", analysis.getMarketRegime().getRegime());
        context.put("confirmation", analysis.getConfirmationStatus());
        analysis.maxPain().ifPresent(maxPain -> context.put("maxPain", maxPain));
        analysis.trapWarning().ifPresent(trap -> context.put("trap", trap.getType()));

        log(
                DecisionSource.TUG_OF_WAR_ENGINE,
                String.valueOf(analysis.getTimestamp()),
                DecisionType.ANALYSIS_COMPLETED,
                DecisionOutcome.INFO,
                String.format(
                        "%s (score %.1f, confidence %.0f)",
                        analysis.getVerdict().getLabel(), analysis.getCombinedScore(), analysis.getConfidence()),
                context,
                DecisionSeverity.DEBUG);
    }

    public void logSnapshotSkipped(String reasoning, Map<String, Object> details) {
        log(
                DecisionSource.TICK_PROCESSOR,
                null,
                DecisionType.SNAPSHOT_SKIPPED,
                DecisionOutcome.SKIPPED,
                reasoning,
                details,
                DecisionSeverity.WARNING);
    }

    // ---- Creation gate ----

    public void logGateDecision(Analysis analysis, GateResult gateResult) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("verdict", analysis.getVerdict().getLabel());
        context.put("confidence", analysis.getConfidence());
        if (gateResult.isRejected()) {
            context.put(
                    "violations",
                    gateResult.getViolations().stream().map(GateViolation::toString).toList());
        }

        log(
                DecisionSource.LIFECYCLE_MANAGER,
                String.valueOf(analysis.getTimestamp()),
                DecisionType.SETUP_GATE_EVALUATED,
                gateResult.isApproved() ? DecisionOutcome.TRIGGERED : DecisionOutcome.REJECTED,
                gateResult.isApproved()
                        ? "All creation conditions passed"
                        : "Rejected: " + String.join(", ", gateResult.codes()),
                context,
                DecisionSeverity.DEBUG);
    }

    // ---- Setup lifecycle ----

    public void logSetupCreated(TradeSetup setup) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("direction", setup.getDirection());
        context.put("strike", setup.getStrike());
        context.put("entryPremium", setup.getEntryPremium());
        context.put("slPremium", setup.getSlPremium());
        context.put("target1Premium", setup.getTarget1Premium());
        context.put("qualityScore", setup.getQualityScore());

        log(
                DecisionSource.LIFECYCLE_MANAGER,
                setup.getId() != null ? String.valueOf(setup.getId()) : null,
                DecisionType.SETUP_CREATED,
                DecisionOutcome.TRIGGERED,
                setup.getTradeReasoning(),
                context,
                DecisionSeverity.INFO);
    }

    public void logTransition(SetupTransition transition) {
        TradeSetup setup = transition.getSetup();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("from", transition.getFrom());
        context.put("to", transition.getTo());
        context.put("lastPremium", setup.getLastPremium());
        if (transition.isResolution()) {
            context.put("exitPremium", setup.getExitPremium());
            context.put("profitLossPct", setup.getProfitLossPct());
        }

        TradeSetupStatus to = transition.getTo();
        DecisionSeverity severity = (to == TradeSetupStatus.LOST || to == TradeSetupStatus.CANCELLED)
                ? DecisionSeverity.WARNING
                : DecisionSeverity.INFO;

        log(
                DecisionSource.LIFECYCLE_MANAGER,
                setup.getId() != null ? String.valueOf(setup.getId()) : null,
                transition.isForced() ? DecisionType.SETUP_FORCE_CLOSED : decisionTypeFor(to),
                DecisionOutcome.TRIGGERED,
                transition.getReason(),
                context,
                severity);
    }

    // ---- Ring buffer queries ----

    /** The most recent N decision records, newest first. */
    public List<DecisionRecord> getRecentDecisions(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, DecisionSource source) {
        return ringBuffer.stream()
                .filter(r -> r.getSource() == source)
                .limit(count)
                .toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    // ---- Internal ----

    private static DecisionType decisionTypeFor(TradeSetupStatus status) {
        return switch (status) {
            case ACTIVE -> DecisionType.SETUP_ACTIVATED;
            case WON -> DecisionType.SETUP_WON;
            case LOST -> DecisionType.SETUP_LOST;
            case CANCELLED -> DecisionType.SETUP_CANCELLED;
            case EXPIRED -> DecisionType.SETUP_EXPIRED;
            case PENDING -> DecisionType.SETUP_CREATED;
        };
    }

    private void persist(DecisionRecord decisionRecord) {
        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }

        try {
            applicationEventPublisher.publishEvent(new DecisionLogEvent(this, decisionRecord));
        } catch (RuntimeException e) {
            // Listener failures must not break the decision loop
            logger.error("Failed to publish DecisionLogEvent: {}", e.getMessage());
        }
    }
}
