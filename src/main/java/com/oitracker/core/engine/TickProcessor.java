package com.oitracker.core.engine;

import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.MarketHistory;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeMetrics;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.event.EventPublisherHelper;
import com.oitracker.exception.InvalidSnapshotException;
import com.oitracker.learner.SignalLearner;
import com.oitracker.lifecycle.LifecycleState;
import com.oitracker.lifecycle.LivePnl;
import com.oitracker.lifecycle.SetupTransition;
import com.oitracker.lifecycle.TradeSetupLifecycleManager;
import com.oitracker.observability.DecisionLogger;
import com.oitracker.service.TradeSetupService;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point an external scheduler calls once per snapshot.
 *
 * <p>One tick:
 * <ol>
 *   <li>Validate the raw snapshot (invalid data skips the tick)</li>
 *   <li>Analyze it with the {@link TugOfWarEngine}</li>
 *   <li>Advance the live setup: cancel, expire, force-close, activate or resolve</li>
 *   <li>Run the creation gate and create a new setup if it approves</li>
 *   <li>Persist changes and publish setup events</li>
 * </ol>
 *
 * <p>Holds the {@link LifecycleState} between ticks. Not thread-safe: the scheduler must
 * serialize calls, which keeps "at most one live setup" a single-writer invariant.
 */
@Service
public class TickProcessor {

    private static final Logger log = LoggerFactory.getLogger(TickProcessor.class);

    private final TugOfWarEngine tugOfWarEngine;
    private final TradeSetupLifecycleManager lifecycleManager;
    private final TradeSetupService tradeSetupService;
    private final SignalLearner signalLearner;
    private final EventPublisherHelper eventPublisherHelper;
    private final DecisionLogger decisionLogger;

    private final LifecycleState lifecycleState = new LifecycleState();

    public TickProcessor(
            TugOfWarEngine tugOfWarEngine,
            TradeSetupLifecycleManager lifecycleManager,
            TradeSetupService tradeSetupService,
            SignalLearner signalLearner,
            EventPublisherHelper eventPublisherHelper,
            DecisionLogger decisionLogger) {
        this.tugOfWarEngine = tugOfWarEngine;
        this.lifecycleManager = lifecycleManager;
        this.tradeSetupService = tradeSetupService;
        this.signalLearner = signalLearner;
        this.eventPublisherHelper = eventPublisherHelper;
        this.decisionLogger = decisionLogger;
    }

    /**
     * Validates raw snapshot data and processes it. Invalid data is logged and the tick is
     * skipped; it never propagates to the scheduler.
     */
    public TickOutcome processTick(
            LocalDateTime timestamp,
            BigDecimal spotPrice,
            String expiry,
            Collection<StrikeMetrics> strikes,
            MarketHistory history) {
        Snapshot snapshot;
        try {
            snapshot = Snapshot.of(timestamp, spotPrice, expiry, strikes);
        } catch (InvalidSnapshotException e) {
            log.warn("Skipping tick at {}: {}", timestamp, e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>(e.getDetails());
            details.put("timestamp", String.valueOf(timestamp));
            decisionLogger.logSnapshotSkipped(e.getMessage(), details);
            return TickOutcome.skipped(e.getMessage());
        }
        return processTick(snapshot, history);
    }

    public TickOutcome processTick(Snapshot snapshot, MarketHistory history) {
        LocalDateTime now = snapshot.getTimestamp();
        lifecycleState.advanceCycle();

        Analysis analysis = tugOfWarEngine.analyze(snapshot, history);
        decisionLogger.logAnalysis(analysis);

        // Advance the live setup
        Optional<TradeSetup> live = tradeSetupService.findLive();
        SetupTransition transition = null;
        if (live.isPresent()) {
            TradeSetup setup = live.get();
            BigDecimal premium = currentPremium(snapshot, setup);
            TradeSetupStatus previousStatus = setup.getStatus();

            transition = lifecycleManager
                    .advance(setup, analysis, premium, signalLearner.isPaused(), now, lifecycleState)
                    .orElse(null);
            tradeSetupService.update(setup);

            if (transition != null) {
                eventPublisherHelper.publishSetupTransition(this, setup, previousStatus);
            }
        }

        // Gate and create
        TradeSetup current = live.orElseGet(() -> tradeSetupService.findLatest().orElse(null));
        TradeSetup created = lifecycleManager
                .createSetup(analysis, history, current, lifecycleState, now)
                .map(setup -> {
                    TradeSetup saved = tradeSetupService.create(setup);
                    eventPublisherHelper.publishSetupCreated(this, saved);
                    return saved;
                })
                .orElse(null);

        TradeSetup liveAfter = created != null
                ? created
                : live.filter(setup -> !setup.isTerminal()).orElse(null);
        LivePnl livePnl = liveAfter != null
                ? lifecycleManager.livePnl(liveAfter, currentPremium(snapshot, liveAfter))
                : LivePnl.zero();

        return TickOutcome.builder()
                .analysis(analysis)
                .transition(transition)
                .createdSetup(created)
                .liveSetup(liveAfter)
                .livePnl(livePnl)
                .build();
    }

    public LifecycleState getLifecycleState() {
        return lifecycleState;
    }

    private static BigDecimal currentPremium(Snapshot snapshot, TradeSetup setup) {
        StrikeMetrics metrics = snapshot.get(setup.getStrike());
        if (metrics == null || !metrics.hasPrice(setup.getOptionSide())) {
            return null;
        }
        return metrics.ltp(setup.getOptionSide());
    }
}
