package com.oitracker.lifecycle;

import com.oitracker.domain.enums.SentimentDirection;
import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.MarketHistory;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.domain.model.TradeSetupCandidate;
import com.oitracker.observability.DecisionLogger;
import com.oitracker.setup.TradeQualityScorer;
import com.oitracker.setup.TradeReasoningFormatter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Gates creation of trade setups and drives them through their lifecycle.
 *
 * <pre>
 * PENDING --(premium &lt;= entry + 10%)--&gt; ACTIVE --(premium &lt;= SL)--&gt; LOST
 *                                                  --(premium &gt;= T1)--&gt; WON
 *                                                  --(15:20)--------&gt; WON | LOST by P&amp;L sign
 * PENDING --(direction flip | learner pause)--&gt; CANCELLED
 * PENDING --(15:25)--&gt; EXPIRED
 * </pre>
 *
 * <p>Every transition method is a no-op on a terminal setup and returns empty, so the
 * caller may invoke them redundantly within one tick. Cooldown clocks live in the
 * caller's {@link LifecycleState}; this service keeps nothing between calls.
 *
 * <p>P&amp;L on resolution is measured against the activation premium, not the entry.
 */
@Service
public class TradeSetupLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(TradeSetupLifecycleManager.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LifecycleConfig lifecycleConfig;
    private final CreationGate creationGate;
    private final TradeQualityScorer tradeQualityScorer;
    private final TradeReasoningFormatter tradeReasoningFormatter;
    private final DecisionLogger decisionLogger;

    public TradeSetupLifecycleManager(
            LifecycleConfig lifecycleConfig,
            CreationGate creationGate,
            TradeQualityScorer tradeQualityScorer,
            TradeReasoningFormatter tradeReasoningFormatter,
            DecisionLogger decisionLogger) {
        this.lifecycleConfig = lifecycleConfig;
        this.creationGate = creationGate;
        this.tradeQualityScorer = tradeQualityScorer;
        this.tradeReasoningFormatter = tradeReasoningFormatter;
        this.decisionLogger = decisionLogger;
    }

    // ========================
    // Creation
    // ========================

    /**
     * Creates a PENDING setup from the analysis's candidate if the creation gate approves.
     *
     * @param currentSetup the most recent setup (terminal or not), or null
     * @return the new, not yet persisted setup; empty when the gate rejects
     */
    public Optional<TradeSetup> createSetup(
            Analysis analysis,
            MarketHistory history,
            TradeSetup currentSetup,
            LifecycleState state,
            LocalDateTime now) {
        GateResult gate = creationGate.evaluate(analysis, history, currentSetup, state, now);
        decisionLogger.logGateDecision(analysis, gate);

        if (gate.isRejected()) {
            log.debug("Setup creation rejected at {}: {}", now, gate.getViolations());
            return Optional.empty();
        }

        TradeSetupCandidate candidate = analysis.tradeSetup().orElseThrow();
        int quality = tradeQualityScorer.score(analysis, candidate);

        TradeSetup setup = TradeSetup.builder()
                .createdAt(now)
                .direction(candidate.getDirection())
                .strike(candidate.getStrike())
                .optionSide(candidate.getOptionSide())
                .moneyness(candidate.getMoneyness())
                .entryPremium(candidate.getEntryPremium())
                .slPremium(candidate.getSlPremium())
                .target1Premium(candidate.getTarget1Premium())
                .target2Premium(candidate.getTarget2Premium())
                .riskPct(candidate.getRiskPct())
                .status(TradeSetupStatus.PENDING)
                .spotAtCreation(analysis.getSpotPrice())
                .verdictAtCreation(analysis.getVerdict().getLabel())
                .confidenceAtCreation(BigDecimal.valueOf(analysis.getConfidence()).setScale(1, RoundingMode.HALF_UP))
                .ivAtCreation(candidate.getIvAtStrike())
                .expiry(analysis.getExpiry())
                .callOiChangeAtCreation(analysis.getCallOiChange())
                .putOiChangeAtCreation(analysis.getPutOiChange())
                .pcrAtCreation(BigDecimal.valueOf(analysis.getPcr()).setScale(2, RoundingMode.HALF_UP))
                .maxPainAtCreation(analysis.getMaxPain())
                .supportAtCreation(candidate.getSupportRef())
                .resistanceAtCreation(candidate.getResistanceRef())
                .qualityScore(quality)
                .tradeReasoning(tradeReasoningFormatter.format(analysis, candidate, quality))
                .confidenceBreakdown(
                        analysis.getConfidenceBreakdown() != null
                                ? analysis.getConfidenceBreakdown().getComponents()
                                : null)
                .build();

        state.recordSuggestion(candidate.getDirection(), now);
        decisionLogger.logSetupCreated(setup);
        log.info(
                "Setup created: {} {} {} entry={} sl={} t1={} quality={}/{}",
                setup.getDirection(),
                setup.getStrike(),
                setup.getOptionSide(),
                setup.getEntryPremium(),
                setup.getSlPremium(),
                setup.getTarget1Premium(),
                quality,
                TradeQualityScorer.MAX_SCORE);
        return Optional.of(setup);
    }

    // ========================
    // Price-driven transitions
    // ========================

    /**
     * Records the latest premium and applies activation (PENDING) or SL/target resolution
     * (ACTIVE). A missing or non-positive premium leaves the setup untouched.
     */
    public Optional<SetupTransition> checkAndUpdate(
            TradeSetup setup, BigDecimal premium, LocalDateTime now, LifecycleState state) {
        if (setup == null || setup.isTerminal() || premium == null || premium.signum() <= 0) {
            return Optional.empty();
        }

        setup.setLastCheckedAt(now);
        setup.setLastPremium(premium);
        trackExtremes(setup, premium);

        if (setup.isPending()) {
            return tryActivate(setup, premium, now);
        }

        if (premium.compareTo(setup.getSlPremium()) <= 0) {
            return Optional.of(resolve(setup, TradeSetupStatus.LOST, premium, now, state, false, "Stop loss hit"));
        }
        if (premium.compareTo(setup.getTarget1Premium()) >= 0) {
            return Optional.of(resolve(setup, TradeSetupStatus.WON, premium, now, state, false, "Target 1 hit"));
        }
        return Optional.empty();
    }

    // ========================
    // Cancellation, expiry, force-close
    // ========================

    /** Cancels a PENDING setup when the verdict now points the other way. Neutral does not cancel. */
    public Optional<SetupTransition> cancelOnDirectionChange(
            TradeSetup setup, SentimentDirection verdictDirection, LocalDateTime now, LifecycleState state) {
        if (setup == null || !setup.isPending() || verdictDirection == null) {
            return Optional.empty();
        }
        if (verdictDirection != setup.getDirection().getSentiment().opposite()) {
            return Optional.empty();
        }
        return Optional.of(cancel(setup, now, state, "Verdict flipped " + verdictDirection + " while pending"));
    }

    /** Cancels a PENDING setup when the learner has paused trading. */
    public Optional<SetupTransition> cancelOnLearnerPause(
            TradeSetup setup, boolean learnerPaused, LocalDateTime now, LifecycleState state) {
        if (setup == null || !setup.isPending() || !learnerPaused) {
            return Optional.empty();
        }
        return Optional.of(cancel(setup, now, state, "Learner paused trading"));
    }

    /** Expires a PENDING setup that is still waiting at the market-close cutoff. */
    public Optional<SetupTransition> expirePending(TradeSetup setup, LocalDateTime now) {
        if (setup == null || !setup.isPending()) {
            return Optional.empty();
        }
        if (now.toLocalTime().isBefore(lifecycleConfig.getPendingExpiryTime())) {
            return Optional.empty();
        }
        setup.setStatus(TradeSetupStatus.EXPIRED);
        setup.setResolvedAt(now);

        SetupTransition transition = transition(
                setup, TradeSetupStatus.PENDING, now, false, "Not activated before " + lifecycleConfig.getPendingExpiryTime());
        decisionLogger.logTransition(transition);
        log.info("Setup {} expired without activation", setup.getId());
        return Optional.of(transition);
    }

    /**
     * Closes an ACTIVE setup at the late-session cutoff: WON if P&amp;L is positive, LOST
     * otherwise. Without a current premium the last observed premium is used, then the
     * activation premium (a flat close, hence LOST).
     */
    public Optional<SetupTransition> forceCloseActive(
            TradeSetup setup, BigDecimal premium, LocalDateTime now, LifecycleState state) {
        if (setup == null || !setup.isActive()) {
            return Optional.empty();
        }
        if (now.toLocalTime().isBefore(lifecycleConfig.getForceCloseTime())) {
            return Optional.empty();
        }

        BigDecimal exit = premium;
        if (exit == null || exit.signum() <= 0) {
            exit = setup.getLastPremium() != null ? setup.getLastPremium() : setup.getActivationPremium();
        } else {
            setup.setLastCheckedAt(now);
            setup.setLastPremium(exit);
            trackExtremes(setup, exit);
        }

        boolean profitable = exit.compareTo(setup.getPnlBasis()) > 0;
        TradeSetupStatus outcome = profitable ? TradeSetupStatus.WON : TradeSetupStatus.LOST;
        return Optional.of(resolve(
                setup, outcome, exit, now, state, true, "Force-closed at " + lifecycleConfig.getForceCloseTime()));
    }

    /**
     * Runs every transition in order: learner pause, direction flip, expiry, force-close,
     * then price checks. At most one status change results, since each step is a no-op
     * once the setup leaves the state it applies to.
     */
    public Optional<SetupTransition> advance(
            TradeSetup setup,
            Analysis analysis,
            BigDecimal premium,
            boolean learnerPaused,
            LocalDateTime now,
            LifecycleState state) {
        if (setup == null || setup.isTerminal()) {
            return Optional.empty();
        }
        return cancelOnLearnerPause(setup, learnerPaused, now, state)
                .or(() -> cancelOnDirectionChange(setup, analysis.getDirection(), now, state))
                .or(() -> expirePending(setup, now))
                .or(() -> forceCloseActive(setup, premium, now, state))
                .or(() -> checkAndUpdate(setup, premium, now, state));
    }

    // ========================
    // Live P&L
    // ========================

    /** ACTIVE: vs activation premium. PENDING: distance from entry. Terminal or no price: zero. */
    public LivePnl livePnl(TradeSetup setup, BigDecimal premium) {
        if (setup == null || setup.isTerminal() || premium == null || premium.signum() <= 0) {
            return LivePnl.zero();
        }
        BigDecimal basis = setup.isActive() ? setup.getActivationPremium() : setup.getEntryPremium();
        if (basis == null || basis.signum() <= 0) {
            return LivePnl.zero();
        }
        BigDecimal points = premium.subtract(basis);
        return new LivePnl(basis, premium, points.setScale(2, RoundingMode.HALF_UP), percentOf(points, basis));
    }

    // ========================
    // Internals
    // ========================

    private Optional<SetupTransition> tryActivate(TradeSetup setup, BigDecimal premium, LocalDateTime now) {
        BigDecimal entry = setup.getEntryPremium();
        BigDecimal tolerance = bandLimit(entry, lifecycleConfig.getEntryTolerancePct());
        BigDecimal maxChase = bandLimit(entry, lifecycleConfig.getMaxChasePct());

        if (premium.compareTo(maxChase) > 0) {
            log.debug(
                    "Setup {} waiting: premium {} above chase limit {} (entry {})",
                    setup.getId(), premium, maxChase, entry);
            return Optional.empty();
        }

        setup.setStatus(TradeSetupStatus.ACTIVE);
        setup.setActivatedAt(now);
        setup.setActivationPremium(premium);
        setup.setMaxPremiumReached(premium);
        setup.setMinPremiumReached(premium);

        String reason = premium.compareTo(tolerance) <= 0
                ? "Premium " + premium + " within entry tolerance " + tolerance
                : "Premium " + premium + " above tolerance, within chase limit " + maxChase;
        SetupTransition transition = transition(setup, TradeSetupStatus.PENDING, now, false, reason);
        decisionLogger.logTransition(transition);
        log.info("Setup {} activated at {} (entry {})", setup.getId(), premium, entry);
        return Optional.of(transition);
    }

    private SetupTransition resolve(
            TradeSetup setup,
            TradeSetupStatus outcome,
            BigDecimal exit,
            LocalDateTime now,
            LifecycleState state,
            boolean forced,
            String reason) {
        BigDecimal basis = setup.getPnlBasis();
        BigDecimal points = exit.subtract(basis);

        setup.setStatus(outcome);
        setup.setResolvedAt(now);
        setup.setExitPremium(exit);
        setup.setHitSl(!forced && outcome == TradeSetupStatus.LOST);
        setup.setHitTarget(!forced && outcome == TradeSetupStatus.WON);
        setup.setProfitLossPoints(points.setScale(2, RoundingMode.HALF_UP));
        setup.setProfitLossPct(percentOf(points, basis));
        state.recordResolution(now);

        SetupTransition transition = transition(setup, TradeSetupStatus.ACTIVE, now, forced, reason);
        decisionLogger.logTransition(transition);
        if (outcome == TradeSetupStatus.LOST) {
            log.warn("Setup {} LOST: exit {} vs activation {} ({}%)", setup.getId(), exit, basis, setup.getProfitLossPct());
        } else {
            log.info("Setup {} WON: exit {} vs activation {} ({}%)", setup.getId(), exit, basis, setup.getProfitLossPct());
        }
        return transition;
    }

    private SetupTransition cancel(TradeSetup setup, LocalDateTime now, LifecycleState state, String reason) {
        setup.setStatus(TradeSetupStatus.CANCELLED);
        setup.setResolvedAt(now);
        state.recordCancellation(now);

        SetupTransition transition = transition(setup, TradeSetupStatus.PENDING, now, false, reason);
        decisionLogger.logTransition(transition);
        log.info("Setup {} cancelled: {}", setup.getId(), reason);
        return transition;
    }

    private static SetupTransition transition(
            TradeSetup setup, TradeSetupStatus from, LocalDateTime at, boolean forced, String reason) {
        return SetupTransition.builder()
                .setup(setup)
                .from(from)
                .to(setup.getStatus())
                .at(at)
                .forced(forced)
                .reason(reason)
                .build();
    }

    private static void trackExtremes(TradeSetup setup, BigDecimal premium) {
        if (setup.getMaxPremiumReached() == null || premium.compareTo(setup.getMaxPremiumReached()) > 0) {
            setup.setMaxPremiumReached(premium);
        }
        if (setup.getMinPremiumReached() == null || premium.compareTo(setup.getMinPremiumReached()) < 0) {
            setup.setMinPremiumReached(premium);
        }
    }

    private static BigDecimal bandLimit(BigDecimal entry, BigDecimal pct) {
        return entry.multiply(HUNDRED.add(pct)).divide(HUNDRED, 4, RoundingMode.HALF_UP);
    }

    private static BigDecimal percentOf(BigDecimal points, BigDecimal basis) {
        return points.multiply(HUNDRED).divide(basis, 2, RoundingMode.HALF_UP);
    }
}
