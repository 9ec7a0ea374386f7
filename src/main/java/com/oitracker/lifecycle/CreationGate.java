package com.oitracker.lifecycle;

import com.oitracker.analysis.ScoreMath;
import com.oitracker.domain.enums.ConfirmationStatus;
import com.oitracker.domain.enums.MarketRegimeType;
import com.oitracker.domain.enums.Moneyness;
import com.oitracker.domain.enums.TradeDirection;
import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.MarketHistory;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.domain.model.TradeSetupCandidate;
import com.oitracker.learner.LearnerDecision;
import com.oitracker.learner.SignalLearner;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Decides whether a new trade setup may be created on this tick.
 *
 * <p>Every condition is checked and all failures are reported together, so the decision log
 * shows the complete picture rather than the first blocker. Conditions fall into four groups:
 * <ol>
 *   <li>Session and exclusivity: trading window, no live setup</li>
 *   <li>Learner: {@link SignalLearner#shouldTrade} (pause, confidence band, excluded
 *       sub-ranges, underperforming verdicts); its first refusal is reported</li>
 *   <li>Timing: resolution, cancellation and direction-flip cooldowns; stale-move and
 *       bounce guards on the underlying</li>
 *   <li>Signal quality: a tradable candidate, regime gates, regime alignment, confirmation
 *       status, and at least 3 of 4 independent confirmations</li>
 * </ol>
 */
@Component
public class CreationGate {

    public static final String OUTSIDE_TRADING_WINDOW = "OUTSIDE_TRADING_WINDOW";
    public static final String ACTIVE_SETUP_EXISTS = "ACTIVE_SETUP_EXISTS";
    public static final String LEARNER_PAUSED = "LEARNER_PAUSED";
    public static final String LEARNER_REJECTED = "LEARNER_REJECTED";
    public static final String CONFIDENCE_OUT_OF_BAND = "CONFIDENCE_OUT_OF_BAND";
    public static final String CONFIDENCE_EXCLUDED = "CONFIDENCE_EXCLUDED";
    public static final String RESOLUTION_COOLDOWN = "RESOLUTION_COOLDOWN";
    public static final String CANCELLATION_COOLDOWN = "CANCELLATION_COOLDOWN";
    public static final String DIRECTION_FLIP_COOLDOWN = "DIRECTION_FLIP_COOLDOWN";
    public static final String MOVE_ALREADY_HAPPENED = "MOVE_ALREADY_HAPPENED";
    public static final String BOUNCE_IN_PROGRESS = "BOUNCE_IN_PROGRESS";
    public static final String NO_TRADE_CANDIDATE = "NO_TRADE_CANDIDATE";
    public static final String VERDICT_UNDERPERFORMING = "VERDICT_UNDERPERFORMING";
    public static final String RANGE_BOUND_OTM = "RANGE_BOUND_OTM";
    public static final String RANGE_BOUND_WIDE_STOP = "RANGE_BOUND_WIDE_STOP";
    public static final String REGIME_MISALIGNED = "REGIME_MISALIGNED";
    public static final String UNCONFIRMED_SIGNAL = "UNCONFIRMED_SIGNAL";
    public static final String INSUFFICIENT_CONFIRMATIONS = "INSUFFICIENT_CONFIRMATIONS";

    private final LifecycleConfig lifecycleConfig;
    private final SignalLearner signalLearner;

    public CreationGate(LifecycleConfig lifecycleConfig, SignalLearner signalLearner) {
        this.lifecycleConfig = lifecycleConfig;
        this.signalLearner = signalLearner;
    }

    /**
     * @param analysis     the analysis proposing the setup
     * @param history      the price window; the stale-move guard reads only its most recent
     *                     prices, the bounce guard all of it
     * @param currentSetup the most recent setup, or null if none
     * @param state        caller-held cooldown state
     * @param now          the snapshot time
     */
    public GateResult evaluate(
            Analysis analysis,
            MarketHistory history,
            TradeSetup currentSetup,
            LifecycleState state,
            LocalDateTime now) {
        List<GateViolation> violations = new ArrayList<>();

        violations.addAll(checkSession(currentSetup, now));
        violations.addAll(checkLearner(analysis));
        violations.addAll(checkCooldowns(state, now));

        Optional<TradeSetupCandidate> candidate = analysis.tradeSetup();
        if (candidate.isEmpty()) {
            violations.add(GateViolation.of(
                    NO_TRADE_CANDIDATE,
                    "No tradable strike for verdict '" + analysis.getVerdict().getLabel() + "'"));
        } else {
            violations.addAll(checkCandidate(analysis, candidate.get(), history, state, now));
        }

        if (violations.isEmpty()) {
            return GateResult.approved();
        }
        return GateResult.rejected(violations);
    }

    /**
     * Counts the independent signals agreeing with the trade: OI confirmed by price, regime
     * aligned, premium momentum aligned (|score| above 10), IV skew aligned.
     */
    public int countConfirmations(Analysis analysis, TradeDirection direction) {
        int count = 0;
        if (analysis.getConfirmationStatus() == ConfirmationStatus.CONFIRMED) {
            count++;
        }
        if (isRegimeAligned(analysis, direction)) {
            count++;
        }
        if (analysis.getPremiumMomentum() != null) {
            double pm = analysis.getPremiumMomentum().getScore();
            double threshold = lifecycleConfig.getPremiumConfirmationScore();
            if (direction == TradeDirection.BUY_CALL ? pm > threshold : pm < -threshold) {
                count++;
            }
        }
        if (analysis.ivSkew()
                .map(skew -> skew.getDirection() == direction.getSentiment())
                .orElse(false)) {
            count++;
        }
        return count;
    }

    // ========================
    // Session
    // ========================

    private List<GateViolation> checkSession(TradeSetup currentSetup, LocalDateTime now) {
        List<GateViolation> violations = new ArrayList<>();

        LocalTime time = now.toLocalTime();
        if (time.isBefore(lifecycleConfig.getTradingStart()) || time.isAfter(lifecycleConfig.getTradingEnd())) {
            violations.add(GateViolation.of(
                    OUTSIDE_TRADING_WINDOW,
                    String.format(
                            "%s is outside %s-%s",
                            time, lifecycleConfig.getTradingStart(), lifecycleConfig.getTradingEnd())));
        }

        if (currentSetup != null && !currentSetup.isTerminal()) {
            violations.add(GateViolation.of(
                    ACTIVE_SETUP_EXISTS,
                    "Setup " + currentSetup.getId() + " is still " + currentSetup.getStatus()));
        }
        return violations;
    }

    // ========================
    // Learner
    // ========================

    private List<GateViolation> checkLearner(Analysis analysis) {
        LearnerDecision decision = signalLearner.shouldTrade(analysis.getConfidence(), analysis.getVerdict());
        if (decision.answer()) {
            return List.of();
        }
        if (decision.block() == null) {
            return List.of(GateViolation.of(LEARNER_REJECTED, decision.reason()));
        }
        String code = switch (decision.block()) {
            case PAUSED -> LEARNER_PAUSED;
            case CONFIDENCE_OUT_OF_BAND -> CONFIDENCE_OUT_OF_BAND;
            case CONFIDENCE_EXCLUDED -> CONFIDENCE_EXCLUDED;
            case VERDICT_SKIPPED -> VERDICT_UNDERPERFORMING;
        };
        return List.of(GateViolation.of(code, decision.reason()));
    }

    // ========================
    // Cooldowns
    // ========================

    private List<GateViolation> checkCooldowns(LifecycleState state, LocalDateTime now) {
        List<GateViolation> violations = new ArrayList<>();

        Integer cycles = state.getCyclesSinceResolution();
        int requiredCycles = lifecycleConfig.getResolutionCooldownCycles();
        if (cycles != null && cycles < requiredCycles) {
            violations.add(GateViolation.of(
                    RESOLUTION_COOLDOWN,
                    String.format("%d of %d cycles since last resolution", cycles, requiredCycles)));
        }

        LocalDateTime cancelledAt = state.getLastCancelledAt();
        if (cancelledAt != null && now.isBefore(cancelledAt.plus(lifecycleConfig.getCancellationCooldown()))) {
            violations.add(GateViolation.of(
                    CANCELLATION_COOLDOWN,
                    "Last setup cancelled at " + cancelledAt + ", cooldown "
                            + lifecycleConfig.getCancellationCooldown().toMinutes() + " min"));
        }
        return violations;
    }

    // ========================
    // Candidate and signal quality
    // ========================

    private List<GateViolation> checkCandidate(
            Analysis analysis,
            TradeSetupCandidate candidate,
            MarketHistory history,
            LifecycleState state,
            LocalDateTime now) {
        List<GateViolation> violations = new ArrayList<>();
        TradeDirection direction = candidate.getDirection();

        TradeDirection lastDirection = state.getLastSuggestedDirection();
        LocalDateTime lastSuggestionAt = state.getLastSuggestionAt();
        if (lastDirection != null
                && lastDirection != direction
                && lastSuggestionAt != null
                && now.isBefore(lastSuggestionAt.plus(lifecycleConfig.getDirectionFlipCooldown()))) {
            violations.add(GateViolation.of(
                    DIRECTION_FLIP_COOLDOWN,
                    "Direction flipped from " + lastDirection + " to " + direction + " within "
                            + lifecycleConfig.getDirectionFlipCooldown().toMinutes() + " min"));
        }

        violations.addAll(checkPriceGuards(analysis, direction, history));

        MarketRegimeType regime = analysis.getMarketRegime().getRegime();
        if (regime == MarketRegimeType.RANGE_BOUND) {
            if (candidate.getMoneyness() == Moneyness.OTM) {
                violations.add(GateViolation.of(RANGE_BOUND_OTM, "OTM entries are not taken in a range-bound market"));
            }
            if (candidate.getRiskPct().compareTo(lifecycleConfig.getRangeBoundMaxSlPct()) > 0) {
                violations.add(GateViolation.of(
                        RANGE_BOUND_WIDE_STOP,
                        "Stop loss " + candidate.getRiskPct() + "% exceeds "
                                + lifecycleConfig.getRangeBoundMaxSlPct() + "% in a range-bound market"));
            }
        }

        if (!isRegimeAligned(analysis, direction)) {
            violations.add(GateViolation.of(
                    REGIME_MISALIGNED, direction + " not aligned with " + regime.getLabel() + " regime"));
        }

        ConfirmationStatus status = analysis.getConfirmationStatus();
        if (status != ConfirmationStatus.CONFIRMED && status != ConfirmationStatus.REVERSAL_ALERT) {
            violations.add(GateViolation.of(UNCONFIRMED_SIGNAL, "Confirmation status is " + status));
        }

        int confirmations = countConfirmations(analysis, direction);
        if (confirmations < lifecycleConfig.getRequiredConfirmations()) {
            violations.add(GateViolation.of(
                    INSUFFICIENT_CONFIRMATIONS,
                    String.format(
                            "%d of 4 confirmations, need %d", confirmations, lifecycleConfig.getRequiredConfirmations())));
        }
        return violations;
    }

    private List<GateViolation> checkPriceGuards(Analysis analysis, TradeDirection direction, MarketHistory history) {
        List<GateViolation> violations = new ArrayList<>();
        double spot = analysis.getSpotPrice().doubleValue();
        int lookback = lifecycleConfig.getStaleMoveLookback();
        BigDecimal reference = history != null ? history.priceBack(lookback) : null;

        if (reference != null && reference.signum() > 0) {
            double movePct = ScoreMath.pctChange(reference.doubleValue(), spot);
            double staleMove = lifecycleConfig.getStaleMovePct();
            boolean alreadyMoved = direction == TradeDirection.BUY_CALL ? movePct > staleMove : movePct < -staleMove;
            if (alreadyMoved) {
                violations.add(GateViolation.of(
                        MOVE_ALREADY_HAPPENED,
                        String.format("Underlying already moved %.2f%% over the last %d prices", movePct, lookback)));
            }
        }

        if (direction == TradeDirection.BUY_PUT && history != null) {
            double low = history.getRecentPrices().stream()
                    .filter(price -> price != null && price.signum() > 0)
                    .mapToDouble(BigDecimal::doubleValue)
                    .min()
                    .orElse(spot);
            low = Math.min(low, spot);
            double bouncePct = ScoreMath.pctChange(low, spot);
            if (bouncePct > lifecycleConfig.getBounceThresholdPct()) {
                violations.add(GateViolation.of(
                        BOUNCE_IN_PROGRESS,
                        String.format("Price bounced %.2f%% off the window low %.2f", bouncePct, low)));
            }
        }
        return violations;
    }

    private static boolean isRegimeAligned(Analysis analysis, TradeDirection direction) {
        if (analysis.getMarketRegime() == null) {
            return false;
        }
        MarketRegimeType regime = analysis.getMarketRegime().getRegime();
        return direction == TradeDirection.BUY_CALL
                ? regime == MarketRegimeType.TRENDING_UP
                : regime == MarketRegimeType.TRENDING_DOWN;
    }
}
