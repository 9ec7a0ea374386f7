package com.oitracker.lifecycle;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Creation-gate and lifecycle constants, read from {@code oi-tracker.lifecycle}.
 *
 * <p>The activation band and the cooldowns were tuned empirically on live sessions. They
 * are kept overridable so a backtest can sweep them.
 *
 * <pre>
 * oi-tracker.lifecycle.trading-start=09:30
 * oi-tracker.lifecycle.cancellation-cooldown=30m
 * oi-tracker.lifecycle.max-chase-pct=10
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "oi-tracker.lifecycle")
public class LifecycleConfig {

    // ==================== Session times ====================

    /** New setups are only proposed between tradingStart and tradingEnd (inclusive). */
    private LocalTime tradingStart = LocalTime.of(9, 30);

    private LocalTime tradingEnd = LocalTime.of(15, 15);

    /** ACTIVE setups are closed at market price from this time on. */
    private LocalTime forceCloseTime = LocalTime.of(15, 20);

    /** PENDING setups that never activated expire from this time on. */
    private LocalTime pendingExpiryTime = LocalTime.of(15, 25);

    // ==================== Activation ====================

    /** Premium within entry + 2% counts as a fill at entry. */
    private BigDecimal entryTolerancePct = BigDecimal.valueOf(2);

    /** Premium up to entry + 10% is still accepted; beyond it the setup keeps waiting. */
    private BigDecimal maxChasePct = BigDecimal.valueOf(10);

    // ==================== Cooldowns ====================

    /** Ticks to wait after a setup resolves before proposing the next one. */
    private int resolutionCooldownCycles = 12;

    private Duration cancellationCooldown = Duration.ofMinutes(30);

    /** Applies only when the new setup's direction differs from the last proposed one. */
    private Duration directionFlipCooldown = Duration.ofMinutes(15);

    // ==================== Entry guards ====================

    /** Skip a signal once the underlying already moved this far (%) its way over the lookback. */
    private double staleMovePct = 0.8;

    /**
     * Recent prices the stale-move guard looks back over. Must stay shorter than the regime
     * window, whose trend test needs more than 1.25% from the window's oldest price.
     */
    private int staleMoveLookback = 3;

    /** Skip a PUT once price bounced this far (%) off the window low. */
    private double bounceThresholdPct = 0.3;

    /** Independent confirmations (out of four) a signal needs. */
    private int requiredConfirmations = 3;

    /** Premium momentum score counting as a confirmation in the trade's direction. */
    private double premiumConfirmationScore = 10.0;

    /** Widest stop loss (%) accepted in a range-bound market. */
    private BigDecimal rangeBoundMaxSlPct = BigDecimal.valueOf(15);
}
