package com.oitracker.analysis;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables of the tug-of-war scoring engine.
 *
 * <p>Reads from application.yml under {@code oi-tracker.analysis}. Every default matches
 * the production behaviour; override only for backtests or experiments.
 *
 * <pre>
 * oi-tracker.analysis.zone-width=3
 * oi-tracker.analysis.total-oi-weight=0.15
 * oi-tracker.analysis.legacy-zone-weight=0.7
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "oi-tracker.analysis")
public class AnalysisConfig {

    // ==================== Zones and force ====================

    /** Strikes per side of ATM that form each zone. */
    private int zoneWidth = 3;

    /** Weight of scaled total OI against OI change inside the force formula. */
    private double totalOiWeight = 0.15;

    /** |OI change| below this is treated as noise (conviction 0.5). */
    private long noiseOiChange = 100;

    private double freshTurnover = 0.5;
    private double normalTurnover = 0.2;
    private double freshConviction = 1.5;
    private double normalConviction = 1.0;
    private double staleConviction = 0.5;

    // ==================== Strength and combining ====================

    private double strengthRatioScale = 50.0;

    /** |net strength| above this sets a BULLISH/BEARISH strength direction. */
    private double strengthDirectionThreshold = 15.0;

    /** Share of the legacy below/above-spot score in the zone average; the rest is net strength. */
    private double legacyZoneWeight = 0.7;

    private double momentumMultiplier = 20.0;

    /** Price moves smaller than this (percent) count as flat. */
    private double priceFlatThresholdPct = 0.05;

    /** Momentum weight when OI and price diverge. */
    private double divergenceMomentumWeight = 0.45;

    /** Momentum weight when OI and price agree. */
    private double normalMomentumWeight = 0.20;

    // ==================== Regime ====================

    private double regimeProximityPct = 0.1;
    private double regimeMomentumThreshold = 25.0;
    private double regimeMinRangePct = 0.2;

    // ==================== OI acceleration ====================

    private double unwindingMomentumThreshold = 15.0;
    private double unwindingAdjustment = 15.0;
    private double accumulationAdjustment = 10.0;

    /** Net acceleration counts as strong above this fraction of prior-window activity. */
    private double strongAccelerationRatio = 0.2;

    // ==================== Premium momentum ====================

    private double premiumMomentumMultiplier = 5.0;

    /** |combined score| beyond which a contradicting premium move is considered. */
    private double premiumContradictionScore = 10.0;

    /** |premium momentum| beyond which it contradicts the OI read. */
    private double premiumContradictionMomentum = 20.0;

    private double premiumAdjustmentFactor = 0.3;

    // ==================== Verdict ====================

    private double strongThreshold = 40.0;
    private double moderateThreshold = 15.0;

    // ==================== Levels and warnings ====================

    private double clusterPercentile = 75.0;
    private int clusterSize = 5;
    private double trapProximityPct = 1.0;

    /** |IV skew| (vol points) inside this band has no direction. */
    private double ivSkewNeutralBand = 1.0;

    /** |premium momentum| needed to turn an OI/price disagreement into a REVERSAL_ALERT. */
    private double reversalPremiumThreshold = 10.0;
}
