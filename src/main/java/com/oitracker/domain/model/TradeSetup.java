package com.oitracker.domain.model;

import com.oitracker.domain.enums.Moneyness;
import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.TradeDirection;
import com.oitracker.domain.enums.TradeSetupStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * A single proposed option trade and its lifecycle state.
 *
 * <p>Created PENDING from one {@link Analysis}. After creation only the lifecycle
 * manager mutates it: activation premium and time, running max/min premium, last
 * checked premium and time, and the resolution fields. P&L is always measured against
 * the activation premium, since activation itself can carry slippage from entry.
 *
 * <p>The "at most one non-terminal setup" rule is enforced by the lifecycle manager,
 * not by this class.
 */
@Data
@Builder
public class TradeSetup {

    private Long id;

    private LocalDateTime createdAt;

    private TradeDirection direction;
    private int strike;
    private OptionSide optionSide;
    private Moneyness moneyness;

    private BigDecimal entryPremium;
    private BigDecimal slPremium;
    private BigDecimal target1Premium;
    private BigDecimal target2Premium;
    private BigDecimal riskPct;

    private TradeSetupStatus status;

    // ==================== Context at creation ====================

    private BigDecimal spotAtCreation;
    private String verdictAtCreation;
    private BigDecimal confidenceAtCreation;
    private BigDecimal ivAtCreation;
    private String expiry;
    private long callOiChangeAtCreation;
    private long putOiChangeAtCreation;
    private BigDecimal pcrAtCreation;
    private Integer maxPainAtCreation;
    private Integer supportAtCreation;
    private Integer resistanceAtCreation;

    /** 0-9, see TradeQualityScorer. */
    private int qualityScore;

    private String tradeReasoning;

    /** Points each confidence component contributed at creation. */
    private Map<String, Double> confidenceBreakdown;

    // ==================== Lifecycle ====================

    private LocalDateTime activatedAt;
    private BigDecimal activationPremium;

    private LocalDateTime resolvedAt;
    private BigDecimal exitPremium;
    private boolean hitSl;
    private boolean hitTarget;
    private BigDecimal profitLossPct;
    private BigDecimal profitLossPoints;

    private BigDecimal maxPremiumReached;
    private BigDecimal minPremiumReached;
    private LocalDateTime lastCheckedAt;
    private BigDecimal lastPremium;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isPending() {
        return status == TradeSetupStatus.PENDING;
    }

    public boolean isActive() {
        return status == TradeSetupStatus.ACTIVE;
    }

    /** Reference price for P&L: activation premium, falling back to entry. */
    public BigDecimal getPnlBasis() {
        return activationPremium != null ? activationPremium : entryPremium;
    }
}
