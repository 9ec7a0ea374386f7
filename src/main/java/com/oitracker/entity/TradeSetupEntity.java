package com.oitracker.entity;

import com.oitracker.domain.enums.Moneyness;
import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.TradeDirection;
import com.oitracker.domain.enums.TradeSetupStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_setups table.
 * One row per proposed setup, updated in place as it moves through its lifecycle.
 * Schema is created by db/schema-v1.sql at startup.
 */
@Entity
@Table(name = "trade_setups")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeSetupEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeDirection direction;

    private int strike;

    @Enumerated(EnumType.STRING)
    @Column(name = "option_side", columnDefinition = "varchar(2)")
    private OptionSide optionSide;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(3)")
    private Moneyness moneyness;

    @Column(name = "entry_premium", precision = 15, scale = 2)
    private BigDecimal entryPremium;

    @Column(name = "sl_premium", precision = 15, scale = 2)
    private BigDecimal slPremium;

    @Column(name = "target1_premium", precision = 15, scale = 2)
    private BigDecimal target1Premium;

    @Column(name = "target2_premium", precision = 15, scale = 2)
    private BigDecimal target2Premium;

    @Column(name = "risk_pct", precision = 7, scale = 2)
    private BigDecimal riskPct;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeSetupStatus status;

    // Context at creation

    @Column(name = "spot_at_creation", precision = 15, scale = 2)
    private BigDecimal spotAtCreation;

    @Column(name = "verdict_at_creation", length = 40)
    private String verdictAtCreation;

    @Column(name = "confidence_at_creation", precision = 5, scale = 1)
    private BigDecimal confidenceAtCreation;

    @Column(name = "iv_at_creation", precision = 7, scale = 2)
    private BigDecimal ivAtCreation;

    @Column(length = 20)
    private String expiry;

    @Column(name = "call_oi_change_at_creation")
    private long callOiChangeAtCreation;

    @Column(name = "put_oi_change_at_creation")
    private long putOiChangeAtCreation;

    @Column(name = "pcr_at_creation", precision = 7, scale = 2)
    private BigDecimal pcrAtCreation;

    @Column(name = "max_pain_at_creation")
    private Integer maxPainAtCreation;

    @Column(name = "support_at_creation")
    private Integer supportAtCreation;

    @Column(name = "resistance_at_creation")
    private Integer resistanceAtCreation;

    @Column(name = "quality_score")
    private int qualityScore;

    @Column(name = "trade_reasoning", columnDefinition = "TEXT")
    private String tradeReasoning;

    /** Confidence components at creation, as a JSON object of name to points. */
    @Column(name = "confidence_breakdown", columnDefinition = "TEXT")
    private String confidenceBreakdownJson;

    // Lifecycle

    @Column(name = "activated_at")
    private LocalDateTime activatedAt;

    @Column(name = "activation_premium", precision = 15, scale = 2)
    private BigDecimal activationPremium;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "exit_premium", precision = 15, scale = 2)
    private BigDecimal exitPremium;

    @Column(name = "hit_sl")
    private boolean hitSl;

    @Column(name = "hit_target")
    private boolean hitTarget;

    @Column(name = "profit_loss_pct", precision = 9, scale = 2)
    private BigDecimal profitLossPct;

    @Column(name = "profit_loss_points", precision = 15, scale = 2)
    private BigDecimal profitLossPoints;

    @Column(name = "max_premium_reached", precision = 15, scale = 2)
    private BigDecimal maxPremiumReached;

    @Column(name = "min_premium_reached", precision = 15, scale = 2)
    private BigDecimal minPremiumReached;

    @Column(name = "last_checked_at")
    private LocalDateTime lastCheckedAt;

    @Column(name = "last_premium", precision = 15, scale = 2)
    private BigDecimal lastPremium;
}
