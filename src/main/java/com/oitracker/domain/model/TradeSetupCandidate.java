package com.oitracker.domain.model;

import com.oitracker.domain.enums.Moneyness;
import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.TradeDirection;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * A proposed option trade derived from one analysis, before the lifecycle manager
 * decides whether to accept it.
 *
 * <p>Targets are symmetric in risk: target1 = entry + risk (1:1), target2 = entry + 2 x risk
 * (1:2), where risk = entry - stop loss.
 */
@Data
@Builder
public class TradeSetupCandidate {

    private TradeDirection direction;
    private int strike;
    private OptionSide optionSide;
    private Moneyness moneyness;

    private BigDecimal entryPremium;
    private BigDecimal slPremium;
    private BigDecimal target1Premium;
    private BigDecimal target2Premium;

    /** Stop-loss distance as a percentage of entry. */
    private BigDecimal riskPct;

    /** IV of the selected option; zero when the venue did not publish one. */
    private BigDecimal ivAtStrike;

    private BigDecimal spotPrice;

    /** Strongest support / resistance at proposal time, for reference only. May be null. */
    private Integer supportRef;

    private Integer resistanceRef;
}
