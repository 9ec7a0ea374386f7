package com.oitracker.setup;

import com.oitracker.domain.enums.Moneyness;
import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.TradeDirection;
import com.oitracker.domain.enums.Verdict;
import com.oitracker.domain.model.OiClusters;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeMetrics;
import com.oitracker.domain.model.TradeSetupCandidate;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a directional verdict into a concrete option trade.
 *
 * <p>Strike preference is ITM, then ATM, then OTM: the first candidate with a positive
 * last traded price wins. For calls the ITM strike is the nearest strike below ATM and
 * the OTM strike the nearest above; puts are mirrored.
 *
 * <p>Stop loss is a percentage of entry chosen by the option's IV (wider stops for more
 * volatile options). Targets sit at 1x and 2x the risk above entry.
 */
@Component
public class TradeSetupBuilder {

    private static final Logger log = LoggerFactory.getLogger(TradeSetupBuilder.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal DEFAULT_SL_PCT = BigDecimal.valueOf(20);

    /**
     * Builds a candidate, or empty when the verdict is Neutral or no candidate strike has a
     * usable price.
     */
    public Optional<TradeSetupCandidate> build(Verdict verdict, Snapshot snapshot, int atmStrike, OiClusters clusters) {
        if (verdict == null || verdict.getDirection().sign() == 0 || snapshot.isEmpty()) {
            return Optional.empty();
        }

        TradeDirection direction = verdict.isBullish() ? TradeDirection.BUY_CALL : TradeDirection.BUY_PUT;
        OptionSide side = direction.getOptionSide();

        for (StrikeChoice choice : candidates(snapshot, atmStrike, direction)) {
            StrikeMetrics metrics = snapshot.get(choice.strike());
            if (metrics == null || !metrics.hasPrice(side)) {
                continue;
            }
            TradeSetupCandidate candidate = price(direction, choice, metrics, snapshot, clusters);
            log.debug(
                    "Trade candidate {} {} {} ({}) entry={} sl={} t1={}",
                    direction,
                    candidate.getStrike(),
                    side,
                    choice.moneyness(),
                    candidate.getEntryPremium(),
                    candidate.getSlPremium(),
                    candidate.getTarget1Premium());
            return Optional.of(candidate);
        }

        log.debug("No {} candidate with a usable premium around ATM {}", direction, atmStrike);
        return Optional.empty();
    }

    /** Stop-loss percentage for an option IV in percent; 20 when IV is unknown. */
    public static BigDecimal stopLossPct(BigDecimal iv) {
        if (iv == null || iv.signum() <= 0) {
            return DEFAULT_SL_PCT;
        }
        double value = iv.doubleValue();
        if (value < 12) {
            return BigDecimal.valueOf(15);
        } else if (value < 15) {
            return BigDecimal.valueOf(18);
        } else if (value < 18) {
            return BigDecimal.valueOf(20);
        } else if (value < 22) {
            return BigDecimal.valueOf(22);
        }
        return BigDecimal.valueOf(25);
    }

    private List<StrikeChoice> candidates(Snapshot snapshot, int atmStrike, TradeDirection direction) {
        Integer below = snapshot.getStrikes().lowerKey(atmStrike);
        Integer above = snapshot.getStrikes().higherKey(atmStrike);
        Integer itm = direction == TradeDirection.BUY_CALL ? below : above;
        Integer otm = direction == TradeDirection.BUY_CALL ? above : below;

        List<StrikeChoice> choices = new ArrayList<>(3);
        if (itm != null) {
            choices.add(new StrikeChoice(itm, Moneyness.ITM));
        }
        choices.add(new StrikeChoice(atmStrike, Moneyness.ATM));
        if (otm != null) {
            choices.add(new StrikeChoice(otm, Moneyness.OTM));
        }
        return choices;
    }

    private TradeSetupCandidate price(
            TradeDirection direction,
            StrikeChoice choice,
            StrikeMetrics metrics,
            Snapshot snapshot,
            OiClusters clusters) {
        OptionSide side = direction.getOptionSide();
        BigDecimal entry = metrics.ltp(side).setScale(2, RoundingMode.HALF_UP);
        BigDecimal iv = metrics.iv(side);
        BigDecimal slPct = stopLossPct(iv);

        BigDecimal risk = entry.multiply(slPct).divide(HUNDRED, 4, RoundingMode.HALF_UP);
        BigDecimal sl = entry.subtract(risk).setScale(2, RoundingMode.HALF_UP);
        BigDecimal target1 = entry.add(risk).setScale(2, RoundingMode.HALF_UP);
        BigDecimal target2 = entry.add(risk.multiply(BigDecimal.valueOf(2))).setScale(2, RoundingMode.HALF_UP);

        return TradeSetupCandidate.builder()
                .direction(direction)
                .strike(choice.strike())
                .optionSide(side)
                .moneyness(choice.moneyness())
                .entryPremium(entry)
                .slPremium(sl)
                .target1Premium(target1)
                .target2Premium(target2)
                .riskPct(slPct.setScale(2, RoundingMode.HALF_UP))
                .ivAtStrike(iv)
                .spotPrice(snapshot.getSpotPrice())
                .supportRef(clusters != null ? clusters.getStrongestSupport() : null)
                .resistanceRef(clusters != null ? clusters.getStrongestResistance() : null)
                .build();
    }

    private record StrikeChoice(int strike, Moneyness moneyness) {}
}
