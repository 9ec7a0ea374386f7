package com.oitracker.domain.model;

import com.oitracker.domain.enums.ConfirmationStatus;
import com.oitracker.domain.enums.SentimentDirection;
import com.oitracker.domain.enums.SignalStrength;
import com.oitracker.domain.enums.Verdict;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * The engine's full output for one snapshot.
 *
 * <p>An analysis is derived from exactly one {@link Snapshot} plus the caller's short
 * {@link MarketHistory}, and is never modified after the engine builds it.
 *
 * <p>Optional sub-results (max pain, IV skew, trap warning, trade setup candidate) are
 * absent rather than zero-filled when the data did not support computing them; use the
 * {@code Optional} accessors to tell "no signal" apart from a real value.
 */
@Getter
@Builder
@ToString
public class Analysis {

    private final LocalDateTime timestamp;
    private final BigDecimal spotPrice;
    private final String expiry;
    private final int atmStrike;

    /** Final combined score, clamped to -100..100. */
    private final double combinedScore;

    private final Verdict verdict;

    /** Confidence 0..100 in the verdict. */
    private final double confidence;

    private final ConfidenceScore confidenceBreakdown;

    private final ZoneBreakdown zoneBreakdown;
    private final StrengthScores strength;
    private final MarketRegime marketRegime;
    private final OiAcceleration oiAcceleration;
    private final PremiumMomentum premiumMomentum;
    private final OiClusters oiClusters;
    private final ConfirmationStatus confirmationStatus;

    /** Zone call OI-change total (OTM and ITM call zones). */
    private final long callOiChange;

    /** Zone put OI-change total (OTM and ITM put zones). */
    private final long putOiChange;

    /** Zone put OI / zone call OI; zero when there is no call OI. */
    private final double pcr;

    /** Zone put volume / zone call volume; zero when there is no call volume. */
    private final double volumePcr;

    private final Integer maxPain;
    private final IvSkew ivSkew;
    private final TrapWarning trapWarning;
    private final TradeSetupCandidate tradeSetup;

    public SignalStrength getSignalStrength() {
        return verdict.getStrength();
    }

    public SentimentDirection getDirection() {
        return verdict.getDirection();
    }

    public Optional<Integer> maxPain() {
        return Optional.ofNullable(maxPain);
    }

    public Optional<IvSkew> ivSkew() {
        return Optional.ofNullable(ivSkew);
    }

    public Optional<TrapWarning> trapWarning() {
        return Optional.ofNullable(trapWarning);
    }

    public Optional<TradeSetupCandidate> tradeSetup() {
        return Optional.ofNullable(tradeSetup);
    }
}
