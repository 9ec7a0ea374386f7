package com.oitracker.core.engine;

import com.oitracker.analysis.ConfidenceScorer;
import com.oitracker.analysis.ConfirmationEvaluator;
import com.oitracker.analysis.ForceCalculator;
import com.oitracker.analysis.IvSkewCalculator;
import com.oitracker.analysis.MarketRegimeDetector;
import com.oitracker.analysis.MaxPainCalculator;
import com.oitracker.analysis.OiAccelerationAnalyzer;
import com.oitracker.analysis.OiClusterDetector;
import com.oitracker.analysis.PremiumMomentumAnalyzer;
import com.oitracker.analysis.ScoreMath;
import com.oitracker.analysis.StrengthAggregator;
import com.oitracker.analysis.TrapDetector;
import com.oitracker.analysis.VerdictClassifier;
import com.oitracker.analysis.ZonePartitioner;
import com.oitracker.domain.enums.ConfirmationStatus;
import com.oitracker.domain.enums.Verdict;
import com.oitracker.domain.enums.ZoneType;
import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.ConfidenceInputs;
import com.oitracker.domain.model.ConfidenceScore;
import com.oitracker.domain.model.IvSkew;
import com.oitracker.domain.model.MarketHistory;
import com.oitracker.domain.model.MarketRegime;
import com.oitracker.domain.model.OiAcceleration;
import com.oitracker.domain.model.OiClusters;
import com.oitracker.domain.model.PremiumMomentum;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrengthScores;
import com.oitracker.domain.model.TradeSetupCandidate;
import com.oitracker.domain.model.TrapWarning;
import com.oitracker.domain.model.ZoneBreakdown;
import com.oitracker.setup.TradeSetupBuilder;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tug-of-war scoring engine: converts one snapshot plus its short history into an
 * {@link Analysis}.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Zone partitioning around ATM and per-strike forces</li>
 *   <li>Strength ratios and legacy zone scores, blended into the zone average</li>
 *   <li>Momentum/divergence weighting into the combined score</li>
 *   <li>OI-acceleration and premium-momentum adjustments, clamp, verdict</li>
 *   <li>Diagnostics: max pain, OI clusters, IV skew, confirmation, PCR</li>
 *   <li>Confidence, trap detection, trade setup candidate</li>
 * </ol>
 *
 * <p>Stateless: everything that crosses ticks arrives in {@link MarketHistory}. Sparse or
 * degenerate data produces neutral values, never NaN or an exception. An empty chain is
 * analysed as Neutral.
 */
@Service
public class TugOfWarEngine {

    private static final Logger log = LoggerFactory.getLogger(TugOfWarEngine.class);

    private final ZonePartitioner zonePartitioner;
    private final ForceCalculator forceCalculator;
    private final StrengthAggregator strengthAggregator;
    private final MarketRegimeDetector marketRegimeDetector;
    private final OiAccelerationAnalyzer oiAccelerationAnalyzer;
    private final PremiumMomentumAnalyzer premiumMomentumAnalyzer;
    private final VerdictClassifier verdictClassifier;
    private final MaxPainCalculator maxPainCalculator;
    private final OiClusterDetector oiClusterDetector;
    private final IvSkewCalculator ivSkewCalculator;
    private final ConfirmationEvaluator confirmationEvaluator;
    private final ConfidenceScorer confidenceScorer;
    private final TrapDetector trapDetector;
    private final TradeSetupBuilder tradeSetupBuilder;

    public TugOfWarEngine(
            ZonePartitioner zonePartitioner,
            ForceCalculator forceCalculator,
            StrengthAggregator strengthAggregator,
            MarketRegimeDetector marketRegimeDetector,
            OiAccelerationAnalyzer oiAccelerationAnalyzer,
            PremiumMomentumAnalyzer premiumMomentumAnalyzer,
            VerdictClassifier verdictClassifier,
            MaxPainCalculator maxPainCalculator,
            OiClusterDetector oiClusterDetector,
            IvSkewCalculator ivSkewCalculator,
            ConfirmationEvaluator confirmationEvaluator,
            ConfidenceScorer confidenceScorer,
            TrapDetector trapDetector,
            TradeSetupBuilder tradeSetupBuilder) {
        this.zonePartitioner = zonePartitioner;
        this.forceCalculator = forceCalculator;
        this.strengthAggregator = strengthAggregator;
        this.marketRegimeDetector = marketRegimeDetector;
        this.oiAccelerationAnalyzer = oiAccelerationAnalyzer;
        this.premiumMomentumAnalyzer = premiumMomentumAnalyzer;
        this.verdictClassifier = verdictClassifier;
        this.maxPainCalculator = maxPainCalculator;
        this.oiClusterDetector = oiClusterDetector;
        this.ivSkewCalculator = ivSkewCalculator;
        this.confirmationEvaluator = confirmationEvaluator;
        this.confidenceScorer = confidenceScorer;
        this.trapDetector = trapDetector;
        this.tradeSetupBuilder = tradeSetupBuilder;
    }

    public Analysis analyze(Snapshot snapshot, MarketHistory history) {
        MarketHistory safeHistory = history != null ? history : MarketHistory.empty();
        double spot = snapshot.spot();

        // 1. Zones and forces
        ZoneBreakdown breakdown = forceCalculator.applyForces(snapshot, zonePartitioner.partition(snapshot));
        int atm = breakdown.getAtmStrike();

        // 2. Strength and momentum
        MarketRegime regime = marketRegimeDetector.detect(spot, safeHistory);
        StrengthScores strength = strengthAggregator.strength(snapshot, breakdown);

        double combinedScore;
        OiAcceleration acceleration;
        PremiumMomentum premiumMomentum;
        if (snapshot.isEmpty()) {
            combinedScore = 0.0;
            acceleration = oiAccelerationAnalyzer.analyze(breakdown, null, regime.getMomentum());
            premiumMomentum = PremiumMomentum.none(atm);
        } else {
            StrengthAggregator.Combination combination =
                    strengthAggregator.combine(strength.getZoneAverage(), regime);

            // 3. Adjustments
            acceleration = oiAccelerationAnalyzer.analyze(
                    breakdown, safeHistory.getPriorOiChanges(), regime.getMomentum());
            double adjusted = combination.score() + acceleration.getAdjustment();

            premiumMomentum =
                    premiumMomentumAnalyzer.analyze(snapshot, atm, safeHistory.getPreviousStrikes(), adjusted);
            combinedScore = ScoreMath.clampScore(adjusted + premiumMomentum.getAdjustment());
        }
        Verdict verdict = verdictClassifier.classify(combinedScore);

        // 4. Diagnostics
        Optional<Integer> maxPain = maxPainCalculator.calculate(snapshot);
        OiClusters clusters = oiClusterDetector.detect(snapshot);
        Optional<IvSkew> ivSkew = ivSkewCalculator.calculate(snapshot, breakdown);
        ConfirmationStatus confirmation = confirmationEvaluator.evaluate(
                verdict.getDirection(), regime.getPriceDirection(), premiumMomentum.getScore());

        long callOiChange = breakdown.totalOiChange(ZoneType.ITM_CALL, ZoneType.OTM_CALL);
        long putOiChange = breakdown.totalOiChange(ZoneType.OTM_PUT, ZoneType.ITM_PUT);
        double pcr = ScoreMath.safeDivide(
                breakdown.totalOi(ZoneType.OTM_PUT, ZoneType.ITM_PUT),
                breakdown.totalOi(ZoneType.ITM_CALL, ZoneType.OTM_CALL),
                0.0);
        double volumePcr = ScoreMath.safeDivide(
                breakdown.totalVolume(ZoneType.OTM_PUT, ZoneType.ITM_PUT),
                breakdown.totalVolume(ZoneType.ITM_CALL, ZoneType.OTM_CALL),
                0.0);

        // 5. Confidence, trap, candidate
        ConfidenceScore confidence = confidenceScorer.score(ConfidenceInputs.builder()
                .combinedScore(combinedScore)
                .signalDirection(verdict.getDirection())
                .ivSkewDirection(ivSkew.map(IvSkew::getDirection).orElse(null))
                .volumePcr(volumePcr)
                .spotPrice(spot)
                .maxPain(maxPain.orElse(null))
                .confirmationStatus(confirmation)
                .vix(safeHistory.getVix() != null ? safeHistory.getVix().doubleValue() : 0.0)
                .futuresOiChange(safeHistory.getFuturesOiChange())
                .priceDirection(regime.getPriceDirection())
                .build());

        Optional<TrapWarning> trap = trapDetector.detect(regime.getPriceDirection(), verdict, clusters, spot);
        Optional<TradeSetupCandidate> candidate = tradeSetupBuilder.build(verdict, snapshot, atm, clusters);

        Analysis analysis = Analysis.builder()
                .timestamp(snapshot.getTimestamp())
                .spotPrice(snapshot.getSpotPrice())
                .expiry(snapshot.getExpiry())
                .atmStrike(atm)
                .combinedScore(combinedScore)
                .verdict(verdict)
                .confidence(confidence.getScore())
                .confidenceBreakdown(confidence)
                .zoneBreakdown(breakdown)
                .strength(strength)
                .marketRegime(regime)
                .oiAcceleration(acceleration)
                .premiumMomentum(premiumMomentum)
                .oiClusters(clusters)
                .confirmationStatus(confirmation)
                .callOiChange(callOiChange)
                .putOiChange(putOiChange)
                .pcr(pcr)
                .volumePcr(volumePcr)
                .maxPain(maxPain.orElse(null))
                .ivSkew(ivSkew.orElse(null))
                .trapWarning(trap.orElse(null))
                .tradeSetup(candidate.orElse(null))
                .build();

        log.debug(
                "Analysis {}: spot={} atm={} score={} verdict={} confidence={} regime={}",
                snapshot.getTimestamp(),
                snapshot.getSpotPrice(),
                atm,
                String.format("%.2f", combinedScore),
                verdict.getLabel(),
                String.format("%.0f", confidence.getScore()),
                regime.getRegime());
        trap.ifPresent(warning -> log.info("Trap warning: {}", warning.getMessage()));
        return analysis;
    }
}
