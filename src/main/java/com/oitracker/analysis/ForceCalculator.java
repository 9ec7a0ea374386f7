package com.oitracker.analysis;

import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.ZoneType;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeForce;
import com.oitracker.domain.model.StrikeMetrics;
import com.oitracker.domain.model.ZoneBreakdown;
import com.oitracker.domain.model.ZoneSummary;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns a strike's raw OI metrics into a single directional force.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>turnover = volume / max(1, |OI change|)</li>
 *   <li>conviction = 0.5 if |OI change| &lt; 100 (noise); else 1.5 if turnover &gt; 0.5 (fresh),
 *       1.0 if turnover &gt; 0.2, otherwise 0.5 (stale)</li>
 *   <li>force = conviction * ((1 - w) * OI change + w * (total OI / scale))</li>
 *   <li>scale = avg(total OI) / avg(|OI change|) across every strike-side in the four zones,
 *       1 when either average is zero</li>
 * </ul>
 *
 * <p>The scale puts total OI on the same order of magnitude as OI change, so the small
 * weight {@code w} really is a small share of the force instead of dominating it.
 */
@Component
public class ForceCalculator {

    private final AnalysisConfig analysisConfig;

    public ForceCalculator(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    public double conviction(long volume, long oiChange) {
        long magnitude = Math.abs(oiChange);
        if (magnitude < analysisConfig.getNoiseOiChange()) {
            return analysisConfig.getStaleConviction();
        }
        double turnover = (double) volume / Math.max(1L, magnitude);
        if (turnover > analysisConfig.getFreshTurnover()) {
            return analysisConfig.getFreshConviction();
        }
        if (turnover > analysisConfig.getNormalTurnover()) {
            return analysisConfig.getNormalConviction();
        }
        return analysisConfig.getStaleConviction();
    }

    public double force(long oi, long oiChange, long volume, double scale) {
        double w = analysisConfig.getTotalOiWeight();
        double safeScale = scale > 0 && Double.isFinite(scale) ? scale : 1.0;
        return conviction(volume, oiChange) * ((1.0 - w) * oiChange + w * (oi / safeScale));
    }

    /**
     * Fills in per-strike forces and zone totals. Returns a new breakdown; the input is not modified.
     */
    public ZoneBreakdown applyForces(Snapshot snapshot, ZoneBreakdown breakdown) {
        double scale = breakdown.isEmpty()
                ? atmScale(snapshot, breakdown.getAtmStrike())
                : zoneScale(snapshot, breakdown);

        Map<ZoneType, ZoneSummary> zones = new EnumMap<>(ZoneType.class);
        for (ZoneType type : ZoneType.values()) {
            ZoneSummary summary = breakdown.get(type);
            OptionSide side = type.getSide();

            List<StrikeForce> forces = new ArrayList<>();
            double totalForce = 0.0;
            for (int strike : summary.getStrikes()) {
                StrikeForce strikeForce = strikeForce(snapshot.get(strike), side, scale);
                forces.add(strikeForce);
                totalForce += strikeForce.getForce();
            }

            zones.put(
                    type,
                    ZoneSummary.builder()
                            .type(type)
                            .strikes(summary.getStrikes())
                            .forces(List.copyOf(forces))
                            .totalForce(totalForce)
                            .totalOi(summary.getTotalOi())
                            .totalOiChange(summary.getTotalOiChange())
                            .totalVolume(summary.getTotalVolume())
                            .build());
        }

        return ZoneBreakdown.builder()
                .atmStrike(breakdown.getAtmStrike())
                .zones(zones)
                .scale(scale)
                .build();
    }

    /**
     * Force of one side of the ATM strike. Used only when every zone is empty, so the
     * ATM strike is the only data the chain offers.
     */
    public double atmForce(Snapshot snapshot, int atmStrike, OptionSide side, double scale) {
        StrikeMetrics metrics = snapshot.get(atmStrike);
        if (metrics == null) {
            return 0.0;
        }
        return strikeForce(metrics, side, scale).getForce();
    }

    StrikeForce strikeForce(StrikeMetrics metrics, OptionSide side, double scale) {
        long oi = metrics.oi(side);
        long oiChange = metrics.oiChange(side);
        long volume = metrics.volume(side);
        return StrikeForce.builder()
                .strike(metrics.getStrike())
                .side(side)
                .oi(oi)
                .oiChange(oiChange)
                .volume(volume)
                .conviction(conviction(volume, oiChange))
                .force(force(oi, oiChange, volume, scale))
                .build();
    }

    private double zoneScale(Snapshot snapshot, ZoneBreakdown breakdown) {
        double oiSum = 0.0;
        double changeSum = 0.0;
        int count = 0;
        for (ZoneType type : ZoneType.values()) {
            OptionSide side = type.getSide();
            for (int strike : breakdown.get(type).getStrikes()) {
                StrikeMetrics metrics = snapshot.get(strike);
                oiSum += metrics.oi(side);
                changeSum += Math.abs(metrics.oiChange(side));
                count++;
            }
        }
        return scaleOf(oiSum, changeSum, count);
    }

    private double atmScale(Snapshot snapshot, int atmStrike) {
        StrikeMetrics metrics = snapshot.get(atmStrike);
        if (metrics == null) {
            return 1.0;
        }
        double oiSum = metrics.getCallOi() + metrics.getPutOi();
        double changeSum = Math.abs(metrics.getCallOiChange()) + Math.abs(metrics.getPutOiChange());
        return scaleOf(oiSum, changeSum, 2);
    }

    private static double scaleOf(double oiSum, double changeSum, int count) {
        if (count == 0) {
            return 1.0;
        }
        double avgOi = oiSum / count;
        double avgChange = changeSum / count;
        double scale = ScoreMath.safeDivide(avgOi, avgChange, 1.0);
        return scale > 0 ? scale : 1.0;
    }
}
