package com.oitracker.analysis;

import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.SentimentDirection;
import com.oitracker.domain.enums.ZoneType;
import com.oitracker.domain.model.IvSkew;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeMetrics;
import com.oitracker.domain.model.ZoneBreakdown;
import java.util.Optional;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * IV skew between the OTM put zone and the OTM call zone.
 *
 * <p>Only strikes with a published IV count. Absent when either zone has none.
 * A skew inside the neutral band (+-1 vol point) carries no direction.
 */
@Component
public class IvSkewCalculator {

    private final AnalysisConfig analysisConfig;

    public IvSkewCalculator(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    public Optional<IvSkew> calculate(Snapshot snapshot, ZoneBreakdown breakdown) {
        OptionalDouble putIv = averageIv(snapshot, breakdown, ZoneType.OTM_PUT);
        OptionalDouble callIv = averageIv(snapshot, breakdown, ZoneType.OTM_CALL);
        if (putIv.isEmpty() || callIv.isEmpty()) {
            return Optional.empty();
        }

        double skew = putIv.getAsDouble() - callIv.getAsDouble();
        return Optional.of(IvSkew.builder()
                .otmPutIv(putIv.getAsDouble())
                .otmCallIv(callIv.getAsDouble())
                .skew(skew)
                .direction(direction(skew))
                .build());
    }

    SentimentDirection direction(double skew) {
        double band = analysisConfig.getIvSkewNeutralBand();
        if (skew > band) {
            return SentimentDirection.BEARISH;
        }
        if (skew < -band) {
            return SentimentDirection.BULLISH;
        }
        return SentimentDirection.NEUTRAL;
    }

    private static OptionalDouble averageIv(Snapshot snapshot, ZoneBreakdown breakdown, ZoneType type) {
        OptionSide side = type.getSide();
        return breakdown.get(type).getStrikes().stream()
                .map(snapshot::get)
                .filter(metrics -> metrics != null && metrics.hasIv(side))
                .mapToDouble(metrics -> metrics.iv(side).doubleValue())
                .average();
    }
}
