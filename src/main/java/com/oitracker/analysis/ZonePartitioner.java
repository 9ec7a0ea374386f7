package com.oitracker.analysis;

import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.enums.ZoneType;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeMetrics;
import com.oitracker.domain.model.ZoneBreakdown;
import com.oitracker.domain.model.ZoneSummary;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Splits the strike ladder into the four tug-of-war zones around the ATM strike.
 *
 * <p>The lower window is the {@code zoneWidth} strikes immediately below ATM; its put side
 * is the OTM_PUT zone and its call side the ITM_CALL zone. The upper window is the
 * {@code zoneWidth} strikes immediately above ATM, giving OTM_CALL (call side) and
 * ITM_PUT (put side). The ATM strike itself belongs to no zone. Windows are truncated
 * at the ends of the ladder.
 */
@Component
public class ZonePartitioner {

    private final AnalysisConfig analysisConfig;

    public ZonePartitioner(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    /**
     * Returns the strike closest to spot. On a tie the lower strike wins.
     *
     * @return the ATM strike, or 0 for an empty ladder
     */
    public static int findAtmStrike(double spotPrice, List<Integer> sortedStrikes) {
        int atm = 0;
        double bestDistance = Double.MAX_VALUE;
        for (int strike : sortedStrikes) {
            double distance = Math.abs(strike - spotPrice);
            if (distance < bestDistance) {
                bestDistance = distance;
                atm = strike;
            }
        }
        return atm;
    }

    /**
     * Partitions the snapshot into zones. Forces are left empty; see {@link ForceCalculator}.
     */
    public ZoneBreakdown partition(Snapshot snapshot) {
        List<Integer> strikes = snapshot.sortedStrikes();
        int atmStrike = findAtmStrike(snapshot.spot(), strikes);
        int width = Math.max(0, analysisConfig.getZoneWidth());

        List<Integer> below = Collections.emptyList();
        List<Integer> above = Collections.emptyList();
        if (!strikes.isEmpty()) {
            int atmIndex = strikes.indexOf(atmStrike);
            below = strikes.subList(Math.max(0, atmIndex - width), atmIndex);
            above = strikes.subList(atmIndex + 1, Math.min(strikes.size(), atmIndex + 1 + width));
        }

        Map<ZoneType, ZoneSummary> zones = new EnumMap<>(ZoneType.class);
        for (ZoneType type : ZoneType.values()) {
            List<Integer> zoneStrikes = List.copyOf(type.isBelowSpot() ? below : above);
            zones.put(type, summarize(type, zoneStrikes, snapshot));
        }

        return ZoneBreakdown.builder()
                .atmStrike(atmStrike)
                .zones(zones)
                .scale(1.0)
                .build();
    }

    private ZoneSummary summarize(ZoneType type, List<Integer> zoneStrikes, Snapshot snapshot) {
        OptionSide side = type.getSide();
        long totalOi = 0;
        long totalOiChange = 0;
        long totalVolume = 0;
        for (int strike : zoneStrikes) {
            StrikeMetrics metrics = snapshot.get(strike);
            totalOi += metrics.oi(side);
            totalOiChange += metrics.oiChange(side);
            totalVolume += metrics.volume(side);
        }
        return ZoneSummary.builder()
                .type(type)
                .strikes(zoneStrikes)
                .forces(Collections.emptyList())
                .totalOi(totalOi)
                .totalOiChange(totalOiChange)
                .totalVolume(totalVolume)
                .build();
    }
}
