package com.oitracker.domain.model;

import com.oitracker.domain.enums.ZoneType;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * The four zones around the ATM strike for one snapshot.
 *
 * <p>{@code scale} is the factor that brings total OI onto the same order of magnitude
 * as OI change inside the force formula (1 when either average is zero).
 */
@Data
@Builder
public class ZoneBreakdown {

    private int atmStrike;

    private Map<ZoneType, ZoneSummary> zones;

    private double scale;

    public ZoneSummary get(ZoneType type) {
        return zones.get(type);
    }

    public double force(ZoneType type) {
        ZoneSummary summary = zones.get(type);
        return summary != null ? summary.getTotalForce() : 0.0;
    }

    /** True when none of the four zones received a strike (e.g. a single-strike chain). */
    public boolean isEmpty() {
        return zones.values().stream().allMatch(ZoneSummary::isEmpty);
    }

    public long totalOiChange(ZoneType... types) {
        long total = 0;
        for (ZoneType type : types) {
            ZoneSummary summary = zones.get(type);
            if (summary != null) {
                total += summary.getTotalOiChange();
            }
        }
        return total;
    }

    public long totalOi(ZoneType... types) {
        long total = 0;
        for (ZoneType type : types) {
            ZoneSummary summary = zones.get(type);
            if (summary != null) {
                total += summary.getTotalOi();
            }
        }
        return total;
    }

    public long totalVolume(ZoneType... types) {
        long total = 0;
        for (ZoneType type : types) {
            ZoneSummary summary = zones.get(type);
            if (summary != null) {
                total += summary.getTotalVolume();
            }
        }
        return total;
    }
}
