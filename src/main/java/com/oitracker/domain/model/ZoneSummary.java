package com.oitracker.domain.model;

import com.oitracker.domain.enums.ZoneType;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Strikes assigned to one zone together with their aggregate force and OI.
 */
@Data
@Builder
public class ZoneSummary {

    private ZoneType type;

    /** Zone strikes, ascending. */
    private List<Integer> strikes;

    /** Per-strike forces, filled in by the ForceCalculator. Same order as {@link #strikes}. */
    private List<StrikeForce> forces;

    private double totalForce;
    private long totalOi;
    private long totalOiChange;
    private long totalVolume;

    public boolean isEmpty() {
        return strikes == null || strikes.isEmpty();
    }
}
