package com.oitracker.domain.model;

import com.oitracker.domain.enums.TrapType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TrapWarning {

    private TrapType type;

    /** The support or resistance strike the price is running into. */
    private int clusterStrike;

    /** Distance from spot to the cluster strike, in percent. */
    private double distancePct;

    private String message;
}
