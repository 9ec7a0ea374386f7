package com.oitracker.domain.model;

import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Support (heavy put OI below spot) and resistance (heavy call OI above spot) strikes,
 * strongest first.
 */
@Data
@Builder
public class OiClusters {

    @Builder.Default
    private List<ClusterLevel> support = Collections.emptyList();

    @Builder.Default
    private List<ClusterLevel> resistance = Collections.emptyList();

    public Integer getStrongestSupport() {
        return support.isEmpty() ? null : support.get(0).strike();
    }

    public Integer getStrongestResistance() {
        return resistance.isEmpty() ? null : resistance.get(0).strike();
    }

    public static OiClusters empty() {
        return OiClusters.builder().build();
    }

    public record ClusterLevel(int strike, long oi) {}
}
