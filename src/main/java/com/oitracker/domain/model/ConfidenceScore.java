package com.oitracker.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Confidence (0-100) in the verdict, with the contribution of each auxiliary signal.
 */
@Data
@Builder
public class ConfidenceScore {

    private double score;

    /** Component name (e.g. "ivSkew", "vix") to points added or removed. */
    private Map<String, Double> components;
}
