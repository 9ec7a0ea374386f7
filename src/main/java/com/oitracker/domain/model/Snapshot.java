package com.oitracker.domain.model;

import com.oitracker.exception.InvalidSnapshotException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.Getter;

/**
 * One option-chain capture: timestamp, spot, expiry and per-strike metrics.
 *
 * <p>Snapshots are immutable. A new snapshot supersedes the previous one; nothing in
 * the engine mutates a snapshot after {@link #of} has validated it.
 *
 * <p>Strikes are held in ascending order. An empty chain is valid (the engine turns it
 * into a Neutral analysis); malformed data is not.
 */
@Getter
public final class Snapshot {

    private final LocalDateTime timestamp;
    private final BigDecimal spotPrice;
    private final String expiry;
    private final NavigableMap<Integer, StrikeMetrics> strikes;

    private Snapshot(
            LocalDateTime timestamp,
            BigDecimal spotPrice,
            String expiry,
            NavigableMap<Integer, StrikeMetrics> strikes) {
        this.timestamp = timestamp;
        this.spotPrice = spotPrice;
        this.expiry = expiry;
        this.strikes = Collections.unmodifiableNavigableMap(strikes);
    }

    /**
     * Validates and builds a snapshot. This is the only place raw venue data is checked.
     *
     * @throws InvalidSnapshotException if the timestamp is missing, spot is not positive,
     *     or any strike carries negative OI or volume
     */
    public static Snapshot of(
            LocalDateTime timestamp, BigDecimal spotPrice, String expiry, Collection<StrikeMetrics> strikeMetrics) {
        if (timestamp == null) {
            throw new InvalidSnapshotException("Snapshot timestamp is required", Map.of());
        }
        if (spotPrice == null || spotPrice.signum() <= 0) {
            throw new InvalidSnapshotException(
                    "Spot price must be positive", Map.of("spotPrice", String.valueOf(spotPrice)));
        }

        NavigableMap<Integer, StrikeMetrics> strikes = new TreeMap<>();
        if (strikeMetrics != null) {
            for (StrikeMetrics metrics : strikeMetrics) {
                validate(metrics);
                strikes.put(metrics.getStrike(), metrics);
            }
        }
        return new Snapshot(timestamp, spotPrice, expiry != null ? expiry : "", strikes);
    }

    private static void validate(StrikeMetrics metrics) {
        if (metrics.getStrike() <= 0) {
            throw new InvalidSnapshotException(
                    "Strike price must be positive", Map.of("strike", metrics.getStrike()));
        }
        if (metrics.getCallOi() < 0
                || metrics.getPutOi() < 0
                || metrics.getCallVolume() < 0
                || metrics.getPutVolume() < 0) {
            throw new InvalidSnapshotException(
                    "Open interest and volume must be non-negative", Map.of("strike", metrics.getStrike()));
        }
    }

    public double spot() {
        return spotPrice.doubleValue();
    }

    public boolean isEmpty() {
        return strikes.isEmpty();
    }

    /** Strike prices in ascending order. */
    public List<Integer> sortedStrikes() {
        return new ArrayList<>(strikes.keySet());
    }

    public StrikeMetrics get(int strike) {
        return strikes.get(strike);
    }
}
