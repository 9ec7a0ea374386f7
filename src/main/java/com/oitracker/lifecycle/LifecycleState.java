package com.oitracker.lifecycle;

import com.oitracker.domain.enums.TradeDirection;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * Cross-tick memory of the lifecycle: cooldown clocks and the last proposed direction.
 *
 * <p>Owned by the caller and handed to the manager on every tick. The manager updates it
 * when setups are created, cancelled or resolved; nothing here is cached inside the manager.
 */
@Data
public class LifecycleState {

    private LocalDateTime lastResolvedAt;

    /** Ticks since the last WON/LOST resolution; null until a setup has resolved. */
    private Integer cyclesSinceResolution;

    private LocalDateTime lastCancelledAt;

    private TradeDirection lastSuggestedDirection;

    private LocalDateTime lastSuggestionAt;

    /** Called once at the start of every tick. */
    public void advanceCycle() {
        if (cyclesSinceResolution != null) {
            cyclesSinceResolution++;
        }
    }

    public void recordResolution(LocalDateTime at) {
        lastResolvedAt = at;
        cyclesSinceResolution = 0;
    }

    public void recordCancellation(LocalDateTime at) {
        lastCancelledAt = at;
    }

    public void recordSuggestion(TradeDirection direction, LocalDateTime at) {
        lastSuggestedDirection = direction;
        lastSuggestionAt = at;
    }
}
