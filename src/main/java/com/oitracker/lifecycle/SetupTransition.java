package com.oitracker.lifecycle;

import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.TradeSetup;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A status change applied to a setup by the lifecycle manager.
 */
@Getter
@Builder
@ToString
public class SetupTransition {

    private final TradeSetup setup;
    private final TradeSetupStatus from;
    private final TradeSetupStatus to;
    private final LocalDateTime at;
    private final String reason;

    /** True when the setup was closed at the late-session cutoff rather than by SL or target. */
    private final boolean forced;

    public boolean isResolution() {
        return to == TradeSetupStatus.WON || to == TradeSetupStatus.LOST;
    }
}
