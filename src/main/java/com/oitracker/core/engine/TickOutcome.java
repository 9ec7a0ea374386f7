package com.oitracker.core.engine;

import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.lifecycle.LivePnl;
import com.oitracker.lifecycle.SetupTransition;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * What happened on one tick: the analysis, at most one lifecycle transition, at most one
 * newly created setup, and the live setup's unrealized P&L.
 */
@Getter
@Builder
@ToString
public class TickOutcome {

    /** True when the snapshot failed validation; nothing else is set then. */
    private final boolean skipped;

    private final String skipReason;

    private final Analysis analysis;

    private final SetupTransition transition;

    private final TradeSetup createdSetup;

    /** The PENDING or ACTIVE setup after this tick, if any. */
    private final TradeSetup liveSetup;

    private final LivePnl livePnl;

    public static TickOutcome skipped(String reason) {
        return TickOutcome.builder().skipped(true).skipReason(reason).livePnl(LivePnl.zero()).build();
    }

    public Optional<SetupTransition> transition() {
        return Optional.ofNullable(transition);
    }

    public Optional<TradeSetup> createdSetup() {
        return Optional.ofNullable(createdSetup);
    }

    public Optional<TradeSetup> liveSetup() {
        return Optional.ofNullable(liveSetup);
    }
}
