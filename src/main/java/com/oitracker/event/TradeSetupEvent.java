package com.oitracker.event;

import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.TradeSetup;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a trade setup is created or changes status.
 *
 * <p>Fire-and-forget: publishers do not wait for or expect any acknowledgement. Key listeners:
 * <ul>
 *   <li>TradeSetupMetrics -- counts creations and resolutions</li>
 *   <li>notification or broker adapters outside the core</li>
 * </ul>
 */
public class TradeSetupEvent extends ApplicationEvent {

    private final TradeSetup tradeSetup;
    private final TradeSetupEventType eventType;
    private final TradeSetupStatus previousStatus;

    /**
     * @param source         the component publishing this event
     * @param tradeSetup     the setup after the change
     * @param eventType      what happened
     * @param previousStatus status before the change (null for CREATED)
     */
    public TradeSetupEvent(
            Object source, TradeSetup tradeSetup, TradeSetupEventType eventType, TradeSetupStatus previousStatus) {
        super(source);
        this.tradeSetup = tradeSetup;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public TradeSetup getTradeSetup() {
        return tradeSetup;
    }

    public TradeSetupEventType getEventType() {
        return eventType;
    }

    public TradeSetupStatus getPreviousStatus() {
        return previousStatus;
    }
}
