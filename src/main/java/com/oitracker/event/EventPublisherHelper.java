package com.oitracker.event;

import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.TradeSetup;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for trade setup events.
 *
 * <p>Delivery is synchronous unless a listener is {@code @Async}. The core never waits on
 * a listener's result.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishSetupCreated(Object source, TradeSetup tradeSetup) {
        applicationEventPublisher.publishEvent(
                new TradeSetupEvent(source, tradeSetup, TradeSetupEventType.CREATED, null));
    }

    /** Publishes the event matching the setup's new status. */
    public void publishSetupTransition(Object source, TradeSetup tradeSetup, TradeSetupStatus previousStatus) {
        TradeSetupEventType eventType = switch (tradeSetup.getStatus()) {
            case ACTIVE -> TradeSetupEventType.ACTIVATED;
            case WON -> TradeSetupEventType.WON;
            case LOST -> TradeSetupEventType.LOST;
            case CANCELLED -> TradeSetupEventType.CANCELLED;
            case EXPIRED -> TradeSetupEventType.EXPIRED;
            case PENDING -> TradeSetupEventType.CREATED;
        };
        applicationEventPublisher.publishEvent(new TradeSetupEvent(source, tradeSetup, eventType, previousStatus));
    }
}
