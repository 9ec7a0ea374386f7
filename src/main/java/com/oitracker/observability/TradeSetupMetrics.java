package com.oitracker.observability;

import com.oitracker.domain.enums.DecisionOutcome;
import com.oitracker.domain.enums.DecisionType;
import com.oitracker.event.DecisionLogEvent;
import com.oitracker.event.TradeSetupEvent;
import com.oitracker.event.TradeSetupEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters for the setup pipeline:
 * <ul>
 *   <li><b>setups.created</b>: setups that passed the creation gate</li>
 *   <li><b>setups.resolved</b> (tag {@code status}): WON, LOST, CANCELLED, EXPIRED</li>
 *   <li><b>gate.rejections</b>: gate evaluations with at least one violation</li>
 * </ul>
 * All counters are fed from application events, after core processing.
 */
@Service
public class TradeSetupMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter setupsCreatedCounter;
    private final Counter gateRejectionsCounter;

    public TradeSetupMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.setupsCreatedCounter = Counter.builder("setups.created")
                .description("Trade setups that passed the creation gate")
                .register(meterRegistry);

        this.gateRejectionsCounter = Counter.builder("gate.rejections")
                .description("Creation gate evaluations that rejected a setup")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onTradeSetupEvent(TradeSetupEvent event) {
        TradeSetupEventType type = event.getEventType();
        if (type == TradeSetupEventType.CREATED) {
            setupsCreatedCounter.increment();
        } else if (type != TradeSetupEventType.ACTIVATED) {
            resolvedCounter(type.name()).increment();
        }
    }

    @EventListener
    @Order(20)
    public void onDecisionLogEvent(DecisionLogEvent event) {
        if (event.getDecisionRecord().getDecisionType() == DecisionType.SETUP_GATE_EVALUATED
                && event.getDecisionRecord().getOutcome() == DecisionOutcome.REJECTED) {
            gateRejectionsCounter.increment();
        }
    }

    private Counter resolvedCounter(String status) {
        return Counter.builder("setups.resolved")
                .description("Trade setups reaching a terminal status")
                .tag("status", status)
                .register(meterRegistry);
    }
}
