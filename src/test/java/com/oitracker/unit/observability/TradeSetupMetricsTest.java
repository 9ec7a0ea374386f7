package com.oitracker.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.oitracker.domain.enums.DecisionOutcome;
import com.oitracker.domain.enums.DecisionSource;
import com.oitracker.domain.enums.DecisionType;
import com.oitracker.domain.enums.TradeSetupStatus;
import com.oitracker.domain.model.DecisionRecord;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.event.DecisionLogEvent;
import com.oitracker.event.TradeSetupEvent;
import com.oitracker.event.TradeSetupEventType;
import com.oitracker.observability.TradeSetupMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for TradeSetupMetrics verifying that the setup counters follow trade setup and
 * decision log events.
 */
class TradeSetupMetricsTest {

    private MeterRegistry meterRegistry;
    private TradeSetupMetrics tradeSetupMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        tradeSetupMetrics = new TradeSetupMetrics(meterRegistry);
    }

    private TradeSetupEvent setupEvent(TradeSetupEventType type, TradeSetupStatus status) {
        TradeSetup setup = TradeSetup.builder().id(1L).status(status).build();
        return new TradeSetupEvent(this, setup, type, null);
    }

    private DecisionLogEvent decisionEvent(DecisionType type, DecisionOutcome outcome) {
        DecisionRecord record = DecisionRecord.builder()
                .source(DecisionSource.LIFECYCLE_MANAGER)
                .decisionType(type)
                .outcome(outcome)
                .build();
        return new DecisionLogEvent(this, record);
    }

    @Test
    @DisplayName("setups.created increments on CREATED")
    void createdCounter() {
        tradeSetupMetrics.onTradeSetupEvent(setupEvent(TradeSetupEventType.CREATED, TradeSetupStatus.PENDING));

        assertThat(meterRegistry.counter("setups.created").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("setups.resolved is tagged by terminal status")
    void resolvedCounterTagged() {
        tradeSetupMetrics.onTradeSetupEvent(setupEvent(TradeSetupEventType.WON, TradeSetupStatus.WON));
        tradeSetupMetrics.onTradeSetupEvent(setupEvent(TradeSetupEventType.WON, TradeSetupStatus.WON));
        tradeSetupMetrics.onTradeSetupEvent(setupEvent(TradeSetupEventType.LOST, TradeSetupStatus.LOST));

        assertThat(meterRegistry.counter("setups.resolved", "status", "WON").count()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("setups.resolved", "status", "LOST").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Activation is not counted as a resolution")
    void activationNotCounted() {
        tradeSetupMetrics.onTradeSetupEvent(setupEvent(TradeSetupEventType.ACTIVATED, TradeSetupStatus.ACTIVE));

        assertThat(meterRegistry.find("setups.resolved").counters()).isEmpty();
        assertThat(meterRegistry.counter("setups.created").count()).isZero();
    }

    @Test
    @DisplayName("gate.rejections counts only rejected gate evaluations")
    void gateRejections() {
        tradeSetupMetrics.onDecisionLogEvent(
                decisionEvent(DecisionType.SETUP_GATE_EVALUATED, DecisionOutcome.REJECTED));
        tradeSetupMetrics.onDecisionLogEvent(
                decisionEvent(DecisionType.SETUP_GATE_EVALUATED, DecisionOutcome.TRIGGERED));
        tradeSetupMetrics.onDecisionLogEvent(decisionEvent(DecisionType.SETUP_LOST, DecisionOutcome.TRIGGERED));

        assertThat(meterRegistry.counter("gate.rejections").count()).isEqualTo(1.0);
    }
}
