package com.oitracker.unit.analysis;

import static com.oitracker.unit.ChainFixtures.snapshot;
import static com.oitracker.unit.ChainFixtures.strike;
import static org.assertj.core.api.Assertions.assertThat;

import com.oitracker.analysis.MaxPainCalculator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MaxPainCalculator.
 */
class MaxPainCalculatorTest {

    private MaxPainCalculator maxPainCalculator;

    @BeforeEach
    void setUp() {
        maxPainCalculator = new MaxPainCalculator();
    }

    @Test
    @DisplayName("Max pain is the strike with the lowest writer payout")
    void lowestPayoutStrike() {
        assertThat(maxPainCalculator.calculate(snapshot(
                        110.0,
                        strike(100, 0, 0, 0, 1000, 0, 0),
                        strike(110, 500, 0, 0, 500, 0, 0),
                        strike(120, 1000, 0, 0, 0, 0, 0))))
                .contains(110);
    }

    @Test
    @DisplayName("Heavy call OI drags max pain down")
    void heavyCallOi() {
        assertThat(maxPainCalculator.calculate(snapshot(
                        110.0,
                        strike(100, 10_000, 0, 0, 0, 0, 0),
                        strike(110, 100, 0, 0, 100, 0, 0),
                        strike(120, 100, 0, 0, 100, 0, 0))))
                .contains(100);
    }

    @Test
    @DisplayName("Equal payouts resolve to the lowest strike")
    void tieLowestStrike() {
        assertThat(maxPainCalculator.calculate(snapshot(
                        110.0, strike(100, 500, 0, 0, 0, 0, 0), strike(110, 0, 0, 0, 500, 0, 0))))
                .contains(100);
    }

    @Test
    @DisplayName("Empty chain has no max pain")
    void emptyChain() {
        assertThat(maxPainCalculator.calculate(snapshot(24000.0, List.of()))).isEmpty();
    }

    @Test
    @DisplayName("Chain without any OI has no max pain")
    void noOi() {
        assertThat(maxPainCalculator.calculate(snapshot(
                        110.0, strike(100, 0, 10, 10, 0, 10, 10), strike(110, 0, 10, 10, 0, 10, 10))))
                .isEmpty();
    }
}
