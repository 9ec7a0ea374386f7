package com.oitracker.unit.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.oitracker.analysis.AnalysisConfig;
import com.oitracker.analysis.IvSkewCalculator;
import com.oitracker.analysis.ZonePartitioner;
import com.oitracker.domain.enums.SentimentDirection;
import com.oitracker.domain.model.IvSkew;
import com.oitracker.domain.model.Snapshot;
import com.oitracker.domain.model.StrikeMetrics;
import com.oitracker.unit.ChainFixtures;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for IvSkewCalculator.
 */
class IvSkewCalculatorTest {

    private AnalysisConfig analysisConfig;
    private IvSkewCalculator ivSkewCalculator;

    @BeforeEach
    void setUp() {
        analysisConfig = new AnalysisConfig();
        ivSkewCalculator = new IvSkewCalculator(analysisConfig);
    }

    private Optional<IvSkew> skew(String putIvBelow, String callIvAbove) {
        Snapshot snapshot = ChainFixtures.snapshot(
                24000.0,
                StrikeMetrics.builder()
                        .strike(23900)
                        .putOi(1000)
                        .putIv(new BigDecimal(putIvBelow))
                        .build(),
                StrikeMetrics.builder().strike(24000).build(),
                StrikeMetrics.builder()
                        .strike(24100)
                        .callOi(1000)
                        .callIv(new BigDecimal(callIvAbove))
                        .build());
        return ivSkewCalculator.calculate(snapshot, new ZonePartitioner(analysisConfig).partition(snapshot));
    }

    @Test
    @DisplayName("Puts bid over calls is a bearish skew")
    void bearishSkew() {
        IvSkew skew = skew("18.0", "14.0").orElseThrow();

        assertThat(skew.getSkew()).isCloseTo(4.0, within(1e-9));
        assertThat(skew.getDirection()).isEqualTo(SentimentDirection.BEARISH);
    }

    @Test
    @DisplayName("Calls bid over puts is a bullish skew")
    void bullishSkew() {
        IvSkew skew = skew("14.0", "18.0").orElseThrow();

        assertThat(skew.getDirection()).isEqualTo(SentimentDirection.BULLISH);
    }

    @Test
    @DisplayName("Skew inside one vol point has no direction")
    void neutralBand() {
        IvSkew skew = skew("15.5", "15.0").orElseThrow();

        assertThat(skew.getDirection()).isEqualTo(SentimentDirection.NEUTRAL);
    }

    @Test
    @DisplayName("Missing call IV means no skew")
    void missingIv() {
        assertThat(skew("15.0", "0")).isEmpty();
    }
}
