package com.oitracker.analysis;

import com.oitracker.domain.enums.ConfirmationStatus;
import com.oitracker.domain.enums.SentimentDirection;
import org.springframework.stereotype.Component;

/**
 * Checks whether price action confirms the OI verdict.
 *
 * <p>NEUTRAL when either side is flat. CONFIRMED when they agree. When they disagree,
 * REVERSAL_ALERT if ATM premiums side with OI (|premium score| above 10, same sign as the
 * verdict), otherwise CONFLICT.
 */
@Component
public class ConfirmationEvaluator {

    private final AnalysisConfig analysisConfig;

    public ConfirmationEvaluator(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    public ConfirmationStatus evaluate(
            SentimentDirection oiDirection, SentimentDirection priceDirection, double premiumMomentumScore) {
        if (oiDirection == SentimentDirection.NEUTRAL || priceDirection == SentimentDirection.NEUTRAL) {
            return ConfirmationStatus.NEUTRAL;
        }
        if (oiDirection == priceDirection) {
            return ConfirmationStatus.CONFIRMED;
        }
        double threshold = analysisConfig.getReversalPremiumThreshold();
        boolean premiumsSideWithOi = Math.abs(premiumMomentumScore) > threshold
                && SentimentDirection.fromSign(premiumMomentumScore) == oiDirection;
        return premiumsSideWithOi ? ConfirmationStatus.REVERSAL_ALERT : ConfirmationStatus.CONFLICT;
    }
}
