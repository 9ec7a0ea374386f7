package com.oitracker.setup;

import com.oitracker.domain.enums.ConfirmationStatus;
import com.oitracker.domain.enums.Moneyness;
import com.oitracker.domain.enums.TradeDirection;
import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.TradeSetupCandidate;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Quality score 0-9 attached to every created setup.
 *
 * <ul>
 *   <li>+2 confirmation status CONFIRMED</li>
 *   <li>+2 confidence 60-85, +1 for 50-60 or 85-95 (very high confidence tends to be late)</li>
 *   <li>+1 "Winning" verdict (moderate or strong)</li>
 *   <li>+1 ITM strike</li>
 *   <li>+1 risk of 15% or less</li>
 *   <li>+1 premium momentum above 10 in the trade's direction</li>
 * </ul>
 */
@Component
public class TradeQualityScorer {

    public static final int MAX_SCORE = 9;

    private static final double PREMIUM_ALIGNMENT_THRESHOLD = 10.0;
    private static final BigDecimal LOW_RISK_PCT = BigDecimal.valueOf(15);

    public int score(Analysis analysis, TradeSetupCandidate candidate) {
        int score = 0;

        if (analysis.getConfirmationStatus() == ConfirmationStatus.CONFIRMED) {
            score += 2;
        }

        double confidence = analysis.getConfidence();
        if (confidence >= 60 && confidence <= 85) {
            score += 2;
        } else if ((confidence >= 50 && confidence < 60) || (confidence > 85 && confidence <= 95)) {
            score += 1;
        }

        if (analysis.getVerdict().isWinning()) {
            score += 1;
        }
        if (candidate.getMoneyness() == Moneyness.ITM) {
            score += 1;
        }
        if (candidate.getRiskPct() != null && candidate.getRiskPct().compareTo(LOW_RISK_PCT) <= 0) {
            score += 1;
        }
        if (isPremiumAligned(analysis, candidate.getDirection())) {
            score += 1;
        }
        return score;
    }

    static boolean isPremiumAligned(Analysis analysis, TradeDirection direction) {
        if (analysis.getPremiumMomentum() == null) {
            return false;
        }
        double pm = analysis.getPremiumMomentum().getScore();
        return direction == TradeDirection.BUY_CALL
                ? pm > PREMIUM_ALIGNMENT_THRESHOLD
                : pm < -PREMIUM_ALIGNMENT_THRESHOLD;
    }
}
