package com.oitracker.setup;

import com.oitracker.domain.enums.OptionSide;
import com.oitracker.domain.model.Analysis;
import com.oitracker.domain.model.TradeSetupCandidate;
import org.springframework.stereotype.Component;

/**
 * One-paragraph human-readable explanation stored with each setup, e.g.
 *
 * <pre>
 * BUY CALL: Bulls Winning (72% confidence). Quality Score: 6/9. Call OI -1.2L vs Put OI +3.4L.
 * Spot 24025.50 above max pain 24000. Selected 23950 CE (ITM) with 15.00% risk. IV: 11.8%
 * </pre>
 *
 * OI changes are shown in lakhs (100,000 contracts).
 */
@Component
public class TradeReasoningFormatter {

    private static final double LAKH = 100_000.0;

    public String format(Analysis analysis, TradeSetupCandidate candidate, int qualityScore) {
        StringBuilder reasoning = new StringBuilder();
        reasoning.append(candidate.getDirection().getDisplayName())
                .append(": ")
                .append(analysis.getVerdict().getLabel())
                .append(String.format(" (%.0f%% confidence). ", analysis.getConfidence()))
                .append(String.format("Quality Score: %d/%d. ", qualityScore, TradeQualityScorer.MAX_SCORE))
                .append(String.format(
                        "Call OI %+.1fL vs Put OI %+.1fL. ",
                        analysis.getCallOiChange() / LAKH,
                        analysis.getPutOiChange() / LAKH));

        analysis.maxPain().ifPresent(maxPain -> {
            double spot = analysis.getSpotPrice().doubleValue();
            String position = spot < maxPain ? "below" : "above";
            reasoning.append(String.format("Spot %.2f %s max pain %d. ", spot, position, maxPain));
        });

        reasoning.append(String.format(
                "Selected %d %s (%s) with %s%% risk.",
                candidate.getStrike(),
                candidate.getOptionSide() == OptionSide.CE ? "CE" : "PE",
                candidate.getMoneyness(),
                candidate.getRiskPct().toPlainString()));

        if (candidate.getIvAtStrike() != null && candidate.getIvAtStrike().signum() > 0) {
            reasoning.append(String.format(" IV: %.1f%%", candidate.getIvAtStrike().doubleValue()));
        }
        return reasoning.toString();
    }
}
