package com.oitracker.analysis;

import com.oitracker.domain.enums.OiPhase;
import com.oitracker.domain.enums.ZoneType;
import com.oitracker.domain.model.OiAcceleration;
import com.oitracker.domain.model.OiChangePair;
import com.oitracker.domain.model.ZoneBreakdown;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Compares the current zone OI-change totals with the average of the prior window.
 *
 * <p>Phases and their score adjustments:
 * <ul>
 *   <li>UNWINDING: both sides' OI-change magnitudes are shrinking. With momentum above +15
 *       this is short covering (+15); below -15 it is profit booking (-15).</li>
 *   <li>ACCUMULATION: net acceleration (put accel - call accel) is strongly positive and
 *       either put writing is rising or call OI is falling (+10).</li>
 *   <li>DISTRIBUTION: the bearish mirror (-10).</li>
 * </ul>
 * "Strongly" means the net acceleration exceeds 20% of the prior window's combined magnitude.
 */
@Component
public class OiAccelerationAnalyzer {

    private final AnalysisConfig analysisConfig;

    public OiAccelerationAnalyzer(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    public OiAcceleration analyze(ZoneBreakdown breakdown, List<OiChangePair> priorChanges, double momentum) {
        long currentCall = breakdown.totalOiChange(ZoneType.ITM_CALL, ZoneType.OTM_CALL);
        long currentPut = breakdown.totalOiChange(ZoneType.OTM_PUT, ZoneType.ITM_PUT);

        if (priorChanges == null || priorChanges.isEmpty()) {
            return OiAcceleration.builder()
                    .phase(OiPhase.INSUFFICIENT_DATA)
                    .label("insufficient_data")
                    .currentCallChange(currentCall)
                    .currentPutChange(currentPut)
                    .build();
        }

        double priorCall = priorChanges.stream().mapToLong(OiChangePair::callChange).average().orElse(0.0);
        double priorPut = priorChanges.stream().mapToLong(OiChangePair::putChange).average().orElse(0.0);

        double callAcceleration = currentCall - priorCall;
        double putAcceleration = currentPut - priorPut;
        double netAcceleration = putAcceleration - callAcceleration;

        OiAcceleration.OiAccelerationBuilder result = OiAcceleration.builder()
                .currentCallChange(currentCall)
                .currentPutChange(currentPut)
                .priorCallChange(priorCall)
                .priorPutChange(priorPut)
                .callAcceleration(callAcceleration)
                .putAcceleration(putAcceleration)
                .netAcceleration(netAcceleration);

        boolean unwinding = Math.abs(currentCall) < Math.abs(priorCall) && Math.abs(currentPut) < Math.abs(priorPut);
        if (unwinding) {
            double threshold = analysisConfig.getUnwindingMomentumThreshold();
            double adjustment = analysisConfig.getUnwindingAdjustment();
            if (momentum > threshold) {
                return result.phase(OiPhase.UNWINDING).label("short_covering").adjustment(adjustment).build();
            }
            if (momentum < -threshold) {
                return result.phase(OiPhase.UNWINDING).label("profit_booking").adjustment(-adjustment).build();
            }
            return result.phase(OiPhase.UNWINDING).label("unwinding").adjustment(0.0).build();
        }

        double strongThreshold = Math.max(
                1.0, analysisConfig.getStrongAccelerationRatio() * (Math.abs(priorCall) + Math.abs(priorPut)));
        double accumulation = analysisConfig.getAccumulationAdjustment();

        if (netAcceleration > strongThreshold && (putAcceleration > 0 || callAcceleration < 0)) {
            return result.phase(OiPhase.ACCUMULATION).label("accumulation").adjustment(accumulation).build();
        }
        if (netAcceleration < -strongThreshold && (callAcceleration > 0 || putAcceleration < 0)) {
            return result.phase(OiPhase.DISTRIBUTION).label("distribution").adjustment(-accumulation).build();
        }
        return result.phase(OiPhase.NEUTRAL).label("neutral").adjustment(0.0).build();
    }
}
