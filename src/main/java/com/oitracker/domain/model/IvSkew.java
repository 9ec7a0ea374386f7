package com.oitracker.domain.model;

import com.oitracker.domain.enums.SentimentDirection;
import lombok.Builder;
import lombok.Data;

/**
 * Average OTM put IV minus average OTM call IV, in volatility points.
 *
 * <p>Positive skew means puts are bid (hedging demand): bearish. Negative skew means
 * calls are bid: bullish.
 */
@Data
@Builder
public class IvSkew {

    private double otmPutIv;
    private double otmCallIv;
    private double skew;
    private SentimentDirection direction;
}
