package com.oitracker.domain.model;

import com.oitracker.domain.enums.ConfirmationStatus;
import com.oitracker.domain.enums.SentimentDirection;
import lombok.Builder;
import lombok.Data;

/**
 * Everything the confidence scorer looks at, gathered by the engine for one snapshot.
 *
 * <p>Zero means "unavailable" for {@code volumePcr}, {@code vix} and {@code futuresOiChange};
 * a null {@code ivSkewDirection} or {@code maxPain} means the value could not be computed.
 */
@Data
@Builder
public class ConfidenceInputs {

    private double combinedScore;

    /** Direction of the verdict being scored. */
    private SentimentDirection signalDirection;

    private SentimentDirection ivSkewDirection;

    private double volumePcr;

    private double spotPrice;

    private Integer maxPain;

    private ConfirmationStatus confirmationStatus;

    private double vix;

    private long futuresOiChange;

    /** Direction of the underlying over the history window, for futures OI interpretation. */
    private SentimentDirection priceDirection;
}
