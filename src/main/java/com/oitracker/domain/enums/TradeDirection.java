package com.oitracker.domain.enums;

/** Direction of a trade setup. Only option buying is proposed. */
public enum TradeDirection {
    BUY_CALL(OptionSide.CE, SentimentDirection.BULLISH),
    BUY_PUT(OptionSide.PE, SentimentDirection.BEARISH);

    private final OptionSide optionSide;
    private final SentimentDirection sentiment;

    TradeDirection(OptionSide optionSide, SentimentDirection sentiment) {
        this.optionSide = optionSide;
        this.sentiment = sentiment;
    }

    public OptionSide getOptionSide() {
        return optionSide;
    }

    public SentimentDirection getSentiment() {
        return sentiment;
    }

    public String getDisplayName() {
        return this == BUY_CALL ? "BUY CALL" : "BUY PUT";
    }
}
