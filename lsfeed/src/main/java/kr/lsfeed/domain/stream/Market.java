package kr.lsfeed.domain.stream;

/**
 * Listing market of a symbol, which decides its trade-tick channel.
 */
public enum Market {
    KOSPI(ChannelCodes.KOSPI_TRADE),
    KOSDAQ(ChannelCodes.KOSDAQ_TRADE);

    private final String tradeChannel;

    Market(String tradeChannel) {
        this.tradeChannel = tradeChannel;
    }

    public String tradeChannel() {
        return tradeChannel;
    }

    public SubscriptionKey tradeKey(String symbol) {
        return new SubscriptionKey(tradeChannel, symbol);
    }
}
