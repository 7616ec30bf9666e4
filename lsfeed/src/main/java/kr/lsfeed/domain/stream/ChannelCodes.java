package kr.lsfeed.domain.stream;

/**
 * Wire-level channel codes (tr_cd) used by the streaming feed.
 */
public final class ChannelCodes {

    // VI (volatility interruption) activation/release events
    public static final String VI = "VI_";

    // Trade ticks per market
    public static final String KOSPI_TRADE = "S3_";
    public static final String KOSDAQ_TRADE = "K3_";

    // Order lifecycle (account channels)
    public static final String ORDER_ACCEPTED = "SC0";
    public static final String ORDER_FILLED = "SC1";
    public static final String ORDER_AMENDED = "SC2";
    public static final String ORDER_CANCELLED = "SC3";
    public static final String ORDER_REJECTED = "SC4";

    /** Broker response code for a successful request. */
    public static final String RESPONSE_OK = "00000";

    private ChannelCodes() {}
}
