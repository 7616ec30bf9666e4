package kr.lsfeed.domain.stream;

/**
 * Channel code families recognized by the router.
 *
 * Each family carries the tr_type pair used to register and unregister a
 * real-time subscription: quote channels use 3/4, account channels use 1/2.
 */
public enum ChannelFamily {
    VI("3", "4"),
    TRADE("3", "4"),
    ORDER("1", "2"),
    UNKNOWN("3", "4");

    private final String registerCode;
    private final String unregisterCode;

    ChannelFamily(String registerCode, String unregisterCode) {
        this.registerCode = registerCode;
        this.unregisterCode = unregisterCode;
    }

    public String registerCode() {
        return registerCode;
    }

    public String unregisterCode() {
        return unregisterCode;
    }

    /**
     * Resolve the family of a channel code by prefix.
     */
    public static ChannelFamily of(String channelCode) {
        if (channelCode == null || channelCode.isEmpty()) {
            return UNKNOWN;
        }
        if (channelCode.startsWith(ChannelCodes.VI)) {
            return VI;
        }
        if (channelCode.startsWith(ChannelCodes.KOSPI_TRADE) || channelCode.startsWith(ChannelCodes.KOSDAQ_TRADE)) {
            return TRADE;
        }
        if (channelCode.startsWith("SC")) {
            return ORDER;
        }
        return UNKNOWN;
    }
}
