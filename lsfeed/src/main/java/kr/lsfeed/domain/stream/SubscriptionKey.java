package kr.lsfeed.domain.stream;

import java.util.Objects;

/**
 * (channel code, routing key) pair identifying one subscription.
 *
 * @param channel    wire channel code, e.g. "VI_" or "S3_"
 * @param routingKey symbol code, {@link #ALL_SYMBOLS}, or "" for account channels
 */
public record SubscriptionKey(String channel, String routingKey) {

    /** Routing key meaning "every symbol" on quote channels. */
    public static final String ALL_SYMBOLS = "000000";

    public SubscriptionKey {
        Objects.requireNonNull(channel, "channel");
        if (channel.isBlank()) {
            throw new IllegalArgumentException("channel must not be blank");
        }
        routingKey = routingKey == null ? "" : routingKey;
    }

    public static SubscriptionKey of(String channel, String routingKey) {
        return new SubscriptionKey(channel, routingKey);
    }

    public static SubscriptionKey allSymbols(String channel) {
        return new SubscriptionKey(channel, ALL_SYMBOLS);
    }

    public ChannelFamily family() {
        return ChannelFamily.of(channel);
    }

    public boolean isAllSymbols() {
        return ALL_SYMBOLS.equals(routingKey);
    }

    @Override
    public String toString() {
        return channel + "_" + routingKey;
    }
}
