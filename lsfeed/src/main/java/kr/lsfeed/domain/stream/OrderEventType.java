package kr.lsfeed.domain.stream;

import java.util.Optional;

/**
 * Order lifecycle stages and their channel codes.
 */
public enum OrderEventType {
    ACCEPTED(ChannelCodes.ORDER_ACCEPTED),
    FILLED(ChannelCodes.ORDER_FILLED),
    AMENDED(ChannelCodes.ORDER_AMENDED),
    CANCELLED(ChannelCodes.ORDER_CANCELLED),
    REJECTED(ChannelCodes.ORDER_REJECTED);

    private final String channel;

    OrderEventType(String channel) {
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }

    public static Optional<OrderEventType> fromChannel(String channel) {
        for (OrderEventType type : values()) {
            if (type.channel.equals(channel)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
