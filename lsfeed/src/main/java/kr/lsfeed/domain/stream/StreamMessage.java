package kr.lsfeed.domain.stream;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A decoded inbound frame.
 *
 * @param header  envelope header (never null)
 * @param body    envelope body, or null when the frame had none
 * @param channel channel code taken from the header, else from the body
 * @param routingKey routing key taken from the body, else from the header, else ""
 * @param raw     original frame text
 */
public record StreamMessage(
    EnvelopeHeader header,
    ObjectNode body,
    String channel,
    String routingKey,
    String raw
) {
    public ChannelFamily family() {
        return ChannelFamily.of(channel);
    }

    public SubscriptionKey key() {
        return new SubscriptionKey(channel, routingKey);
    }

    public boolean hasResponseCode() {
        return header.rspCd() != null && !header.rspCd().isBlank();
    }

    /**
     * A broker response carrying a non-success code. Never treated as data.
     */
    public boolean isErrorResponse() {
        return hasResponseCode() && !ChannelCodes.RESPONSE_OK.equals(header.rspCd());
    }

    /**
     * A success response to a subscribe/unsubscribe request with nothing to deliver.
     */
    public boolean isAcknowledgement() {
        return hasResponseCode() && !isErrorResponse() && (body == null || body.isEmpty());
    }

    /**
     * Text value of a body field, or null.
     */
    public String bodyText(String field) {
        if (body == null || !body.hasNonNull(field)) return null;
        return body.get(field).asText();
    }
}
