package kr.lsfeed.domain.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Wire envelope: {"header": {...}, "body": {...}}.
 *
 * The body stays a JSON tree because its fields differ per channel family;
 * typed views are obtained through the codec.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Envelope(
    @JsonProperty("header") EnvelopeHeader header,
    @JsonProperty("body") ObjectNode body
) {
    public Envelope {
        Objects.requireNonNull(header, "header");
    }

    /**
     * Build the register request for a subscription key.
     * The token is left empty; it is stamped when the frame is sent.
     */
    public static Envelope subscribeRequest(SubscriptionKey key) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("tr_cd", key.channel());
        body.put("tr_key", key.routingKey());
        return new Envelope(
            EnvelopeHeader.request("", key.family().registerCode(), key.channel()),
            body
        );
    }

    public Envelope withToken(String token) {
        return new Envelope(header.withToken(token), body);
    }

    /**
     * The matching unregister request: same header and body, family's unregister tr_type.
     */
    public Envelope toUnsubscribe() {
        String channel = header.trCd();
        if (channel == null && body != null && body.hasNonNull("tr_cd")) {
            channel = body.get("tr_cd").asText();
        }
        return new Envelope(header.withTrType(ChannelFamily.of(channel).unregisterCode()), body);
    }
}
