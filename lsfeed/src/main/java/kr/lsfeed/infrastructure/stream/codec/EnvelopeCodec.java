package kr.lsfeed.infrastructure.stream.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kr.lsfeed.domain.stream.Envelope;
import kr.lsfeed.domain.stream.EnvelopeHeader;
import kr.lsfeed.domain.stream.StreamMessage;
import kr.lsfeed.infrastructure.stream.data.StreamProtocolException;

/**
 * JSON encoding of outbound envelopes and decoding of inbound frames.
 *
 * Thread-safe: the ObjectMapper is configured once and only read afterwards.
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Envelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode envelope for " + envelope.header().trCd(), e);
        }
    }

    /**
     * Decode one inbound frame.
     *
     * @throws StreamProtocolException if the frame is not a JSON object with a header
     *         and a channel code in the header or body
     */
    public StreamMessage decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new StreamProtocolException(frame, "Empty frame");
        }

        JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new StreamProtocolException(frame, "Malformed JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new StreamProtocolException(frame, "Frame is not a JSON object");
        }

        JsonNode headerNode = root.get("header");
        if (headerNode == null || !headerNode.isObject()) {
            throw new StreamProtocolException(frame, "Frame has no header");
        }

        EnvelopeHeader header;
        try {
            header = mapper.treeToValue(headerNode, EnvelopeHeader.class);
        } catch (JsonProcessingException e) {
            throw new StreamProtocolException(frame, "Invalid header", e);
        }

        JsonNode bodyNode = root.get("body");
        ObjectNode body = bodyNode != null && bodyNode.isObject() ? (ObjectNode) bodyNode : null;

        String channel = firstNonBlank(header.trCd(), text(body, "tr_cd"));
        if (channel == null) {
            throw new StreamProtocolException(frame, "Frame has no channel code");
        }
        String routingKey = firstNonBlank(text(body, "tr_key"), header.trKey());

        return new StreamMessage(header, body, channel, routingKey == null ? "" : routingKey.trim(), frame);
    }

    /**
     * Map the body of a message to a typed record.
     *
     * @throws StreamProtocolException if the message has no body or the body does not fit the type
     */
    public <T> T bodyAs(StreamMessage message, Class<T> type) {
        if (message.body() == null) {
            throw new StreamProtocolException(message.raw(), "Frame has no body for " + type.getSimpleName());
        }
        try {
            return mapper.treeToValue(message.body(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StreamProtocolException(message.raw(), "Cannot map body to " + type.getSimpleName(), e);
        }
    }

    private static String text(ObjectNode node, String field) {
        if (node == null) return null;
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a.trim();
        if (b != null && !b.isBlank()) return b.trim();
        return null;
    }
}
