package kr.lsfeed.infrastructure.stream.data;

import kr.lsfeed.domain.stream.SubscriptionKey;

/**
 * Exception raised when a subscribe/unsubscribe is rejected, either by the broker
 * (non-success response code) or locally (subscription capacity reached).
 */
public class StreamSubscriptionException extends RuntimeException {

    private final SubscriptionKey key;
    private final String responseCode;
    private final String responseMessage;

    public StreamSubscriptionException(SubscriptionKey key, String responseCode, String responseMessage) {
        super(String.format("[%s] Subscription rejected (%s): %s", key, responseCode, responseMessage));
        this.key = key;
        this.responseCode = responseCode;
        this.responseMessage = responseMessage;
    }

    public SubscriptionKey getKey() {
        return key;
    }

    public String getResponseCode() {
        return responseCode;
    }

    public String getResponseMessage() {
        return responseMessage;
    }
}
