package kr.lsfeed.config;

import kr.lsfeed.domain.stream.Market;
import kr.lsfeed.util.Env;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration for the streaming session, subscription registry and VI cascade.
 *
 * Built from environment variables by {@link #fromEnv()}; call {@link #validate()}
 * before wiring anything so the process refuses to start with a broken config.
 */
public record StreamConfig(
    URI endpoint,
    String token,
    int maxSubscriptions,
    int maxReconnectAttempts,
    Duration reconnectBaseDelay,
    Duration reconnectMaxDelay,
    Duration keepaliveInterval,
    Duration keepaliveTimeout,
    Duration handshakeTimeout,
    Duration viUnsubscribeGrace,
    int inboundQueueCapacity,
    int outboundQueueCapacity,
    Market defaultMarket,
    int metricsPort
) {
    public static final String DEFAULT_ENDPOINT = "wss://openapi.ls-sec.co.kr:9443/websocket";

    /**
     * Load configuration from the environment, falling back to the feed's documented defaults.
     */
    public static StreamConfig fromEnv() {
        return new StreamConfig(
            URI.create(Env.get("LS_WS_URL", DEFAULT_ENDPOINT)),
            Env.get("LS_ACCESS_TOKEN", ""),
            Env.getInt("WS_MAX_SUBSCRIPTIONS", 100),
            Env.getInt("WS_MAX_RECONNECT_ATTEMPTS", 5),
            Env.getSeconds("WS_RECONNECT_INTERVAL", 5),
            Env.getSeconds("WS_RECONNECT_MAX_DELAY", 30),
            Env.getSeconds("WS_PING_INTERVAL", 30),
            Env.getSeconds("WS_PING_TIMEOUT", 10),
            Env.getSeconds("WS_CONNECT_TIMEOUT", 30),
            Env.getSeconds("VI_UNSUBSCRIBE_DELAY", 180),
            Env.getInt("WS_INBOUND_QUEUE", 10_000),
            Env.getInt("WS_OUTBOUND_QUEUE", 1_000),
            Market.valueOf(Env.get("VI_DEFAULT_MARKET", "KOSPI").toUpperCase(Locale.ROOT)),
            Env.getInt("METRICS_PORT", 0)
        );
    }

    /**
     * Same values with a different token. Used after an access token refresh.
     */
    public StreamConfig withToken(String newToken) {
        return new StreamConfig(endpoint, newToken, maxSubscriptions, maxReconnectAttempts,
            reconnectBaseDelay, reconnectMaxDelay, keepaliveInterval, keepaliveTimeout,
            handshakeTimeout, viUnsubscribeGrace, inboundQueueCapacity, outboundQueueCapacity,
            defaultMarket, metricsPort);
    }

    /**
     * Validate configuration values.
     *
     * @throws IllegalStateException listing every invalid value
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        String scheme = endpoint == null ? null : endpoint.getScheme();
        if (scheme == null || !(scheme.equals("ws") || scheme.equals("wss"))) {
            problems.add("LS_WS_URL must be a ws:// or wss:// URL (was " + endpoint + ")");
        }
        if (token == null || token.isBlank()) {
            problems.add("LS_ACCESS_TOKEN is required");
        }
        if (maxSubscriptions <= 0) {
            problems.add("WS_MAX_SUBSCRIPTIONS must be positive");
        }
        if (maxReconnectAttempts <= 0) {
            problems.add("WS_MAX_RECONNECT_ATTEMPTS must be positive");
        }
        if (!isPositive(reconnectBaseDelay) || !isPositive(reconnectMaxDelay)) {
            problems.add("WS_RECONNECT_INTERVAL and WS_RECONNECT_MAX_DELAY must be positive");
        } else if (reconnectBaseDelay.compareTo(reconnectMaxDelay) > 0) {
            problems.add("WS_RECONNECT_INTERVAL cannot exceed WS_RECONNECT_MAX_DELAY");
        }
        if (!isPositive(keepaliveInterval) || !isPositive(keepaliveTimeout)) {
            problems.add("WS_PING_INTERVAL and WS_PING_TIMEOUT must be positive");
        }
        if (!isPositive(handshakeTimeout)) {
            problems.add("WS_CONNECT_TIMEOUT must be positive");
        }
        if (viUnsubscribeGrace == null || viUnsubscribeGrace.isNegative()) {
            problems.add("VI_UNSUBSCRIBE_DELAY cannot be negative");
        }
        if (inboundQueueCapacity <= 0 || outboundQueueCapacity <= 0) {
            problems.add("WS_INBOUND_QUEUE and WS_OUTBOUND_QUEUE must be positive");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            problems.add("METRICS_PORT must be between 0 and 65535");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid stream configuration:\n  - "
                + String.join("\n  - ", problems));
        }
    }

    /**
     * Token masked for logs: first four characters only.
     */
    public String maskedToken() {
        if (token == null || token.length() <= 4) return "***";
        return token.substring(0, 4) + "***";
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }
}
