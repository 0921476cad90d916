package io.trading.relay.config;

import io.trading.marketdata.model.InstrumentIdentification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the Market Relay.
 *
 * @param relayId             Relay instance identifier, used in logs and status
 * @param feedUri             Upstream push feed (ws:// or wss://), null to run without ingestion
 * @param instruments         ISINs requested from the upstream feed
 * @param listenHost          Address the subscriber websocket server binds to
 * @param listenPort          Port of the subscriber websocket server, 0 for an ephemeral port
 * @param writeTimeoutMs      A subscriber write pending longer than this closes the connection
 * @param reconnectMaxRetries Maximum consecutive upstream reconnect attempts (-1 for unlimited)
 * @param metricsPort         Port for the Prometheus metrics HTTP server, 0 to disable it
 * @param marketEndTime       Time of day at which the relay shuts down, null to run until signalled
 */
public record RelayConfig(
    String relayId,
    URI feedUri,
    Set<String> instruments,
    String listenHost,
    int listenPort,
    int writeTimeoutMs,
    int reconnectMaxRetries,
    int metricsPort,
    LocalTime marketEndTime
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(RelayConfig.class);

    private static final String DEFAULT_LISTEN_HOST = "localhost";
    private static final int DEFAULT_LISTEN_PORT = 8765;
    private static final int DEFAULT_WRITE_TIMEOUT_MS = 5000;
    private static final int DEFAULT_RECONNECT_MAX_RETRIES = 10;
    private static final int DEFAULT_METRICS_PORT = 9090;
    private static final LocalTime DEFAULT_MARKET_END_TIME = LocalTime.of(12, 30);

    public RelayConfig {
        if (relayId == null || relayId.isEmpty()) {
            throw new IllegalArgumentException("relayId cannot be null or empty");
        }
        if (feedUri != null && !"ws".equals(feedUri.getScheme()) && !"wss".equals(feedUri.getScheme())) {
            throw new IllegalArgumentException("feedUri must be a ws:// or wss:// URI: " + feedUri);
        }
        // keeps configuration order, which is also the order of the upstream subscribe request
        instruments = instruments == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(instruments));
        for (String isin : instruments) {
            if (!InstrumentIdentification.isValidIsin(isin)) {
                throw new IllegalArgumentException("Invalid instrument ISIN: " + isin);
            }
        }
        if (feedUri != null && instruments.isEmpty()) {
            throw new IllegalArgumentException("instruments cannot be empty when a feed is configured");
        }
        if (listenHost == null || listenHost.isEmpty()) {
            throw new IllegalArgumentException("listenHost cannot be null or empty");
        }
        if (listenPort < 0 || listenPort > 65535) {
            throw new IllegalArgumentException("listenPort must be between 0 and 65535");
        }
        if (writeTimeoutMs <= 0) {
            throw new IllegalArgumentException("writeTimeoutMs must be positive");
        }
        if (reconnectMaxRetries < -1) {
            throw new IllegalArgumentException("reconnectMaxRetries must be -1 or greater");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 0 and 65535");
        }
    }

    /**
     * Returns whether an upstream feed is configured.
     */
    public boolean hasFeed() {
        return feedUri != null;
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - RELAY_ID: Relay instance ID (default: "relay-0")
     * - FEED_URI: Upstream feed, e.g. "ws://feed-host:8765" (default: none)
     * - INSTRUMENTS: Comma-separated ISINs requested upstream
     * - LISTEN_HOST / LISTEN_PORT: Subscriber server address (default: localhost:8765)
     * - WRITE_TIMEOUT_MS: Subscriber write timeout (default: 5000)
     * - RECONNECT_MAX_RETRIES: Upstream reconnect attempts (default: 10)
     * - METRICS_PORT: Metrics HTTP port, 0 disables (default: 9090)
     * - MARKET_END_TIME: Shutdown time of day, "none" disables (default: 12:30)
     */
    public static RelayConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Loads configuration from a map of environment-style variables.
     */
    public static RelayConfig fromMap(Map<String, String> env) {
        String feed = valueOrDefault(env, "FEED_URI", "");
        String endTime = valueOrDefault(env, "MARKET_END_TIME", DEFAULT_MARKET_END_TIME.toString());

        return new RelayConfig(
            valueOrDefault(env, "RELAY_ID", "relay-0"),
            feed.isEmpty() ? null : URI.create(feed),
            parseInstruments(valueOrDefault(env, "INSTRUMENTS", "")),
            valueOrDefault(env, "LISTEN_HOST", DEFAULT_LISTEN_HOST),
            parseInt(env, "LISTEN_PORT", DEFAULT_LISTEN_PORT),
            parseInt(env, "WRITE_TIMEOUT_MS", DEFAULT_WRITE_TIMEOUT_MS),
            parseInt(env, "RECONNECT_MAX_RETRIES", DEFAULT_RECONNECT_MAX_RETRIES),
            parseInt(env, "METRICS_PORT", DEFAULT_METRICS_PORT),
            parseTime(endTime)
        );
    }

    private static String valueOrDefault(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static LocalTime parseTime(String value) {
        if ("none".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid MARKET_END_TIME: " + value, e);
        }
    }

    private static Set<String> parseInstruments(String value) {
        Set<String> isins = new LinkedHashSet<>();
        Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .forEach(isins::add);
        return isins;
    }

    /**
     * Identifications of the configured instruments.
     */
    public List<InstrumentIdentification> instrumentIdentifications() {
        List<InstrumentIdentification> result = new ArrayList<>(instruments.size());
        for (String isin : instruments) {
            result.add(InstrumentIdentification.ofIsin(isin));
        }
        return result;
    }

    /**
     * Creates a new builder for RelayConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for RelayConfig.
     */
    public static class Builder {
        private String relayId = "relay-0";
        private URI feedUri;
        private final Set<String> instruments = new LinkedHashSet<>();
        private String listenHost = DEFAULT_LISTEN_HOST;
        private int listenPort = DEFAULT_LISTEN_PORT;
        private int writeTimeoutMs = DEFAULT_WRITE_TIMEOUT_MS;
        private int reconnectMaxRetries = DEFAULT_RECONNECT_MAX_RETRIES;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private LocalTime marketEndTime = DEFAULT_MARKET_END_TIME;

        public Builder relayId(String relayId) {
            this.relayId = relayId;
            return this;
        }

        public Builder feedUri(URI feedUri) {
            this.feedUri = feedUri;
            return this;
        }

        public Builder addInstrument(String... isins) {
            this.instruments.addAll(Arrays.asList(isins));
            return this;
        }

        public Builder listenHost(String listenHost) {
            this.listenHost = listenHost;
            return this;
        }

        public Builder listenPort(int listenPort) {
            this.listenPort = listenPort;
            return this;
        }

        public Builder writeTimeoutMs(int writeTimeoutMs) {
            this.writeTimeoutMs = writeTimeoutMs;
            return this;
        }

        public Builder reconnectMaxRetries(int reconnectMaxRetries) {
            this.reconnectMaxRetries = reconnectMaxRetries;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder marketEndTime(LocalTime marketEndTime) {
            this.marketEndTime = marketEndTime;
            return this;
        }

        public RelayConfig build() {
            return new RelayConfig(
                relayId,
                feedUri,
                instruments,
                listenHost,
                listenPort,
                writeTimeoutMs,
                reconnectMaxRetries,
                metricsPort,
                marketEndTime
            );
        }
    }
}
