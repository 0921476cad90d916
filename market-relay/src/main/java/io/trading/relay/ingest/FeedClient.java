package io.trading.relay.ingest;

import io.trading.marketdata.parser.DecodeStats;
import io.trading.marketdata.parser.FeedFrameDecoder;
import io.trading.marketdata.parser.FeedUpdateHandler;
import io.trading.relay.broker.Action;
import io.trading.relay.broker.SubscriptionChannel;
import io.trading.relay.broker.SubscriptionCommand;
import io.trading.relay.metrics.RelayMetrics;
import io.trading.relay.netty.ReconnectHandler;
import io.trading.relay.netty.WebSocketClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Upstream push feed connector.
 * Subscribes to every channel of the configured instruments and hands decoded
 * updates to a {@link FeedUpdateHandler}, normally the market state repository.
 */
public class FeedClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedClient.class);

    private static final String NAME = "Feed";

    private final URI feedUri;
    private final List<String> isins;
    private final FeedFrameDecoder decoder;
    private final FeedUpdateHandler handler;
    private final RelayMetrics metrics;
    private final AtomicLong messageCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);
    private final WebSocketClient client;
    private final ReconnectHandler reconnectHandler;

    /**
     * @param feedUri             Upstream push endpoint
     * @param isins               Instruments to subscribe to
     * @param reconnectMaxRetries Consecutive reconnect attempts before giving up (-1 for unlimited)
     * @param handler             Receiver of decoded updates
     * @param metrics             Relay metrics
     */
    public FeedClient(URI feedUri, Set<String> isins, int reconnectMaxRetries,
                      FeedUpdateHandler handler, RelayMetrics metrics) {
        if (isins.isEmpty()) {
            throw new IllegalArgumentException("At least one instrument is required");
        }
        this.feedUri = feedUri;
        this.isins = List.copyOf(isins);
        this.decoder = new FeedFrameDecoder(isins);
        this.handler = handler;
        this.metrics = metrics;
        this.client = new WebSocketClient(
            feedUri,
            NAME,
            this::onMessage,
            this::onError,
            this::onConnected,
            this::onDisconnected
        );
        this.reconnectHandler = new ReconnectHandler(NAME, reconnectMaxRetries, this::reconnect,
            metrics::recordReconnectAttempt);
    }

    /**
     * Connects to the feed. Later connection losses are recovered in the background.
     *
     * @throws IOException if the first connection attempt fails
     */
    public void connect() throws IOException {
        reconnectHandler.start();
        LOGGER.info("[Feed] Connecting to {} for {} instruments", feedUri, isins.size());
        client.connect();
    }

    /**
     * Retries the connection in the background, e.g. after the first attempt failed.
     */
    public void scheduleReconnect() {
        reconnectHandler.scheduleReconnect();
    }

    /**
     * Subscription message sent after every successful handshake.
     */
    String subscribeMessage() {
        return new SubscriptionCommand(Action.SUBSCRIBE, SubscriptionChannel.ALL, isins).toWireFormat();
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    public long getMessageCount() {
        return messageCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    @Override
    public void close() {
        reconnectHandler.stop();
        client.close();
        metrics.setUpstreamConnected(false);
        LOGGER.info("[Feed] Closed");
    }

    private void reconnect() {
        try {
            client.connect();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void onConnected() {
        reconnectHandler.reset();
        metrics.setUpstreamConnected(true);
        if (client.send(subscribeMessage())) {
            LOGGER.info("[Feed] Subscribed to {} instruments", isins.size());
        }
    }

    private void onDisconnected() {
        metrics.setUpstreamConnected(false);
        LOGGER.warn("[Feed] Disconnected, scheduling reconnect...");
        reconnectHandler.scheduleReconnect();
    }

    void onMessage(String frame) {
        messageCount.incrementAndGet();
        metrics.recordFrameReceived(frame.length());
        try {
            DecodeStats stats = decoder.decode(frame, handler);
            if (stats.errors() > 0) {
                errorCount.addAndGet(stats.errors());
                metrics.recordDecodeErrors(stats.errors());
            }
            LOGGER.trace("[Feed] Frame decoded: {} applied, {} ignored, {} errors",
                stats.applied(), stats.ignored(), stats.errors());
        } catch (IllegalArgumentException e) {
            errorCount.incrementAndGet();
            metrics.recordDecodeErrors(1);
            LOGGER.error("[Feed] Dropping undecodable frame: {}", e.getMessage());
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            metrics.recordDecodeErrors(1);
            LOGGER.error("[Feed] Error processing frame", e);
        }
    }

    private void onError(Throwable error) {
        errorCount.incrementAndGet();
        LOGGER.error("[Feed] Connection error: {}", error.getMessage());
    }
}
