package io.trading.relay.core;

import io.trading.marketdata.model.InstrumentIdentification;
import io.trading.marketdata.repository.MarketStateRepository;
import io.trading.relay.broker.SubscriptionBroker;
import io.trading.relay.config.RelayConfig;
import io.trading.relay.ingest.FeedClient;
import io.trading.relay.metrics.MetricsServer;
import io.trading.relay.metrics.RelayMetrics;
import io.trading.relay.metrics.RelayStatus;
import io.trading.relay.netty.RelayServer;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Main controller for the Market Relay.
 * Wires the feed client, the state repository, the subscription broker and the servers.
 */
public class RelayController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayController.class);

    private final RelayConfig config;
    private final RelayMetrics metrics;
    private final MarketStateRepository repository;
    private final SubscriptionBroker broker;
    private final RelayServer server;
    private final FeedClient feedClient;
    private final MetricsServer metricsServer;
    private final MarketSessionGate sessionGate;
    private final ShutdownSignalBarrier shutdownBarrier;

    public RelayController(RelayConfig config) {
        this(config, new RelayMetrics(), Clock.systemDefaultZone());
    }

    public RelayController(RelayConfig config, RelayMetrics metrics, Clock clock) {
        this.config = config;
        this.metrics = metrics;
        this.repository = new MarketStateRepository(clock);
        for (InstrumentIdentification identification : config.instrumentIdentifications()) {
            repository.register(identification);
        }

        this.broker = new SubscriptionBroker(repository, metrics);
        repository.registerChangeSink(broker);

        this.server = new RelayServer(config.listenHost(), config.listenPort(), config.writeTimeoutMs(), broker);
        this.feedClient = config.hasFeed()
            ? new FeedClient(config.feedUri(), config.instruments(), config.reconnectMaxRetries(), repository, metrics)
            : null;
        this.metricsServer = config.metricsPort() > 0
            ? new MetricsServer(config.metricsPort(), metrics, config, this::status)
            : null;
        this.shutdownBarrier = new ShutdownSignalBarrier();
        this.sessionGate = config.marketEndTime() != null
            ? new MarketSessionGate(config.marketEndTime(), clock, shutdownBarrier::signal)
            : null;

        LOGGER.info("Relay controller initialized: {}", config.relayId());
    }

    /**
     * Starts the subscriber server, the metrics server and the feed client.
     *
     * @throws IOException if a listening socket cannot be bound
     */
    public void start() throws IOException {
        LOGGER.info("Starting Market Relay...");

        server.start();

        if (metricsServer != null) {
            metricsServer.start();
        }

        if (feedClient != null) {
            try {
                feedClient.connect();
            } catch (IOException e) {
                LOGGER.error("Feed connection failed, retrying in background: {}", e.getMessage());
                feedClient.scheduleReconnect();
            }
        } else {
            LOGGER.info("No feed configured, serving {} registered instruments", repository.size());
        }

        if (sessionGate != null) {
            sessionGate.start();
        }

        LOGGER.info("Market Relay started on port {}", server.getPort());
    }

    /**
     * Waits for shutdown signal.
     */
    public void waitForShutdown() {
        LOGGER.info("Relay running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Current status, as served by the status endpoint.
     */
    public RelayStatus status() {
        return new RelayStatus(
            feedClient != null,
            feedClient != null && feedClient.isConnected(),
            feedClient == null ? 0 : feedClient.getMessageCount(),
            feedClient == null ? 0 : feedClient.getErrorCount(),
            repository.size(),
            broker.connectionCount(),
            broker.subscriptionCount()
        );
    }

    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }

    public MarketStateRepository getRepository() {
        return repository;
    }

    public SubscriptionBroker getBroker() {
        return broker;
    }

    public RelayMetrics getMetrics() {
        return metrics;
    }

    /**
     * Bound subscriber port, or -1 before {@link #start()}.
     */
    public int getServerPort() {
        return server.getPort();
    }

    /**
     * Stops the relay gracefully.
     */
    public void shutdown() {
        LOGGER.info("Shutting down Market Relay...");
        CloseHelper.closeAll(sessionGate, feedClient, server, metricsServer);
        LOGGER.info("Market Relay shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }
}
