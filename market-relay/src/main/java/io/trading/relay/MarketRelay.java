package io.trading.relay;

import io.trading.relay.config.RelayConfig;
import io.trading.relay.core.RelayController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Market Relay application.
 */
public class MarketRelay {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarketRelay.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Market Relay Starting...");
        LOGGER.info("========================================");

        try {
            // Load configuration from environment variables
            RelayConfig config = RelayConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Relay ID: {}", config.relayId());
            LOGGER.info("  Feed: {}", config.hasFeed() ? config.feedUri() : "none");
            LOGGER.info("  Instruments: {}", config.instruments().size());
            LOGGER.info("  Listen: {}:{}", config.listenHost(), config.listenPort());
            LOGGER.info("  Market end: {}", config.marketEndTime() == null ? "none" : config.marketEndTime());

            RelayController controller = new RelayController(config);
            controller.start();

            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.waitForShutdown();

            controller.close();

        } catch (Exception e) {
            LOGGER.error("Fatal error in Market Relay", e);
            System.exit(1);
        }

        LOGGER.info("Market Relay exited");
    }
}
