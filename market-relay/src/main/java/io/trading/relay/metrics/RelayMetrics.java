package io.trading.relay.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.marketdata.model.DataChannel;

/**
 * Prometheus metrics collector for the Market Relay.
 *
 * Tracks:
 * - Upstream frames received and decode errors
 * - State changes per channel
 * - Pushes sent, dropped and failed per channel
 * - Subscribers closed for falling behind
 * - Subscriber commands per action and outcome
 * - Upstream connection status and open subscriber connections
 */
public class RelayMetrics {

    private final CollectorRegistry registry;

    // Counters
    private final Counter framesReceived;
    private final Counter decodeErrors;
    private final Counter reconnectAttempts;
    private final Counter stateChanges;
    private final Counter pushesSent;
    private final Counter pushesDropped;
    private final Counter pushFailures;
    private final Counter slowSubscribersClosed;
    private final Counter commands;

    // Gauges
    private final Gauge upstreamConnected;
    private final Gauge subscriberConnections;

    // Histogram (upstream frame size distribution)
    private final Histogram frameSize;

    /**
     * Creates metrics registered in the default registry, together with the JVM metrics.
     */
    public RelayMetrics() {
        this(CollectorRegistry.defaultRegistry);
        DefaultExports.initialize();
    }

    /**
     * Creates metrics registered in the given registry.
     */
    public RelayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.framesReceived = Counter.build()
            .name("relay_feed_frames_received_total")
            .help("Total number of frames received from the upstream feed")
            .register(registry);

        this.decodeErrors = Counter.build()
            .name("relay_feed_decode_errors_total")
            .help("Total number of upstream entries or frames that could not be decoded")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("relay_feed_reconnect_attempts_total")
            .help("Total number of upstream reconnection attempts")
            .register(registry);

        this.stateChanges = Counter.build()
            .name("relay_state_changes_total")
            .help("Total number of instrument state changes")
            .labelNames("channel")
            .register(registry);

        this.pushesSent = Counter.build()
            .name("relay_pushes_sent_total")
            .help("Total number of change pushes written to subscribers")
            .labelNames("channel")
            .register(registry);

        this.pushesDropped = Counter.build()
            .name("relay_pushes_dropped_total")
            .help("Total number of change pushes skipped because the subscriber was not writable")
            .labelNames("channel")
            .register(registry);

        this.pushFailures = Counter.build()
            .name("relay_push_failures_total")
            .help("Total number of subscriber writes that failed")
            .register(registry);

        this.slowSubscribersClosed = Counter.build()
            .name("relay_slow_subscribers_closed_total")
            .help("Total number of subscriber connections closed because they fell behind")
            .register(registry);

        this.commands = Counter.build()
            .name("relay_commands_total")
            .help("Total number of subscriber commands")
            .labelNames("action", "result")
            .register(registry);

        this.upstreamConnected = Gauge.build()
            .name("relay_feed_connected")
            .help("Upstream feed connection status (1 = connected, 0 = disconnected)")
            .register(registry);

        this.subscriberConnections = Gauge.build()
            .name("relay_subscriber_connections")
            .help("Number of open subscriber connections")
            .register(registry);

        this.frameSize = Histogram.build()
            .name("relay_feed_frame_size_bytes")
            .help("Upstream frame size distribution in bytes")
            .buckets(100, 1000, 10000, 100000, 1000000)
            .register(registry);
    }

    public void recordFrameReceived(int sizeChars) {
        framesReceived.inc();
        frameSize.observe(sizeChars);
    }

    public void recordDecodeErrors(int count) {
        if (count > 0) {
            decodeErrors.inc(count);
        }
    }

    public void recordReconnectAttempt() {
        reconnectAttempts.inc();
    }

    public void recordStateChange(DataChannel channel) {
        stateChanges.labels(channel.getWireName()).inc();
    }

    public void recordPushSent(DataChannel channel) {
        pushesSent.labels(channel.getWireName()).inc();
    }

    public void recordPushDropped(DataChannel channel) {
        pushesDropped.labels(channel.getWireName()).inc();
    }

    public void recordPushFailure() {
        pushFailures.inc();
    }

    public void recordSlowSubscriberClosed() {
        slowSubscribersClosed.inc();
    }

    /**
     * Records a subscriber command.
     *
     * @param action Action name, or "invalid" for commands that did not parse
     * @param result Outcome, e.g. "accepted" or "rejected"
     */
    public void recordCommand(String action, String result) {
        commands.labels(action, result).inc();
    }

    public void setUpstreamConnected(boolean connected) {
        upstreamConnected.set(connected ? 1 : 0);
    }

    public void incrementSubscriberConnections() {
        subscriberConnections.inc();
    }

    public void decrementSubscriberConnections() {
        subscriberConnections.dec();
    }

    /**
     * Returns the CollectorRegistry for the HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    public double getFramesReceived() {
        return framesReceived.get();
    }

    public double getDecodeErrors() {
        return decodeErrors.get();
    }

    public double getPushesSent(DataChannel channel) {
        return pushesSent.labels(channel.getWireName()).get();
    }

    public double getPushesDropped(DataChannel channel) {
        return pushesDropped.labels(channel.getWireName()).get();
    }

    public double getSlowSubscribersClosed() {
        return slowSubscribersClosed.get();
    }

    public double getCommands(String action, String result) {
        return commands.labels(action, result).get();
    }

    public double getSubscriberConnections() {
        return subscriberConnections.get();
    }
}
