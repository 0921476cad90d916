package io.trading.relay.broker;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.trading.marketdata.encoder.json.ChannelPayloadEncoder;
import io.trading.marketdata.model.DataChannel;
import io.trading.marketdata.model.InstrumentSnapshot;
import io.trading.marketdata.repository.ChangeNotification;
import io.trading.marketdata.repository.ChangeSink;
import io.trading.marketdata.repository.MarketStateRepository;
import io.trading.relay.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks which subscriber connection wants which instrument on which channel,
 * answers subscribe commands with a snapshot and fans state changes out.
 *
 * The broker lock only guards the subscriber sets. It is never held while calling
 * into the repository or writing to a connection. Writes are non-blocking, so a slow
 * subscriber cannot delay delivery to the others. A subscriber whose outbound buffer is
 * full when a change arrives is closed rather than left with a gap in its state.
 */
public class SubscriptionBroker implements ChangeSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionBroker.class);

    private final MarketStateRepository repository;
    private final RelayMetrics metrics;
    private final ChannelPayloadEncoder encoder = ChannelPayloadEncoder.getInstance();

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, InstrumentChannel> instrumentChannels = new HashMap<>();
    private final Set<Channel> connections = new HashSet<>();

    public SubscriptionBroker(MarketStateRepository repository, RelayMetrics metrics) {
        this.repository = repository;
        this.metrics = metrics;
    }

    /**
     * Accepts a subscriber connection. It is dropped from every subscriber set once it closes.
     */
    public void register(Channel connection) {
        lock.lock();
        try {
            if (!connections.add(connection)) {
                return;
            }
        } finally {
            lock.unlock();
        }
        metrics.incrementSubscriberConnections();
        LOGGER.info("[Broker] Subscriber {} connected from {}", connection.id().asShortText(), connection.remoteAddress());
        connection.closeFuture().addListener(future -> unregister(connection));
    }

    /**
     * Removes a connection from every subscriber set.
     */
    public void unregister(Channel connection) {
        lock.lock();
        try {
            if (!connections.remove(connection)) {
                return;
            }
            for (InstrumentChannel instrumentChannel : instrumentChannels.values()) {
                instrumentChannel.removeEverywhere(connection);
            }
        } finally {
            lock.unlock();
        }
        metrics.decrementSubscriberConnections();
        LOGGER.info("[Broker] Subscriber {} disconnected", connection.id().asShortText());
    }

    /**
     * Handles one text message of a subscriber.
     *
     * @return Snapshot to send back, empty for unsubscribes, invalid commands and
     *         subscriptions to instruments the relay does not know
     */
    public Optional<String> handleCommand(Channel connection, String message) {
        SubscriptionCommand command;
        try {
            command = SubscriptionCommand.parse(message);
        } catch (IllegalArgumentException e) {
            LOGGER.error("[Broker] Invalid command from {}: {}", connection.id().asShortText(), e.getMessage());
            metrics.recordCommand("invalid", "rejected");
            return Optional.empty();
        }

        return switch (command.action()) {
            case SUBSCRIBE -> subscribe(connection, command);
            case UNSUBSCRIBE -> unsubscribe(connection, command);
        };
    }

    private Optional<String> subscribe(Channel connection, SubscriptionCommand command) {
        lock.lock();
        try {
            if (!connections.contains(connection)) {
                metrics.recordCommand("subscribe", "closed");
                return Optional.empty();
            }
            for (String isin : command.isins()) {
                instrumentChannels.computeIfAbsent(isin, key -> new InstrumentChannel()).subscribe(command.channel(), connection);
            }
        } finally {
            lock.unlock();
        }
        LOGGER.debug("[Broker] {} subscribed to {} of {}", connection.id().asShortText(), command.channel(), command.isins());

        // Read after joining the sets: a change racing this read is pushed as well, never lost
        Map<String, InstrumentSnapshot> snapshots = repository.snapshots(command.isins());
        if (snapshots.isEmpty()) {
            metrics.recordCommand("subscribe", "unknown");
            return Optional.empty();
        }

        ObjectNode message = encoder.newMessage();
        for (InstrumentSnapshot snapshot : snapshots.values()) {
            for (DataChannel channel : command.channel().snapshotChannels()) {
                encoder.putChannel(message, snapshot, channel);
            }
        }
        metrics.recordCommand("subscribe", "accepted");
        return Optional.of(encoder.encode(message));
    }

    private Optional<String> unsubscribe(Channel connection, SubscriptionCommand command) {
        lock.lock();
        try {
            for (String isin : command.isins()) {
                InstrumentChannel instrumentChannel = instrumentChannels.get(isin);
                if (instrumentChannel != null) {
                    instrumentChannel.unsubscribe(command.channel(), connection);
                }
            }
        } finally {
            lock.unlock();
        }
        LOGGER.debug("[Broker] {} unsubscribed from {} of {}", connection.id().asShortText(), command.channel(), command.isins());
        metrics.recordCommand("unsubscribe", "accepted");
        return Optional.empty();
    }

    @Override
    public void onChange(ChangeNotification notification) {
        metrics.recordStateChange(notification.channel());

        Set<Channel> targets;
        lock.lock();
        try {
            InstrumentChannel instrumentChannel = instrumentChannels.get(notification.isin());
            if (instrumentChannel == null) {
                return;
            }
            targets = instrumentChannel.subscribersOf(notification.channel());
        } finally {
            lock.unlock();
        }
        if (targets.isEmpty()) {
            return;
        }

        String payload = notification.channel() == DataChannel.ORDERBOOK
            ? encoder.encodeOrderBookRanks(notification.snapshot(), notification.changedRanks())
            : encoder.encodeChannel(notification.snapshot(), notification.channel());

        for (Channel target : targets) {
            push(target, payload, notification.channel());
        }
    }

    private void push(Channel target, String payload, DataChannel channel) {
        if (!target.isActive()) {
            return;
        }
        if (!target.isWritable()) {
            // Pushes carry deltas; a subscriber that misses one has to resubscribe for a fresh snapshot
            metrics.recordPushDropped(channel);
            metrics.recordSlowSubscriberClosed();
            LOGGER.warn("[Broker] Subscriber {} is not keeping up, {} push dropped, closing", target.id().asShortText(), channel);
            target.close();
            return;
        }
        target.writeAndFlush(new TextWebSocketFrame(payload)).addListener(future -> {
            if (!future.isSuccess()) {
                metrics.recordPushFailure();
                LOGGER.warn("[Broker] Push to {} failed: {}", target.id().asShortText(), future.cause().toString());
            }
        });
        metrics.recordPushSent(channel);
    }

    /**
     * Where a connection is in its lifecycle.
     */
    public ConnectionState connectionState(Channel connection) {
        lock.lock();
        try {
            if (!connections.contains(connection)) {
                return ConnectionState.CLOSED;
            }
            for (InstrumentChannel instrumentChannel : instrumentChannels.values()) {
                if (instrumentChannel.contains(connection)) {
                    return ConnectionState.ACTIVE;
                }
            }
            return ConnectionState.OPEN;
        } finally {
            lock.unlock();
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Total memberships across all instruments and channels.
     */
    public int subscriptionCount() {
        lock.lock();
        try {
            int count = 0;
            for (InstrumentChannel instrumentChannel : instrumentChannels.values()) {
                count += instrumentChannel.subscriptionCount();
            }
            return count;
        } finally {
            lock.unlock();
        }
    }
}
