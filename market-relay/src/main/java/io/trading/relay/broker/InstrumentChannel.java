package io.trading.relay.broker;

import io.netty.channel.Channel;
import io.trading.marketdata.model.DataChannel;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Subscriber sets of one instrument. Not thread-safe; guarded by the broker's lock.
 */
final class InstrumentChannel {

    private final Set<Channel> tradeSubscribers = new HashSet<>();
    private final Set<Channel> orderBookSubscribers = new HashSet<>();
    private final Set<Channel> clientTypeSubscribers = new HashSet<>();

    void subscribe(SubscriptionChannel channel, Channel connection) {
        for (Set<Channel> subscribers : sets(channel)) {
            subscribers.add(connection);
        }
    }

    void unsubscribe(SubscriptionChannel channel, Channel connection) {
        for (Set<Channel> subscribers : sets(channel)) {
            subscribers.remove(connection);
        }
    }

    void removeEverywhere(Channel connection) {
        unsubscribe(SubscriptionChannel.ALL, connection);
    }

    boolean contains(Channel connection) {
        return tradeSubscribers.contains(connection)
            || orderBookSubscribers.contains(connection)
            || clientTypeSubscribers.contains(connection);
    }

    int subscriptionCount() {
        return tradeSubscribers.size() + orderBookSubscribers.size() + clientTypeSubscribers.size();
    }

    /**
     * Copy of the connections that receive changes of the given data channel.
     * Price limit changes go to trade subscribers.
     */
    Set<Channel> subscribersOf(DataChannel channel) {
        Set<Channel> subscribers = switch (channel) {
            case THRESHOLDS, TRADE -> tradeSubscribers;
            case ORDERBOOK -> orderBookSubscribers;
            case CLIENTTYPE -> clientTypeSubscribers;
        };
        return Set.copyOf(subscribers);
    }

    private List<Set<Channel>> sets(SubscriptionChannel channel) {
        return switch (channel) {
            case ALL -> List.of(tradeSubscribers, orderBookSubscribers, clientTypeSubscribers);
            case TRADE -> List.of(tradeSubscribers);
            case ORDERBOOK -> List.of(orderBookSubscribers);
            case CLIENTTYPE -> List.of(clientTypeSubscribers);
        };
    }
}
