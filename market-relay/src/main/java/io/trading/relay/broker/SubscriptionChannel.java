package io.trading.relay.broker;

import io.trading.marketdata.model.DataChannel;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Channels a subscriber can ask for. {@link #ALL} fans into the other three.
 */
public enum SubscriptionChannel {
    ALL("all"),
    TRADE("trade"),
    ORDERBOOK("orderbook"),
    CLIENTTYPE("clienttype");

    private final String wireName;

    SubscriptionChannel(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Data channels included in the initial snapshot of a subscription.
     */
    public Set<DataChannel> snapshotChannels() {
        return switch (this) {
            case ALL -> EnumSet.allOf(DataChannel.class);
            case TRADE -> EnumSet.of(DataChannel.TRADE);
            case ORDERBOOK -> EnumSet.of(DataChannel.ORDERBOOK);
            case CLIENTTYPE -> EnumSet.of(DataChannel.CLIENTTYPE);
        };
    }

    public static Optional<SubscriptionChannel> fromWireName(String wireName) {
        for (SubscriptionChannel channel : values()) {
            if (channel.wireName.equals(wireName)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
