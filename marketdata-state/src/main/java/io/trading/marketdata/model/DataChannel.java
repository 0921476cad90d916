package io.trading.marketdata.model;

import java.util.Optional;

/**
 * Data categories carried by both feed protocols, keyed by their wire name.
 */
public enum DataChannel {
    THRESHOLDS("thresholds"),
    TRADE("trade"),
    ORDERBOOK("orderbook"),
    CLIENTTYPE("clienttype");

    private final String wireName;

    DataChannel(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Looks up a channel by the name used on the wire.
     *
     * @param wireName The channel name, e.g. "trade"
     * @return The channel, or empty if the name is not recognised
     */
    public static Optional<DataChannel> fromWireName(String wireName) {
        for (DataChannel channel : values()) {
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
