package io.trading.marketdata.model;

/**
 * Buy and sell activity of one investor class (legal or natural).
 */
public record ClientTypeGroup(ClientTypeFlow buy, ClientTypeFlow sell) {

    private static final ClientTypeGroup EMPTY = new ClientTypeGroup(ClientTypeFlow.empty(), ClientTypeFlow.empty());

    public ClientTypeGroup {
        if (buy == null || sell == null) {
            throw new IllegalArgumentException("buy and sell cannot be null");
        }
    }

    public static ClientTypeGroup empty() {
        return EMPTY;
    }
}
