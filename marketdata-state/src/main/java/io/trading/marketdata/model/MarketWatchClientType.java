package io.trading.marketdata.model;

/**
 * One instrument's row of a market-wide client type snapshot, keyed by tsetmc code.
 */
public record MarketWatchClientType(String tsetmcCode, ClientType clientType) {

    public MarketWatchClientType {
        if (tsetmcCode == null || tsetmcCode.isEmpty()) {
            throw new IllegalArgumentException("tsetmcCode cannot be null or empty");
        }
        if (clientType == null) {
            throw new IllegalArgumentException("clientType cannot be null");
        }
    }
}
