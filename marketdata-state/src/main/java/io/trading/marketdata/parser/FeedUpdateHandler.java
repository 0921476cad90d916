package io.trading.marketdata.parser;

import io.trading.marketdata.model.Candle;
import io.trading.marketdata.model.PriceLimits;

/**
 * Handler interface for field updates decoded from the upstream feed.
 */
public interface FeedUpdateHandler {

    /**
     * Called when a trade entry is decoded.
     */
    void onTrade(String isin, Candle candle);

    /**
     * Called when a thresholds entry is decoded.
     */
    void onThresholds(String isin, PriceLimits priceLimits);
}
