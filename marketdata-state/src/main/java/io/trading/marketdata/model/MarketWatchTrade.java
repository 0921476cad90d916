package io.trading.marketdata.model;

import java.time.LocalTime;
import java.util.List;

/**
 * One instrument's row of a market-wide trade snapshot.
 * The market watch reports the last trade as a time of day only.
 *
 * @param identification Instrument identity, including its tsetmc code
 * @param candle         Trade statistics; its last trade time is ignored
 * @param lastTradeTime  Time of day of the last trade
 * @param orderBook      Depth rows, rank 0 first
 */
public record MarketWatchTrade(
    InstrumentIdentification identification,
    Candle candle,
    LocalTime lastTradeTime,
    List<OrderBookRow> orderBook
) {
    public MarketWatchTrade {
        if (identification == null) {
            throw new IllegalArgumentException("identification cannot be null");
        }
        if (candle == null) {
            throw new IllegalArgumentException("candle cannot be null");
        }
        orderBook = orderBook == null ? List.of() : List.copyOf(orderBook);
    }
}
