package io.trading.marketdata.model;

import java.util.List;

/**
 * Point-in-time read of one instrument's full record.
 * Every component is immutable, so a snapshot can be handed to other threads freely.
 *
 * @param identification Instrument identity
 * @param candle         Intraday trade statistics
 * @param orderBook      Depth rows, rank 0 first, always {@link OrderBook#DEPTH} long
 * @param clientType     Investor-type breakdown
 * @param priceLimits    Allowed price band
 */
public record InstrumentSnapshot(
    InstrumentIdentification identification,
    Candle candle,
    List<OrderBookRow> orderBook,
    ClientType clientType,
    PriceLimits priceLimits
) {
    public InstrumentSnapshot {
        if (identification == null) {
            throw new IllegalArgumentException("identification cannot be null");
        }
        orderBook = List.copyOf(orderBook);
    }

    public String isin() {
        return identification.isin();
    }
}
