package io.trading.marketdata.repository;

import io.trading.marketdata.model.Candle;
import io.trading.marketdata.model.ClientType;
import io.trading.marketdata.model.InstrumentIdentification;
import io.trading.marketdata.model.InstrumentSnapshot;
import io.trading.marketdata.model.OrderBook;
import io.trading.marketdata.model.OrderBookRow;
import io.trading.marketdata.model.PriceLimits;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Mutable record of one instrument. Only {@link MarketStateRepository} holds instances,
 * and only while holding its lock.
 */
final class Instrument {

    private final InstrumentIdentification identification;
    private final OrderBookRow[] orderBook;
    private Candle candle = Candle.empty();
    private ClientType clientType = ClientType.empty();
    private PriceLimits priceLimits = PriceLimits.empty();

    Instrument(InstrumentIdentification identification) {
        this.identification = identification;
        this.orderBook = OrderBook.emptyRows().toArray(new OrderBookRow[0]);
    }

    InstrumentIdentification identification() {
        return identification;
    }

    /**
     * Replaces the candle unless it reports the last trade time already recorded.
     *
     * @return true if the candle was replaced
     */
    boolean updateCandle(Candle update) {
        LocalTime stored = candle.lastTradeTimeOfDay();
        LocalTime incoming = update.lastTradeTimeOfDay();
        if (stored == null && incoming == null) {
            if (candle.equals(update)) {
                return false;
            }
        } else if (Objects.equals(stored, incoming)) {
            return false;
        }
        candle = update;
        return true;
    }

    boolean updatePriceLimits(PriceLimits update) {
        if (priceLimits.equals(update)) {
            return false;
        }
        priceLimits = update;
        return true;
    }

    boolean updateClientType(ClientType update) {
        if (clientType.equals(update)) {
            return false;
        }
        clientType = update;
        return true;
    }

    /**
     * Overwrites the rows that differ from the stored ones.
     *
     * @param rows Rows by rank; may be shorter than the book
     * @return Ranks that were overwritten, ascending
     */
    List<Integer> updateOrderBook(List<OrderBookRow> rows) {
        if (rows.size() > orderBook.length) {
            throw new IllegalArgumentException(
                "order book has " + orderBook.length + " ranks, got " + rows.size() + " rows");
        }
        List<Integer> changed = new ArrayList<>();
        for (int rank = 0; rank < rows.size(); rank++) {
            OrderBookRow row = rows.get(rank);
            if (row != null && !row.equals(orderBook[rank])) {
                orderBook[rank] = row;
                changed.add(rank);
            }
        }
        return changed;
    }

    InstrumentSnapshot snapshot() {
        return new InstrumentSnapshot(identification, candle, Arrays.asList(orderBook), clientType, priceLimits);
    }
}
