package io.trading.marketdata.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order book constants and helpers.
 */
public final class OrderBook {

    /**
     * Number of ranks kept per instrument. Rank 0 is the best row.
     */
    public static final int DEPTH = 3;

    private OrderBook() {
    }

    /**
     * Creates an order book where every rank is empty.
     */
    public static List<OrderBookRow> emptyRows() {
        List<OrderBookRow> rows = new ArrayList<>(DEPTH);
        for (int rank = 0; rank < DEPTH; rank++) {
            rows.add(OrderBookRow.empty());
        }
        return Collections.unmodifiableList(rows);
    }
}
