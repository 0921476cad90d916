package io.trading.marketdata.model;

/**
 * A ranked depth row holding both the bid and the ask side.
 *
 * @param demand Bid side
 * @param supply Ask side
 */
public record OrderBookRow(
    OrderBookLevel demand,
    OrderBookLevel supply
) {
    private static final OrderBookRow EMPTY = new OrderBookRow(OrderBookLevel.empty(), OrderBookLevel.empty());

    public OrderBookRow {
        if (demand == null) {
            throw new IllegalArgumentException("demand cannot be null");
        }
        if (supply == null) {
            throw new IllegalArgumentException("supply cannot be null");
        }
    }

    public static OrderBookRow empty() {
        return EMPTY;
    }
}
