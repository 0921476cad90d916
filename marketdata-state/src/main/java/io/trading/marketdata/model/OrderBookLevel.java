package io.trading.marketdata.model;

/**
 * One side of an order book row.
 *
 * @param count  Number of orders
 * @param volume Total volume of the orders
 * @param price  Price of the level
 */
public record OrderBookLevel(
    long count,
    long volume,
    long price
) {
    private static final OrderBookLevel EMPTY = new OrderBookLevel(0, 0, 0);

    public OrderBookLevel {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative");
        }
        if (volume < 0) {
            throw new IllegalArgumentException("volume cannot be negative");
        }
        if (price < 0) {
            throw new IllegalArgumentException("price cannot be negative");
        }
    }

    /**
     * Creates an empty order book level (no orders).
     */
    public static OrderBookLevel empty() {
        return EMPTY;
    }
}
