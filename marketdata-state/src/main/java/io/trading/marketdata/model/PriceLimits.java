package io.trading.marketdata.model;

/**
 * Allowed order price band of an instrument.
 *
 * @param maxPrice Highest allowed order price
 * @param minPrice Lowest allowed order price
 */
public record PriceLimits(long maxPrice, long minPrice) {

    private static final PriceLimits EMPTY = new PriceLimits(0, 0);

    public static PriceLimits empty() {
        return EMPTY;
    }
}
