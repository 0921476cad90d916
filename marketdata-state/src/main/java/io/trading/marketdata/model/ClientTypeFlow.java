package io.trading.marketdata.model;

/**
 * Buy or sell activity of one investor class.
 *
 * @param count  Number of distinct investors
 * @param volume Traded volume
 */
public record ClientTypeFlow(long count, long volume) {

    private static final ClientTypeFlow EMPTY = new ClientTypeFlow(0, 0);

    public static ClientTypeFlow empty() {
        return EMPTY;
    }
}
