package io.trading.marketdata.model;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Intraday trade statistics of one instrument.
 * Prices are in the smallest currency unit.
 *
 * @param closePrice    Closing (weighted) price
 * @param lastPrice     Price of the last trade
 * @param lastTradeTime Time of the last trade, null before the first trade of the session
 * @param maxPrice      Highest traded price
 * @param minPrice      Lowest traded price
 * @param openPrice     First traded price
 * @param previousPrice Previous session's closing price
 * @param tradeCount    Number of trades
 * @param tradeValue    Total traded value
 * @param tradeVolume   Total traded volume
 */
public record Candle(
    long closePrice,
    long lastPrice,
    LocalDateTime lastTradeTime,
    long maxPrice,
    long minPrice,
    long openPrice,
    long previousPrice,
    long tradeCount,
    long tradeValue,
    long tradeVolume
) {
    private static final Candle EMPTY = new Candle(0, 0, null, 0, 0, 0, 0, 0, 0, 0);

    /**
     * Candle of an instrument that has not traded yet.
     */
    public static Candle empty() {
        return EMPTY;
    }

    /**
     * Time-of-day component of the last trade, or null if there was none.
     */
    public LocalTime lastTradeTimeOfDay() {
        return lastTradeTime == null ? null : lastTradeTime.toLocalTime();
    }

    /**
     * Returns a copy of this candle with a different last trade time.
     */
    public Candle withLastTradeTime(LocalDateTime time) {
        return new Candle(closePrice, lastPrice, time, maxPrice, minPrice, openPrice,
            previousPrice, tradeCount, tradeValue, tradeVolume);
    }
}
