package io.trading.marketdata.repository;

import io.trading.marketdata.model.DataChannel;
import io.trading.marketdata.model.InstrumentSnapshot;

import java.util.List;

/**
 * Signals that one channel of an instrument changed.
 *
 * @param isin         The instrument
 * @param channel      The channel that changed
 * @param snapshot     State of the instrument right after the change
 * @param changedRanks Order book ranks that changed, empty for other channels
 */
public record ChangeNotification(
    String isin,
    DataChannel channel,
    InstrumentSnapshot snapshot,
    List<Integer> changedRanks
) {
    public ChangeNotification {
        if (isin == null || channel == null || snapshot == null) {
            throw new IllegalArgumentException("isin, channel and snapshot are required");
        }
        changedRanks = changedRanks == null ? List.of() : List.copyOf(changedRanks);
    }
}
