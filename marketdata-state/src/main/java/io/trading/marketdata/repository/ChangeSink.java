package io.trading.marketdata.repository;

/**
 * Receiver of the change notifications emitted by {@link MarketStateRepository}.
 */
public interface ChangeSink {

    /**
     * Called after the repository changed observable state of an instrument.
     * Invoked without the repository lock held.
     */
    void onChange(ChangeNotification notification);
}
