package io.trading.relay.broker;

/**
 * Lifecycle of a subscriber connection as seen by the broker.
 */
public enum ConnectionState {
    /** Accepted, no subscriptions held. */
    OPEN,
    /** Holds at least one subscription. */
    ACTIVE,
    /** Ended and removed from every subscriber set. */
    CLOSED
}
