package io.trading.relay.metrics;

/**
 * Point-in-time view of the relay served by the status endpoint.
 */
public record RelayStatus(
    boolean feedConfigured,
    boolean feedConnected,
    long feedMessages,
    long feedErrors,
    int instruments,
    int subscriberConnections,
    int subscriptions
) {
}
