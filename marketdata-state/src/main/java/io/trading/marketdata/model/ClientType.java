package io.trading.marketdata.model;

/**
 * Investor-type breakdown of an instrument's trading.
 *
 * @param legal   Institutional investors
 * @param natural Individual investors
 */
public record ClientType(ClientTypeGroup legal, ClientTypeGroup natural) {

    private static final ClientType EMPTY = new ClientType(ClientTypeGroup.empty(), ClientTypeGroup.empty());

    public ClientType {
        if (legal == null || natural == null) {
            throw new IllegalArgumentException("legal and natural cannot be null");
        }
    }

    public static ClientType empty() {
        return EMPTY;
    }
}
