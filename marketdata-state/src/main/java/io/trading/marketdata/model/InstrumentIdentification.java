package io.trading.marketdata.model;

/**
 * Identity of a listed instrument.
 *
 * @param isin       12-character instrument code, the key in both feed protocols
 * @param tsetmcCode Numeric exchange code used by bulk market-watch snapshots (may be null)
 * @param ticker     Human readable ticker (may be null)
 */
public record InstrumentIdentification(
    String isin,
    String tsetmcCode,
    String ticker
) {
    public static final int ISIN_LENGTH = 12;

    public InstrumentIdentification {
        if (!isValidIsin(isin)) {
            throw new IllegalArgumentException("isin must be exactly " + ISIN_LENGTH + " characters: " + isin);
        }
    }

    /**
     * Creates an identification known only by its ISIN.
     */
    public static InstrumentIdentification ofIsin(String isin) {
        return new InstrumentIdentification(isin, null, null);
    }

    /**
     * Returns whether the given token has the shape of an ISIN.
     */
    public static boolean isValidIsin(String isin) {
        return isin != null && isin.length() == ISIN_LENGTH;
    }
}
