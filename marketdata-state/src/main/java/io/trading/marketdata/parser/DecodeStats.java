package io.trading.marketdata.parser;

/**
 * Outcome of decoding one upstream frame.
 *
 * @param applied Channel entries handed to the handler
 * @param ignored Well-formed channel entries the relay does not take from the stream
 * @param errors  Channel or identity entries that were skipped
 */
public record DecodeStats(int applied, int ignored, int errors) {
}
