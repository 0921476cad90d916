package io.trading.marketdata.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.marketdata.model.Candle;
import io.trading.marketdata.model.DataChannel;
import io.trading.marketdata.model.PriceLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes push frames of the upstream feed into typed field updates.
 *
 * A frame is a JSON object of the form {@code {isin: {channel: [fields...]}}}.
 * Failures are local: an unknown identity skips that identity, an unknown or
 * malformed channel entry skips that entry, and the rest of the frame is still decoded.
 * Thread-safe.
 */
public class FeedFrameDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedFrameDecoder.class);

    private static final int THRESHOLDS_FIELDS = 2;
    private static final int TRADE_FIELDS = 10;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Set<String> subscribedIsins;

    /**
     * Creates a decoder accepting only the given identities.
     *
     * @param subscribedIsins Identities requested from the upstream feed
     */
    public FeedFrameDecoder(Set<String> subscribedIsins) {
        this.subscribedIsins = Set.copyOf(subscribedIsins);
    }

    /**
     * Decodes a frame and forwards every recognised entry to the handler.
     *
     * @param frame   The raw text frame
     * @param handler Receiver of the decoded updates
     * @return Counts of applied, ignored and skipped entries
     * @throws IllegalArgumentException if the frame is not a JSON object
     */
    public DecodeStats decode(String frame, FeedUpdateHandler handler) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Frame is not a JSON object");
        }

        int applied = 0;
        int ignored = 0;
        int errors = 0;

        Iterator<Map.Entry<String, JsonNode>> instruments = root.fields();
        while (instruments.hasNext()) {
            Map.Entry<String, JsonNode> instrument = instruments.next();
            String isin = instrument.getKey();

            if (!subscribedIsins.contains(isin)) {
                LOGGER.warn("[Decoder] Skipping unsubscribed instrument {}", isin);
                errors++;
                continue;
            }
            if (!instrument.getValue().isObject()) {
                LOGGER.warn("[Decoder] Instrument {} carries no channel object", isin);
                errors++;
                continue;
            }

            Iterator<Map.Entry<String, JsonNode>> channels = instrument.getValue().fields();
            while (channels.hasNext()) {
                Map.Entry<String, JsonNode> entry = channels.next();
                switch (decodeChannel(isin, entry.getKey(), entry.getValue(), handler)) {
                    case APPLIED -> applied++;
                    case IGNORED -> ignored++;
                    case FAILED -> errors++;
                }
            }
        }

        return new DecodeStats(applied, ignored, errors);
    }

    private enum EntryOutcome {
        APPLIED,
        IGNORED,
        FAILED
    }

    private EntryOutcome decodeChannel(String isin, String channelName, JsonNode data, FeedUpdateHandler handler) {
        Optional<DataChannel> channel = DataChannel.fromWireName(channelName);
        if (channel.isEmpty()) {
            LOGGER.error("[Decoder] Unknown channel [{}] for {}", channelName, isin);
            return EntryOutcome.FAILED;
        }

        try {
            return switch (channel.get()) {
                case THRESHOLDS -> {
                    handler.onThresholds(isin, decodeThresholds(data));
                    yield EntryOutcome.APPLIED;
                }
                case TRADE -> {
                    handler.onTrade(isin, decodeTrade(data));
                    yield EntryOutcome.APPLIED;
                }
                case CLIENTTYPE -> {
                    LOGGER.debug("[Decoder] Client type for {} is not taken from the stream", isin);
                    yield EntryOutcome.IGNORED;
                }
                // TODO: map the order book fields once a live capture confirms the upstream layout
                case ORDERBOOK -> throw new UnsupportedOperationException(
                    "Order book decoding from the stream is not implemented");
            };
        } catch (UnsupportedOperationException e) {
            LOGGER.warn("[Decoder] {} ({})", e.getMessage(), isin);
            return EntryOutcome.FAILED;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            LOGGER.error("[Decoder] Malformed {} entry for {}: {}", channelName, isin, e.getMessage());
            return EntryOutcome.FAILED;
        }
    }

    private PriceLimits decodeThresholds(JsonNode data) {
        requireFields(data, THRESHOLDS_FIELDS);
        return new PriceLimits(
            longField(data, 0),
            longField(data, 1)
        );
    }

    private Candle decodeTrade(JsonNode data) {
        requireFields(data, TRADE_FIELDS);
        return new Candle(
            longField(data, 0),
            longField(data, 1),
            parseTradeTime(data.get(2)),
            longField(data, 3),
            longField(data, 4),
            longField(data, 5),
            longField(data, 6),
            longField(data, 7),
            longField(data, 8),
            longField(data, 9)
        );
    }

    private static void requireFields(JsonNode data, int expected) {
        if (!data.isArray() || data.size() != expected) {
            throw new IllegalArgumentException("expected " + expected + " fields, got " + data);
        }
    }

    private static long longField(JsonNode data, int index) {
        JsonNode node = data.get(index);
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new IllegalArgumentException("field " + index + " does not fit a long: " + node);
            }
            return node.longValue();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("field " + index + " is not an integer: " + node.textValue());
            }
        }
        throw new IllegalArgumentException("field " + index + " is not an integer: " + node);
    }

    /**
     * Parses an ISO-8601 timestamp. Both the 'T' and the space separator are accepted,
     * and a zone offset, if present, is dropped.
     */
    static LocalDateTime parseTradeTime(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException("last trade time is not a string: " + node);
        }
        String text = node.textValue().trim().replace(' ', 'T');
        return LocalDateTime.parse(text, DateTimeFormatter.ISO_DATE_TIME);
    }
}
