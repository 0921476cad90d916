package io.trading.marketdata.encoder.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.marketdata.model.Candle;
import io.trading.marketdata.model.ClientType;
import io.trading.marketdata.model.ClientTypeFlow;
import io.trading.marketdata.model.DataChannel;
import io.trading.marketdata.model.InstrumentSnapshot;
import io.trading.marketdata.model.OrderBookRow;
import io.trading.marketdata.model.PriceLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;

/**
 * Builds the positional JSON payloads sent to downstream subscribers.
 *
 * Messages have the shape {@code {isin: {channel: [fields...]}}}; the field order of
 * each channel matches the upstream feed so a relay can itself be used as a feed.
 * Thread-safe and reusable.
 */
public final class ChannelPayloadEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelPayloadEncoder.class);

    private static final DateTimeFormatter TRADE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ChannelPayloadEncoder INSTANCE = new ChannelPayloadEncoder();

    private final ObjectMapper objectMapper;

    private ChannelPayloadEncoder() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Gets the singleton instance.
     */
    public static ChannelPayloadEncoder getInstance() {
        return INSTANCE;
    }

    /**
     * Creates an empty message envelope.
     */
    public ObjectNode newMessage() {
        return objectMapper.createObjectNode();
    }

    /**
     * Adds one channel of an instrument to a message envelope.
     *
     * @param message  The envelope
     * @param snapshot The instrument
     * @param channel  The channel to render (order book rendered in full)
     */
    public void putChannel(ObjectNode message, InstrumentSnapshot snapshot, DataChannel channel) {
        ArrayNode fields = switch (channel) {
            case THRESHOLDS -> thresholds(snapshot.priceLimits());
            case TRADE -> trade(snapshot.candle());
            case ORDERBOOK -> orderBook(snapshot.orderBook(), null);
            case CLIENTTYPE -> clientType(snapshot.clientType());
        };
        instrumentNode(message, snapshot.isin()).set(channel.getWireName(), fields);
    }

    /**
     * Adds every channel of an instrument to a message envelope.
     */
    public void putAll(ObjectNode message, InstrumentSnapshot snapshot) {
        for (DataChannel channel : DataChannel.values()) {
            putChannel(message, snapshot, channel);
        }
    }

    /**
     * Adds only the given order book ranks of an instrument to a message envelope.
     */
    public void putOrderBookRanks(ObjectNode message, InstrumentSnapshot snapshot, Collection<Integer> ranks) {
        instrumentNode(message, snapshot.isin())
            .set(DataChannel.ORDERBOOK.getWireName(), orderBook(snapshot.orderBook(), ranks));
    }

    /**
     * Renders a message envelope as text.
     *
     * @throws IllegalStateException if serialization fails
     */
    public String encode(ObjectNode message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to encode payload: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to encode payload", e);
        }
    }

    /**
     * Renders a single-channel message for one instrument.
     */
    public String encodeChannel(InstrumentSnapshot snapshot, DataChannel channel) {
        ObjectNode message = newMessage();
        putChannel(message, snapshot, channel);
        return encode(message);
    }

    /**
     * Renders an order book message restricted to the given ranks.
     */
    public String encodeOrderBookRanks(InstrumentSnapshot snapshot, Collection<Integer> ranks) {
        ObjectNode message = newMessage();
        putOrderBookRanks(message, snapshot, ranks);
        return encode(message);
    }

    private ObjectNode instrumentNode(ObjectNode message, String isin) {
        return message.has(isin) ? (ObjectNode) message.get(isin) : message.putObject(isin);
    }

    ArrayNode trade(Candle candle) {
        ArrayNode fields = objectMapper.createArrayNode();
        fields.add(candle.closePrice());
        fields.add(candle.lastPrice());
        if (candle.lastTradeTime() == null) {
            fields.addNull();
        } else {
            fields.add(TRADE_TIME_FORMAT.format(candle.lastTradeTime()));
        }
        fields.add(candle.maxPrice());
        fields.add(candle.minPrice());
        fields.add(candle.openPrice());
        fields.add(candle.previousPrice());
        fields.add(candle.tradeCount());
        fields.add(candle.tradeValue());
        fields.add(candle.tradeVolume());
        return fields;
    }

    ArrayNode thresholds(PriceLimits limits) {
        ArrayNode fields = objectMapper.createArrayNode();
        fields.add(limits.maxPrice());
        fields.add(limits.minPrice());
        return fields;
    }

    /**
     * Order book rows as {@code [rank, demand count, demand price, demand volume,
     * supply count, supply price, supply volume]}.
     *
     * @param ranks Ranks to include, or null for the whole book
     */
    ArrayNode orderBook(List<OrderBookRow> rows, Collection<Integer> ranks) {
        ArrayNode result = objectMapper.createArrayNode();
        for (int rank = 0; rank < rows.size(); rank++) {
            if (ranks != null && !ranks.contains(rank)) {
                continue;
            }
            OrderBookRow row = rows.get(rank);
            ArrayNode fields = result.addArray();
            fields.add(rank);
            fields.add(row.demand().count());
            fields.add(row.demand().price());
            fields.add(row.demand().volume());
            fields.add(row.supply().count());
            fields.add(row.supply().price());
            fields.add(row.supply().volume());
        }
        return result;
    }

    ArrayNode clientType(ClientType clientType) {
        ArrayNode fields = objectMapper.createArrayNode();
        addFlow(fields, clientType.legal().buy());
        addFlow(fields, clientType.legal().sell());
        addFlow(fields, clientType.natural().buy());
        addFlow(fields, clientType.natural().sell());
        return fields;
    }

    private static void addFlow(ArrayNode fields, ClientTypeFlow flow) {
        fields.add(flow.count());
        fields.add(flow.volume());
    }
}
