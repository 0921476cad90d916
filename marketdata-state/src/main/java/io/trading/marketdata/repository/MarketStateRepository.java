package io.trading.marketdata.repository;

import io.trading.marketdata.model.Candle;
import io.trading.marketdata.model.ClientType;
import io.trading.marketdata.model.DataChannel;
import io.trading.marketdata.model.InstrumentIdentification;
import io.trading.marketdata.model.InstrumentSnapshot;
import io.trading.marketdata.model.MarketWatchClientType;
import io.trading.marketdata.model.MarketWatchTrade;
import io.trading.marketdata.model.OrderBookRow;
import io.trading.marketdata.model.PriceLimits;
import io.trading.marketdata.parser.FeedUpdateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Canonical in-memory state of every instrument, keyed by ISIN.
 *
 * All reads and every compare-then-mutate sequence run under one exclusive lock.
 * Each call that changes observable state emits one {@link ChangeNotification} per
 * changed channel to the registered {@link ChangeSink}, after the lock is released.
 * Notifications are queued under the lock and delivered by one thread at a time, so
 * the sink sees them in the order the changes were applied.
 * Callers only ever receive immutable {@link InstrumentSnapshot}s.
 */
public class MarketStateRepository implements FeedUpdateHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarketStateRepository.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock dispatchLock = new ReentrantLock();
    private final Queue<ChangeNotification> pending = new ConcurrentLinkedQueue<>();
    private final Map<String, Instrument> instruments = new HashMap<>();
    private final Map<String, String> isinByTsetmcCode = new HashMap<>();
    private final Clock clock;

    private volatile ChangeSink changeSink;

    public MarketStateRepository() {
        this(Clock.systemDefaultZone());
    }

    /**
     * @param clock Source of the session date combined with market-watch trade times
     */
    public MarketStateRepository(Clock clock) {
        this.clock = clock;
    }

    /**
     * Installs the receiver of change notifications.
     *
     * @throws IllegalStateException if a different sink is already registered
     */
    public void registerChangeSink(ChangeSink sink) {
        lock.lock();
        try {
            if (changeSink != null && changeSink != sink) {
                throw new IllegalStateException("A change sink is already registered");
            }
            changeSink = sink;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates an empty record for an instrument if it does not exist yet.
     *
     * @return true if a record was created
     */
    public boolean register(InstrumentIdentification identification) {
        lock.lock();
        try {
            if (instruments.containsKey(identification.isin())) {
                return false;
            }
            getOrCreate(identification);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onTrade(String isin, Candle candle) {
        applyTrade(isin, candle);
    }

    @Override
    public void onThresholds(String isin, PriceLimits priceLimits) {
        applyThresholds(isin, priceLimits);
    }

    /**
     * Applies a streamed trade update. An update reporting the last trade time of day
     * already recorded is a duplicate and is dropped.
     *
     * @return true if the candle changed
     */
    public boolean applyTrade(String isin, Candle candle) {
        lock.lock();
        try {
            Instrument instrument = find(isin);
            if (instrument == null || !instrument.updateCandle(candle)) {
                return false;
            }
            enqueue(instrument, DataChannel.TRADE, List.of());
        } finally {
            lock.unlock();
        }
        dispatch();
        return true;
    }

    /**
     * Applies new price limits.
     *
     * @return true if the limits changed
     */
    public boolean applyThresholds(String isin, PriceLimits priceLimits) {
        lock.lock();
        try {
            Instrument instrument = find(isin);
            if (instrument == null || !instrument.updatePriceLimits(priceLimits)) {
                return false;
            }
            enqueue(instrument, DataChannel.THRESHOLDS, List.of());
        } finally {
            lock.unlock();
        }
        dispatch();
        return true;
    }

    /**
     * Replaces the client type breakdown if any of its fields differ.
     *
     * @return true if the breakdown changed
     */
    public boolean applyClientType(String isin, ClientType clientType) {
        lock.lock();
        try {
            Instrument instrument = find(isin);
            if (instrument == null || !instrument.updateClientType(clientType)) {
                return false;
            }
            enqueue(instrument, DataChannel.CLIENTTYPE, List.of());
        } finally {
            lock.unlock();
        }
        dispatch();
        return true;
    }

    /**
     * Overwrites the order book rows that differ from the stored ones.
     *
     * @param rows Rows by rank, rank 0 first
     * @return Changed ranks, empty if nothing changed or the instrument is unknown
     * @throws IllegalArgumentException if more rows than the book depth are given
     */
    public List<Integer> applyOrderBook(String isin, List<OrderBookRow> rows) {
        List<Integer> changed;
        lock.lock();
        try {
            Instrument instrument = find(isin);
            if (instrument == null) {
                return List.of();
            }
            changed = List.copyOf(instrument.updateOrderBook(rows));
            if (changed.isEmpty()) {
                return List.of();
            }
            enqueue(instrument, DataChannel.ORDERBOOK, changed);
        } finally {
            lock.unlock();
        }
        dispatch();
        return changed;
    }

    /**
     * Applies a market-wide trade snapshot. Unknown instruments are created; each
     * candle is combined with today's date and applied unless its time of day is already
     * recorded; order book rows are diffed rank by rank.
     *
     * @return Number of notifications emitted
     */
    public int applyMarketWatch(List<MarketWatchTrade> trades) {
        int emitted = 0;
        LocalDate today = LocalDate.now(clock);
        lock.lock();
        try {
            for (MarketWatchTrade trade : trades) {
                Instrument instrument = getOrCreate(trade.identification());

                Candle candle = trade.lastTradeTime() == null
                    ? trade.candle().withLastTradeTime(null)
                    : trade.candle().withLastTradeTime(today.atTime(trade.lastTradeTime()));
                if (instrument.updateCandle(candle)) {
                    enqueue(instrument, DataChannel.TRADE, List.of());
                    emitted++;
                }

                try {
                    List<Integer> ranks = instrument.updateOrderBook(trade.orderBook());
                    if (!ranks.isEmpty()) {
                        enqueue(instrument, DataChannel.ORDERBOOK, ranks);
                        emitted++;
                    }
                } catch (IllegalArgumentException e) {
                    LOGGER.warn("[Repository] Ignoring order book of {}: {}",
                        trade.identification().isin(), e.getMessage());
                }
            }
        } finally {
            lock.unlock();
        }
        dispatch();
        return emitted;
    }

    /**
     * Applies a market-wide client type snapshot keyed by tsetmc code.
     * Rows of instruments not yet known are ignored.
     *
     * @return Number of notifications emitted
     */
    public int applyClientTypes(List<MarketWatchClientType> clientTypes) {
        int emitted = 0;
        lock.lock();
        try {
            for (MarketWatchClientType row : clientTypes) {
                String isin = isinByTsetmcCode.get(row.tsetmcCode());
                Instrument instrument = isin == null ? null : instruments.get(isin);
                if (instrument != null && instrument.updateClientType(row.clientType())) {
                    enqueue(instrument, DataChannel.CLIENTTYPE, List.of());
                    emitted++;
                }
            }
        } finally {
            lock.unlock();
        }
        dispatch();
        return emitted;
    }

    /**
     * Reads the current record of an instrument.
     *
     * @return The snapshot, or empty if the instrument is unknown
     */
    public Optional<InstrumentSnapshot> snapshot(String isin) {
        lock.lock();
        try {
            Instrument instrument = instruments.get(isin);
            return instrument == null ? Optional.empty() : Optional.of(instrument.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reads the records of several instruments at once.
     *
     * @return Snapshots of the known instruments, in request order
     */
    public Map<String, InstrumentSnapshot> snapshots(Collection<String> isins) {
        Map<String, InstrumentSnapshot> result = new LinkedHashMap<>();
        lock.lock();
        try {
            for (String isin : isins) {
                Instrument instrument = instruments.get(isin);
                if (instrument != null) {
                    result.put(isin, instrument.snapshot());
                }
            }
        } finally {
            lock.unlock();
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Number of instruments held.
     */
    public int size() {
        lock.lock();
        try {
            return instruments.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isLockHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    private Instrument find(String isin) {
        Instrument instrument = instruments.get(isin);
        if (instrument == null) {
            LOGGER.warn("[Repository] Update for unknown instrument {} ignored", isin);
        }
        return instrument;
    }

    private Instrument getOrCreate(InstrumentIdentification identification) {
        Instrument instrument = instruments.get(identification.isin());
        if (instrument == null) {
            instrument = new Instrument(identification);
            instruments.put(identification.isin(), instrument);
            if (identification.tsetmcCode() != null) {
                isinByTsetmcCode.put(identification.tsetmcCode(), identification.isin());
            }
            LOGGER.debug("[Repository] New instrument {}", identification.isin());
        } else if (identification.tsetmcCode() != null) {
            isinByTsetmcCode.putIfAbsent(identification.tsetmcCode(), identification.isin());
        }
        return instrument;
    }

    /**
     * Queues a notification for the state the instrument has right now. Called under the
     * data lock, so the queue order is the order in which the changes were applied.
     */
    private void enqueue(Instrument instrument, DataChannel channel, List<Integer> ranks) {
        if (changeSink == null) {
            return;
        }
        pending.add(new ChangeNotification(instrument.identification().isin(), channel, instrument.snapshot(), ranks));
    }

    /**
     * Delivers queued notifications in queue order. Only one thread delivers at a time;
     * a writer arriving while another delivers waits, and its notifications may already
     * have been delivered by the time it gets the dispatch lock.
     */
    private void dispatch() {
        if (pending.isEmpty()) {
            return;
        }
        dispatchLock.lock();
        try {
            ChangeNotification notification;
            while ((notification = pending.poll()) != null) {
                deliver(notification);
            }
        } finally {
            dispatchLock.unlock();
        }
    }

    private void deliver(ChangeNotification notification) {
        ChangeSink sink = changeSink;
        if (sink == null) {
            return;
        }
        try {
            sink.onChange(notification);
        } catch (RuntimeException e) {
            LOGGER.error("[Repository] Change sink failed for {} {}", notification.isin(), notification.channel(), e);
        }
    }
}
