package io.trading.marketdata.repository;

import io.trading.marketdata.model.Candle;
import io.trading.marketdata.model.ClientType;
import io.trading.marketdata.model.ClientTypeFlow;
import io.trading.marketdata.model.ClientTypeGroup;
import io.trading.marketdata.model.DataChannel;
import io.trading.marketdata.model.InstrumentIdentification;
import io.trading.marketdata.model.InstrumentSnapshot;
import io.trading.marketdata.model.MarketWatchClientType;
import io.trading.marketdata.model.MarketWatchTrade;
import io.trading.marketdata.model.OrderBook;
import io.trading.marketdata.model.OrderBookLevel;
import io.trading.marketdata.model.OrderBookRow;
import io.trading.marketdata.model.PriceLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketStateRepository.
 */
class MarketStateRepositoryTest {

    private static final String FOLD = "IRO1FOLD0001";
    private static final String IKCO = "IRO1IKCO0001";

    private static final Clock CLOCK = Clock.fixed(
        ZonedDateTime.of(2024, 1, 7, 8, 0, 0, 0, ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);

    private MarketStateRepository repository;
    private List<ChangeNotification> notifications;

    @BeforeEach
    void setUp() {
        repository = new MarketStateRepository(CLOCK);
        notifications = new ArrayList<>();
        repository.registerChangeSink(notifications::add);
        repository.register(InstrumentIdentification.ofIsin(FOLD));
    }

    @Test
    void testDuplicateTradeNotifiesOnce() {
        Candle candle = candle(9900, LocalDateTime.of(2024, 1, 7, 10, 15, 30));

        assertTrue(repository.applyTrade(FOLD, candle));
        assertFalse(repository.applyTrade(FOLD, candle));

        assertEquals(1, notifications.size());
        ChangeNotification notification = notifications.get(0);
        assertEquals(FOLD, notification.isin());
        assertEquals(DataChannel.TRADE, notification.channel());
        assertEquals(candle, notification.snapshot().candle());
    }

    @Test
    void testSameTimeOfDayIsDuplicateEvenWithOtherFields() {
        repository.applyTrade(FOLD, candle(9900, LocalDateTime.of(2024, 1, 7, 10, 15, 30)));
        Candle sameTime = candle(10000, LocalDateTime.of(2024, 1, 8, 10, 15, 30));

        assertFalse(repository.applyTrade(FOLD, sameTime));

        assertEquals(9900, repository.snapshot(FOLD).orElseThrow().candle().lastPrice());
        assertEquals(1, notifications.size());
    }

    @Test
    void testNewTradeTimeReplacesCandle() {
        repository.applyTrade(FOLD, candle(9900, LocalDateTime.of(2024, 1, 7, 10, 15, 30)));

        assertTrue(repository.applyTrade(FOLD, candle(9950, LocalDateTime.of(2024, 1, 7, 10, 15, 31))));

        assertEquals(9950, repository.snapshot(FOLD).orElseThrow().candle().lastPrice());
        assertEquals(2, notifications.size());
    }

    @Test
    void testTradeForUnknownInstrumentIsIgnored() {
        assertFalse(repository.applyTrade(IKCO, candle(1, LocalDateTime.of(2024, 1, 7, 9, 0))));

        assertTrue(notifications.isEmpty());
        assertTrue(repository.snapshot(IKCO).isEmpty());
    }

    @Test
    void testOrderBookPartialDiff() {
        List<OrderBookRow> rows = List.of(row(1, 100), row(2, 99), row(3, 98));
        repository.applyOrderBook(FOLD, rows);
        notifications.clear();

        List<OrderBookRow> update = List.of(row(1, 100), row(2, 99), row(7, 97));
        List<Integer> changed = repository.applyOrderBook(FOLD, update);

        assertEquals(List.of(2), changed);
        assertEquals(1, notifications.size());
        assertEquals(DataChannel.ORDERBOOK, notifications.get(0).channel());
        assertEquals(List.of(2), notifications.get(0).changedRanks());
        assertEquals(update, repository.snapshot(FOLD).orElseThrow().orderBook());
    }

    @Test
    void testUnchangedOrderBookDoesNotNotify() {
        List<OrderBookRow> rows = List.of(row(1, 100), row(2, 99), row(3, 98));
        repository.applyOrderBook(FOLD, rows);
        notifications.clear();

        assertTrue(repository.applyOrderBook(FOLD, rows).isEmpty());
        assertTrue(notifications.isEmpty());
    }

    @Test
    void testOrderBookDeeperThanBookIsRejected() {
        List<OrderBookRow> rows = new ArrayList<>();
        for (int i = 0; i <= OrderBook.DEPTH; i++) {
            rows.add(row(i + 1, 100 - i));
        }

        assertThrows(IllegalArgumentException.class, () -> repository.applyOrderBook(FOLD, rows));
        assertTrue(notifications.isEmpty());
    }

    @Test
    void testClientTypeDiff() {
        ClientType clientType = clientType(5);

        assertTrue(repository.applyClientType(FOLD, clientType));
        assertFalse(repository.applyClientType(FOLD, clientType));

        assertEquals(1, notifications.size());
        assertEquals(DataChannel.CLIENTTYPE, notifications.get(0).channel());
        assertEquals(clientType, repository.snapshot(FOLD).orElseThrow().clientType());
    }

    @Test
    void testThresholdsDiff() {
        assertTrue(repository.applyThresholds(FOLD, new PriceLimits(2150, 1950)));
        assertFalse(repository.applyThresholds(FOLD, new PriceLimits(2150, 1950)));
        assertTrue(repository.applyThresholds(FOLD, new PriceLimits(2200, 2000)));

        assertEquals(2, notifications.size());
        assertEquals(DataChannel.THRESHOLDS, notifications.get(1).channel());
        assertEquals(new PriceLimits(2200, 2000), repository.snapshot(FOLD).orElseThrow().priceLimits());
    }

    @Test
    void testSnapshotOfUnknownInstrument() {
        assertEquals(Optional.empty(), repository.snapshot(IKCO));
    }

    @Test
    void testNewInstrumentStartsEmpty() {
        InstrumentSnapshot snapshot = repository.snapshot(FOLD).orElseThrow();

        assertEquals(Candle.empty(), snapshot.candle());
        assertEquals(ClientType.empty(), snapshot.clientType());
        assertEquals(ClientTypeGroup.empty(), snapshot.clientType().legal());
        assertEquals(ClientTypeFlow.empty(), snapshot.clientType().natural().sell());
        assertEquals(PriceLimits.empty(), snapshot.priceLimits());
    }

    @Test
    void testSnapshotsKeepRequestOrderAndSkipUnknown() {
        repository.register(InstrumentIdentification.ofIsin(IKCO));

        Map<String, InstrumentSnapshot> snapshots = repository.snapshots(List.of(IKCO, "IRO1XXXX0001", FOLD));

        assertEquals(List.of(IKCO, FOLD), new ArrayList<>(snapshots.keySet()));
    }

    @Test
    void testSnapshotIsNotAffectedByLaterUpdates() {
        InstrumentSnapshot before = repository.snapshot(FOLD).orElseThrow();

        repository.applyOrderBook(FOLD, List.of(row(9, 500)));

        assertEquals(OrderBookRow.empty(), before.orderBook().get(0));
        assertEquals(row(9, 500), repository.snapshot(FOLD).orElseThrow().orderBook().get(0));
    }

    @Test
    void testUpdatesWithoutSinkDoNotFail() {
        MarketStateRepository bare = new MarketStateRepository(CLOCK);
        bare.register(InstrumentIdentification.ofIsin(FOLD));

        assertTrue(bare.applyTrade(FOLD, candle(1, LocalDateTime.of(2024, 1, 7, 9, 0))));
        assertEquals(List.of(0), bare.applyOrderBook(FOLD, List.of(row(1, 1))));
    }

    @Test
    void testSinkRunsOutsideLock() {
        MarketStateRepository other = new MarketStateRepository(CLOCK);
        other.register(InstrumentIdentification.ofIsin(FOLD));
        List<Boolean> lockHeld = new ArrayList<>();
        other.registerChangeSink(n -> lockHeld.add(other.isLockHeldByCurrentThread()));

        other.applyThresholds(FOLD, new PriceLimits(10, 5));

        assertEquals(List.of(false), lockHeld);
    }

    @Test
    void testFailingSinkDoesNotBreakUpdate() {
        MarketStateRepository other = new MarketStateRepository(CLOCK);
        other.register(InstrumentIdentification.ofIsin(FOLD));
        other.registerChangeSink(n -> {
            throw new IllegalStateException("boom");
        });

        assertTrue(other.applyThresholds(FOLD, new PriceLimits(10, 5)));
        assertEquals(new PriceLimits(10, 5), other.snapshot(FOLD).orElseThrow().priceLimits());
    }

    @Test
    void testSecondSinkIsRejected() {
        assertThrows(IllegalStateException.class, () -> repository.registerChangeSink(n -> { }));
    }

    @Test
    void testRegisterIsIdempotent() {
        assertFalse(repository.register(InstrumentIdentification.ofIsin(FOLD)));
        assertTrue(repository.register(InstrumentIdentification.ofIsin(IKCO)));
        assertEquals(2, repository.size());
    }

    @Test
    void testMarketWatchCreatesInstrumentsAndNotifies() {
        InstrumentIdentification ikco = new InstrumentIdentification(IKCO, "65883838195688438", "KHODRO");
        MarketWatchTrade trade = new MarketWatchTrade(
            ikco, candle(2100, null), LocalTime.of(12, 29, 59), List.of(row(4, 2100)));

        int emitted = repository.applyMarketWatch(List.of(trade));

        assertEquals(2, emitted);
        InstrumentSnapshot snapshot = repository.snapshot(IKCO).orElseThrow();
        assertEquals(LocalDateTime.of(2024, 1, 7, 12, 29, 59), snapshot.candle().lastTradeTime());
        assertEquals(row(4, 2100), snapshot.orderBook().get(0));
        assertEquals(DataChannel.TRADE, notifications.get(0).channel());
        assertEquals(DataChannel.ORDERBOOK, notifications.get(1).channel());
        assertEquals(List.of(0), notifications.get(1).changedRanks());

        assertEquals(0, repository.applyMarketWatch(List.of(trade)));
    }

    @Test
    void testClientTypesAreMatchedByTsetmcCode() {
        InstrumentIdentification ikco = new InstrumentIdentification(IKCO, "65883838195688438", "KHODRO");
        repository.register(ikco);

        int emitted = repository.applyClientTypes(List.of(
            new MarketWatchClientType("65883838195688438", clientType(3)),
            new MarketWatchClientType("1111", clientType(4))));

        assertEquals(1, emitted);
        assertEquals(clientType(3), repository.snapshot(IKCO).orElseThrow().clientType());
        assertEquals(IKCO, notifications.get(0).isin());
        assertEquals(0, repository.applyClientTypes(List.of(
            new MarketWatchClientType("65883838195688438", clientType(3)))));
    }

    private static Candle candle(long lastPrice, LocalDateTime time) {
        return new Candle(lastPrice, lastPrice, time, lastPrice + 10, lastPrice - 10, lastPrice, lastPrice, 10, 1000, 100);
    }

    private static OrderBookRow row(long count, long price) {
        return new OrderBookRow(
            new OrderBookLevel(count, count * 100, price),
            new OrderBookLevel(count + 1, count * 200, price + 1));
    }

    private static ClientType clientType(long seed) {
        return new ClientType(
            new ClientTypeGroup(new ClientTypeFlow(seed, seed * 10), new ClientTypeFlow(seed + 1, seed * 20)),
            new ClientTypeGroup(new ClientTypeFlow(seed + 2, seed * 30), new ClientTypeFlow(seed + 3, seed * 40)));
    }
}
