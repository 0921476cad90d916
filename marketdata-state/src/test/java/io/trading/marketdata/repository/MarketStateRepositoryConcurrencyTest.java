package io.trading.marketdata.repository;

import io.trading.marketdata.model.Candle;
import io.trading.marketdata.model.DataChannel;
import io.trading.marketdata.model.InstrumentIdentification;
import io.trading.marketdata.model.InstrumentSnapshot;
import io.trading.marketdata.model.OrderBook;
import io.trading.marketdata.model.OrderBookLevel;
import io.trading.marketdata.model.OrderBookRow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MarketStateRepository under concurrent writers, readers and a sink that is slow to return.
 */
class MarketStateRepositoryConcurrencyTest {

    private static final String FOLD = "IRO1FOLD0001";
    private static final String IKCO = "IRO1IKCO0001";
    private static final LocalDateTime SESSION_START = LocalDateTime.of(2024, 1, 7, 9, 0);

    private MarketStateRepository repository;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        repository = new MarketStateRepository();
        repository.register(InstrumentIdentification.ofIsin(FOLD));
        repository.register(InstrumentIdentification.ofIsin(IKCO));
        executor = Executors.newFixedThreadPool(6);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testLaterChangeIsDeliveredAfterEarlierOne() throws Exception {
        List<Long> delivered = new CopyOnWriteArrayList<>();
        CountDownLatch firstInSink = new CountDownLatch(1);
        CountDownLatch secondStored = new CountDownLatch(1);
        repository.registerChangeSink(notification -> {
            delivered.add(notification.snapshot().candle().lastPrice());
            if (delivered.size() == 1) {
                firstInSink.countDown();
                await(secondStored);
            }
        });

        Future<Boolean> first = executor.submit(() -> repository.applyTrade(FOLD, candle(1, 1)));
        assertTrue(firstInSink.await(5, TimeUnit.SECONDS));

        // the second writer is not blocked by the sink still busy with the first change
        Future<Boolean> second = executor.submit(() -> repository.applyTrade(FOLD, candle(2, 2)));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (repository.snapshot(FOLD).orElseThrow().candle().lastPrice() != 2) {
            assertTrue(System.nanoTime() < deadline, "second trade was never stored");
            Thread.sleep(1);
        }
        assertEquals(List.of(1L), delivered);
        secondStored.countDown();

        assertTrue(first.get(5, TimeUnit.SECONDS));
        assertTrue(second.get(5, TimeUnit.SECONDS));
        assertEquals(List.of(1L, 2L), delivered);
    }

    @Test
    void testConcurrentWritersAndReaders() throws Exception {
        int writersPerInstrument = 2;
        int rounds = 400;
        Map<String, ChangeNotification> lastDelivered = new ConcurrentHashMap<>();
        AtomicInteger deliveredCount = new AtomicInteger();
        AtomicInteger inSink = new AtomicInteger();
        AtomicBoolean overlapped = new AtomicBoolean();
        repository.registerChangeSink(notification -> {
            if (inSink.incrementAndGet() > 1) {
                overlapped.set(true);
            }
            lastDelivered.put(notification.isin() + "/" + notification.channel(), notification);
            deliveredCount.incrementAndGet();
            inSink.decrementAndGet();
        });

        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger appliedCount = new AtomicInteger();
        AtomicBoolean writing = new AtomicBoolean(true);
        List<Future<?>> writers = new ArrayList<>();
        int writerIndex = 0;
        for (String isin : List.of(FOLD, IKCO)) {
            for (int w = 0; w < writersPerInstrument; w++) {
                int offset = writerIndex++ * rounds;
                writers.add(executor.submit(() -> {
                    await(start);
                    for (int i = 1; i <= rounds; i++) {
                        long value = offset + i;
                        if (repository.applyTrade(isin, candle(value, value))) {
                            appliedCount.incrementAndGet();
                        }
                        if (!repository.applyOrderBook(isin, List.of(row(value))).isEmpty()) {
                            appliedCount.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
        }
        List<Future<?>> readers = new ArrayList<>();
        for (int r = 0; r < 2; r++) {
            readers.add(executor.submit(() -> {
                await(start);
                int reads = 0;
                while (writing.get() || reads == 0) {
                    InstrumentSnapshot fold = repository.snapshot(FOLD).orElseThrow();
                    assertEquals(OrderBook.DEPTH, fold.orderBook().size());
                    Map<String, InstrumentSnapshot> both = repository.snapshots(List.of(FOLD, IKCO));
                    assertEquals(List.of(FOLD, IKCO), new ArrayList<>(both.keySet()));
                    reads++;
                }
                return reads;
            }));
        }

        start.countDown();
        for (Future<?> writer : writers) {
            writer.get(30, TimeUnit.SECONDS);
        }
        writing.set(false);
        for (Future<?> reader : readers) {
            reader.get(30, TimeUnit.SECONDS);
        }

        // every trade time and every top row is distinct, so every call is a real change
        assertEquals(2 * 2 * writersPerInstrument * rounds, appliedCount.get());
        assertEquals(appliedCount.get(), deliveredCount.get());
        assertFalse(overlapped.get(), "sink was entered by two threads at once");
        for (String isin : List.of(FOLD, IKCO)) {
            InstrumentSnapshot stored = repository.snapshot(isin).orElseThrow();
            assertEquals(stored.candle(), lastDelivered.get(isin + "/" + DataChannel.TRADE).snapshot().candle());
            assertEquals(stored.orderBook(), lastDelivered.get(isin + "/" + DataChannel.ORDERBOOK).snapshot().orderBook());
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static Candle candle(long lastPrice, long secondsIntoSession) {
        return new Candle(lastPrice, lastPrice, SESSION_START.plusSeconds(secondsIntoSession),
            lastPrice + 10, lastPrice - 10, lastPrice, lastPrice, 1, lastPrice * 100, 100);
    }

    private static OrderBookRow row(long price) {
        return new OrderBookRow(new OrderBookLevel(1, 100, price), new OrderBookLevel(1, 100, price + 1));
    }
}
