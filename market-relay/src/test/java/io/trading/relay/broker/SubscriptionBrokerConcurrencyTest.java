package io.trading.relay.broker;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.DefaultEventLoopGroup;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.local.LocalAddress;
import io.netty.channel.local.LocalChannel;
import io.netty.channel.local.LocalServerChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.prometheus.client.CollectorRegistry;
import io.trading.marketdata.model.Candle;
import io.trading.marketdata.model.InstrumentIdentification;
import io.trading.marketdata.repository.MarketStateRepository;
import io.trading.relay.metrics.RelayMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SubscriptionBroker with subscribers joining and leaving while changes are fanned out
 * from several writer threads. Subscribers are in-VM channels with their own event loops,
 * so writes and closes from test threads behave as on a real server.
 */
class SubscriptionBrokerConcurrencyTest {

    private static final String FOLD = "IRO1FOLD0001";
    private static final LocalDateTime SESSION_START = LocalDateTime.of(2024, 1, 7, 9, 0);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BlockingQueue<Channel> accepted = new LinkedBlockingQueue<>();

    private EventLoopGroup group;
    private LocalAddress address;
    private Channel server;
    private ExecutorService executor;

    private MarketStateRepository repository;
    private RelayMetrics metrics;
    private SubscriptionBroker broker;

    @BeforeEach
    void setUp() throws Exception {
        repository = new MarketStateRepository();
        repository.register(InstrumentIdentification.ofIsin(FOLD));
        metrics = new RelayMetrics(new CollectorRegistry());
        broker = new SubscriptionBroker(repository, metrics);
        repository.registerChangeSink(broker);

        group = new DefaultEventLoopGroup(4);
        address = new LocalAddress("subscription-broker-" + System.nanoTime());
        server = new ServerBootstrap()
            .group(group)
            .channel(LocalServerChannel.class)
            .childHandler(new ChannelInitializer<LocalChannel>() {
                @Override
                protected void initChannel(LocalChannel ch) {
                    accepted.add(ch);
                }
            })
            .bind(address).sync().channel();
        executor = Executors.newFixedThreadPool(6);
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        server.close().sync();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    @Test
    void testSubscribeAndCloseRacingFanOut() throws Exception {
        int writers = 2;
        int tradesPerWriter = 100;
        int churning = 40;

        List<Long> steadyPrices = new CopyOnWriteArrayList<>();
        Channel steady = connect(steadyPrices);
        broker.register(steady);
        broker.handleCommand(steady, "1.trade." + FOLD);

        List<Channel> churn = new ArrayList<>();
        for (int i = 0; i < churning; i++) {
            churn.add(connect(new CopyOnWriteArrayList<>()));
        }

        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> tasks = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            int offset = w * tradesPerWriter;
            tasks.add(executor.submit(() -> {
                start.await();
                for (int i = 1; i <= tradesPerWriter; i++) {
                    long price = offset + i;
                    assertTrue(repository.applyTrade(FOLD, candle(price)));
                }
                return null;
            }));
        }
        for (int half = 0; half < 2; half++) {
            List<Channel> mine = churn.subList(half * churning / 2, (half + 1) * churning / 2);
            tasks.add(executor.submit(() -> {
                start.await();
                for (Channel connection : mine) {
                    broker.register(connection);
                    broker.handleCommand(connection, "1.all." + FOLD);
                    broker.handleCommand(connection, "0.orderbook." + FOLD);
                }
                return null;
            }));
            tasks.add(executor.submit(() -> {
                start.await();
                for (Channel connection : mine) {
                    connection.close().sync();
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> task : tasks) {
            task.get(30, TimeUnit.SECONDS);
        }

        awaitCondition(() -> broker.connectionCount() == 1, "closed subscribers still registered");
        assertEquals(1, broker.subscriptionCount());
        for (Channel connection : churn) {
            assertEquals(ConnectionState.CLOSED, broker.connectionState(connection));
        }
        awaitCondition(() -> metrics.getSubscriberConnections() == 1.0, "connection gauge not back to one");

        int total = writers * tradesPerWriter;
        awaitCondition(() -> steadyPrices.size() == total, "steady subscriber missed pushes");
        assertTrue(steady.isActive());
        long stored = repository.snapshot(FOLD).orElseThrow().candle().lastPrice();
        assertEquals(stored, steadyPrices.get(total - 1));
    }

    /**
     * Opens an in-VM connection. The returned channel is the relay side, the one the broker
     * writes to; prices of the trade pushes it receives are collected on the far side.
     */
    private Channel connect(List<Long> lastPrices) throws Exception {
        new Bootstrap()
            .group(group)
            .channel(LocalChannel.class)
            .handler(new SimpleChannelInboundHandler<TextWebSocketFrame>() {
                @Override
                protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) throws Exception {
                    lastPrices.add(objectMapper.readTree(frame.text()).get(FOLD).get("trade").get(1).asLong());
                }
            })
            .connect(address).sync();
        Channel relaySide = accepted.poll(5, TimeUnit.SECONDS);
        assertNotNull(relaySide, "connection was not accepted");
        return relaySide;
    }

    private static void awaitCondition(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            assertTrue(System.nanoTime() < deadline, message);
            Thread.sleep(5);
        }
    }

    private static Candle candle(long price) {
        return new Candle(price, price, SESSION_START.plusSeconds(price),
            price + 50, price - 50, price, price, 1, price * 100, 100);
    }
}
