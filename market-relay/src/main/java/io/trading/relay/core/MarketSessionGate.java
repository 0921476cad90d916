package io.trading.relay.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Ends the relay's session at the market close time of day.
 * A close time already past today ends the session right away.
 */
public class MarketSessionGate implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarketSessionGate.class);

    private final LocalTime endTime;
    private final Clock clock;
    private final Runnable onSessionEnd;
    private ScheduledExecutorService scheduler;

    public MarketSessionGate(LocalTime endTime, Clock clock, Runnable onSessionEnd) {
        this.endTime = endTime;
        this.clock = clock;
        this.onSessionEnd = onSessionEnd;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "market-session-gate");
            thread.setDaemon(true);
            return thread;
        });
        Duration delay = delayUntilEnd();
        LOGGER.info("[Session] Market session ends at {} (in {} s)", endTime, delay.toSeconds());
        scheduler.schedule(this::endSession, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Time left until today's close, zero once it has passed.
     */
    Duration delayUntilEnd() {
        LocalDateTime now = LocalDateTime.now(clock);
        Duration delay = Duration.between(now, now.toLocalDate().atTime(endTime));
        return delay.isNegative() ? Duration.ZERO : delay;
    }

    private void endSession() {
        LOGGER.info("[Session] Market closed at {}", endTime);
        onSessionEnd.run();
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
