package io.trading.relay.netty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Re-establishes a lost feed connection with exponential backoff.
 * At most one attempt is pending at any time.
 */
public class ReconnectHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectHandler.class);

    private static final long INITIAL_DELAY_MS = 1000;
    private static final long MAX_DELAY_MS = 60000;
    private static final double BACKOFF_MULTIPLIER = 1.5;

    private final String name;
    private final int maxRetries;
    private final Runnable connectAction;
    private final Runnable attemptListener;
    private final AtomicBoolean pending = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private volatile int retryCount = 0;
    private volatile long currentDelay = INITIAL_DELAY_MS;
    private volatile boolean running = false;

    /**
     * Creates a new reconnect handler.
     *
     * @param name            Friendly name for logging
     * @param maxRetries      Maximum number of consecutive attempts (-1 for unlimited)
     * @param connectAction   Reconnects; throwing counts as a failed attempt
     * @param attemptListener Notified before every attempt (may be null)
     */
    public ReconnectHandler(String name, int maxRetries, Runnable connectAction, Runnable attemptListener) {
        this.name = name;
        this.maxRetries = maxRetries;
        this.connectAction = connectAction;
        this.attemptListener = attemptListener;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name + "-reconnect");
            thread.setDaemon(true);
            return thread;
        });
        LOGGER.info("{}: Reconnect handler started", name);
    }

    public synchronized void stop() {
        running = false;
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        pending.set(false);
        reset();
        LOGGER.info("{}: Reconnect handler stopped", name);
    }

    /**
     * Schedules a reconnection attempt unless one is already pending.
     */
    public synchronized void scheduleReconnect() {
        if (!running) {
            LOGGER.debug("{}: Reconnect handler not running", name);
            return;
        }
        if (!pending.compareAndSet(false, true)) {
            return;
        }
        if (maxRetries >= 0 && retryCount >= maxRetries) {
            LOGGER.error("{}: Max reconnect retries ({}) reached, giving up", name, maxRetries);
            pending.set(false);
            return;
        }

        retryCount++;
        LOGGER.info("{}: Scheduling reconnect attempt {} in {} ms", name, retryCount, currentDelay);
        scheduler.schedule(this::attempt, currentDelay, TimeUnit.MILLISECONDS);
    }

    private void attempt() {
        pending.set(false);
        if (!running) {
            return;
        }
        try {
            LOGGER.info("{}: Attempting reconnection #{}", name, retryCount);
            if (attemptListener != null) {
                attemptListener.run();
            }
            connectAction.run();
        } catch (RuntimeException e) {
            LOGGER.error("{}: Reconnect attempt failed: {}", name, e.getMessage());
            currentDelay = Math.min((long) (currentDelay * BACKOFF_MULTIPLIER), MAX_DELAY_MS);
            scheduleReconnect();
        }
    }

    /**
     * Resets the backoff state; called once a connection is established.
     */
    public void reset() {
        retryCount = 0;
        currentDelay = INITIAL_DELAY_MS;
    }

    public boolean isRunning() {
        return running;
    }

    public int getRetryCount() {
        return retryCount;
    }
}
