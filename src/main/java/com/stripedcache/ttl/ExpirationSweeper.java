package com.stripedcache.ttl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * ExpirationSweeper periodically removes expired entries without waiting for them to be read.
 *
 * Runs the sweep task on a single daemon thread at a fixed interval. A failing sweep is
 * logged and the schedule continues.
 */
public class ExpirationSweeper implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ExpirationSweeper.class);

    private final IntSupplier sweepTask;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private volatile boolean running;

    /**
     * @param sweepTask removes expired entries and returns how many it removed
     * @param interval  delay between two sweeps
     */
    public ExpirationSweeper(IntSupplier sweepTask, Duration interval) {
        this.sweepTask = Objects.requireNonNull(sweepTask, "sweepTask");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive, got: " + interval);
        }
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ExpirationSweeper");
            t.setDaemon(true);
            return t;
        });
        this.running = false;
    }

    /**
     * Start the sweep schedule. Calling it twice has no effect.
     */
    public synchronized void start() {
        if (running) {
            logger.warn("ExpirationSweeper already running");
            return;
        }

        running = true;
        long intervalMs = Math.max(1L, interval.toMillis());
        scheduler.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("ExpirationSweeper started with interval of {} ms", intervalMs);
    }

    /**
     * Stop the sweep schedule and wait briefly for an in-flight sweep.
     */
    public synchronized void stop() {
        if (!running) {
            scheduler.shutdownNow();
            return;
        }

        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            logger.info("ExpirationSweeper stopped");
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }

    private void sweep() {
        try {
            int removed = sweepTask.getAsInt();
            if (removed > 0) {
                logger.debug("Sweep removed {} expired entries", removed);
            }
        } catch (Exception e) {
            logger.error("Error during expiration sweep", e);
        }
    }
}
