/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.system.clipboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Polling clipboard trigger.
 *
 * Fires {@code onTick} from a single daemon thread, so ticks never overlap.
 * While paused, and when capture starts or resumes, {@code onBarrier} runs instead:
 * it marks the current clipboard text as seen so it is not captured.
 */
public final class ClipboardWatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClipboardWatcher.class);

    private static final long PAUSED_POLL_MS = 600;
    private static final long MAX_BACKOFF_MS = 3000;

    private final ScheduledExecutorService exec =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cliptrail-clipboard-watcher");
                t.setDaemon(true);
                return t;
            });

    private final Runnable onTick;
    private final Runnable onBarrier;
    private final BooleanSupplier isPaused;
    private final long pollMs;

    private volatile boolean closed = false;
    private volatile boolean started = false;

    // only touched from the watcher thread
    private boolean wasPaused = false;
    private int consecutiveFailures = 0;

    public ClipboardWatcher(Runnable onTick, Runnable onBarrier, BooleanSupplier isPaused, long pollMs) {
        this.onTick = Objects.requireNonNull(onTick);
        this.onBarrier = Objects.requireNonNull(onBarrier);
        this.isPaused = Objects.requireNonNull(isPaused);
        if (pollMs <= 0) throw new IllegalArgumentException("pollMs must be > 0");
        this.pollMs = pollMs;
    }

    public void start() {
        if (started) return;
        started = true;

        // --- STARTUP BARRIER ---
        exec.execute(this::barrierSafely);
        scheduleNext(pollMs);
    }

    private void scheduleNext(long delayMs) {
        if (closed) return;
        exec.schedule(this::tickSafely, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
    }

    private void tickSafely() {
        if (closed) return;

        try {
            if (isPaused.getAsBoolean()) {
                wasPaused = true;
                barrierSafely();
                scheduleNext(PAUSED_POLL_MS);
                return;
            }

            if (wasPaused) {
                wasPaused = false;
                barrierSafely();
                scheduleNext(pollMs);
                return;
            }

            onTick.run();

            consecutiveFailures = 0;
            scheduleNext(pollMs);

        } catch (Exception e) {
            consecutiveFailures++;
            LOGGER.warn("Clipboard check failed ({} in a row)", consecutiveFailures, e);
            scheduleNext(backoffDelayMs(consecutiveFailures));
        }
    }

    private void barrierSafely() {
        try {
            onBarrier.run();
        } catch (Exception e) {
            LOGGER.debug("Clipboard snapshot failed", e);
        }
    }

    long backoffDelayMs(int failures) {
        long d = pollMs * (1L << Math.min(failures, 4));
        return Math.min(Math.max(pollMs, d), Math.max(pollMs, MAX_BACKOFF_MS));
    }

    @Override
    public void close() {
        closed = true;
        exec.shutdownNow();
    }
}
