/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.system.clipboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Owns the ClipboardWatcher lifecycle and allows safe enable/disable without app restart.
 *
 * Guarantees:
 * - enable() runs the startup barrier, so the current clipboard is NOT captured
 * - disable() stops the background thread immediately
 * - idempotent operations
 */
public final class WatcherController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WatcherController.class);

    private final Runnable onTick;
    private final Runnable onBarrier;
    private final BooleanSupplier isPaused;
    private final long pollMs;

    private final Object lock = new Object();
    private final AtomicBoolean enabled = new AtomicBoolean(false);

    private ClipboardWatcher watcher;

    public WatcherController(Runnable onTick, Runnable onBarrier, BooleanSupplier isPaused, long pollMs) {
        this.onTick = Objects.requireNonNull(onTick);
        this.onBarrier = Objects.requireNonNull(onBarrier);
        this.isPaused = Objects.requireNonNull(isPaused);
        this.pollMs = pollMs;
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public void setEnabled(boolean value) {
        if (value) enable();
        else disable();
    }

    public void enable() {
        synchronized (lock) {
            if (enabled.get()) return;

            ClipboardWatcher w = new ClipboardWatcher(onTick, onBarrier, isPaused, pollMs);
            w.start();

            watcher = w;
            enabled.set(true);
            LOGGER.info("Clipboard capture enabled (poll every {} ms)", pollMs);
        }
    }

    public void disable() {
        synchronized (lock) {
            if (!enabled.get()) return;

            try {
                if (watcher != null) watcher.close();
            } finally {
                watcher = null;
                enabled.set(false);
                LOGGER.info("Clipboard capture disabled");
            }
        }
    }

    @Override
    public void close() {
        disable();
    }
}
