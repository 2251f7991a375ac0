/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.service;

import io.xseries.cliptrail.data.model.ClipEntry;
import io.xseries.cliptrail.data.storage.HistoryStorage;
import io.xseries.cliptrail.domain.history.ClipHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Loads the history once at startup and saves it once at shutdown,
 * both only while "store history" is enabled.
 *
 * The save copies a snapshot under the read lock and writes after releasing it.
 */
public final class HistoryPersistence {

    private static final Logger LOGGER = LoggerFactory.getLogger(HistoryPersistence.class);

    private final ClipHistory history;
    private final HistoryStorage storage;
    private final BooleanSupplier enabled;

    private final AtomicBoolean restored = new AtomicBoolean(false);
    private final AtomicBoolean flushed = new AtomicBoolean(false);

    public HistoryPersistence(ClipHistory history, HistoryStorage storage, BooleanSupplier enabled) {
        this.history = Objects.requireNonNull(history);
        this.storage = Objects.requireNonNull(storage);
        this.enabled = Objects.requireNonNull(enabled);
    }

    /**
     * @return number of entries now in the history
     */
    public int restore() {
        if (!restored.compareAndSet(false, true)) return history.size();
        if (!enabled.getAsBoolean()) return history.size();

        List<ClipEntry> loaded = storage.load();
        history.restore(loaded);

        int size = history.size();
        LOGGER.info("Restored {} clipboard history entries", size);
        return size;
    }

    public void flush() {
        if (!flushed.compareAndSet(false, true)) return;
        if (!enabled.getAsBoolean()) return;

        List<ClipEntry> snapshot = history.snapshot();
        storage.save(snapshot);
    }
}
