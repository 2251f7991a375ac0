/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.config;

import io.xseries.cliptrail.domain.history.ClipHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runtime settings. Every change is written to config.json and applied right away.
 *
 * - history limit: rejected below 1, otherwise truncates the history immediately
 * - store history: read at the next startup/shutdown
 * - fuzzy matching: read by the next search
 * - capture enabled: persisted; the caller starts/stops the watcher
 */
public final class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);

    private final ConfigService configService;
    private final ClipHistory history;

    private volatile Config current;

    public SettingsService(ConfigService configService, ClipHistory history, Config initial) {
        this.configService = Objects.requireNonNull(configService);
        this.history = Objects.requireNonNull(history);
        this.current = (initial == null ? Config.defaults() : initial).normalized();
    }

    public Config current() {
        return current;
    }

    public int historyLimit() {
        return current.historyLimit();
    }

    /**
     * @return false if {@code value} was rejected and the limit is unchanged
     */
    public synchronized boolean setHistoryLimit(int value) {
        if (value < 1 || value > Config.MAX_HISTORY_LIMIT) {
            LOGGER.warn("Ignoring invalid history limit {}", value);
            return false;
        }
        if (value == current.historyLimit()) return true;

        update(current.withHistoryLimit(value));
        history.setLimit(value);
        return true;
    }

    public boolean persistHistory() {
        return current.persistHistory();
    }

    public synchronized void setPersistHistory(boolean value) {
        if (value == current.persistHistory()) return;
        update(current.withPersistHistory(value));
    }

    public boolean fuzzyMatching() {
        return current.fuzzyMatching();
    }

    public synchronized void setFuzzyMatching(boolean value) {
        if (value == current.fuzzyMatching()) return;
        update(current.withFuzzyMatching(value));
    }

    public boolean captureEnabled() {
        return current.captureEnabled();
    }

    public synchronized void setCaptureEnabled(boolean value) {
        if (value == current.captureEnabled()) return;
        update(current.withCaptureEnabled(value));
    }

    private void update(Config next) {
        current = next;
        configService.persist(next);
    }
}
