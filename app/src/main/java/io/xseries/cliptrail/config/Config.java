/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.config;

import java.util.Locale;

/**
 * Immutable ClipTrail configuration.
 *
 * Stored in JSON (config.json) under {@link AppPaths#dataDir()}.
 */
public final class Config {

    public static final int CURRENT_VERSION = 1;

    public static final int DEFAULT_HISTORY_LIMIT = 100;
    public static final int MAX_HISTORY_LIMIT = 10_000_000;

    public static final int DEFAULT_POLL_INTERVAL_MS = 500;
    public static final int MIN_POLL_INTERVAL_MS = 100;
    public static final int MAX_POLL_INTERVAL_MS = 5_000;

    public static final String STORAGE_JSON = "json";
    public static final String STORAGE_SQLITE = "sqlite";

    public static final String DEFAULT_HOTKEY = "Ctrl+Shift+V";

    private final int version;

    private final int historyLimit;
    private final boolean persistHistory;
    private final boolean fuzzyMatching;

    // boxed: absent in older files means "enabled"
    private final Boolean captureEnabled;
    private final boolean startMinimized;

    private final String storage;
    private final int pollIntervalMs;

    // popup shortcut, e.g. "Ctrl+Shift+V"; registered on Windows only
    private final String hotkey;

    public Config(
            int version,
            int historyLimit,
            boolean persistHistory,
            boolean fuzzyMatching,
            Boolean captureEnabled,
            boolean startMinimized,
            String storage,
            int pollIntervalMs,
            String hotkey
    ) {
        this.version = version;
        this.historyLimit = historyLimit;
        this.persistHistory = persistHistory;
        this.fuzzyMatching = fuzzyMatching;
        this.captureEnabled = captureEnabled;
        this.startMinimized = startMinimized;
        this.storage = storage;
        this.pollIntervalMs = pollIntervalMs;
        this.hotkey = hotkey;
    }

    public static Config defaults() {
        return new Config(
                CURRENT_VERSION,
                DEFAULT_HISTORY_LIMIT,
                false,
                false,
                true,
                false,
                STORAGE_JSON,
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_HOTKEY
        );
    }

    public Config normalized() {
        int v = version <= 0 ? CURRENT_VERSION : version;

        // 0 also covers a field missing from the json
        int hl = historyLimit;
        if (hl <= 0) hl = DEFAULT_HISTORY_LIMIT;
        if (hl > MAX_HISTORY_LIMIT) hl = MAX_HISTORY_LIMIT;

        boolean capture = captureEnabled == null || captureEnabled;

        String st = storage == null ? STORAGE_JSON : storage.trim().toLowerCase(Locale.ROOT);
        if (!STORAGE_JSON.equals(st) && !STORAGE_SQLITE.equals(st)) st = STORAGE_JSON;

        int poll = pollIntervalMs;
        if (poll <= 0) poll = DEFAULT_POLL_INTERVAL_MS;
        if (poll < MIN_POLL_INTERVAL_MS) poll = MIN_POLL_INTERVAL_MS;
        if (poll > MAX_POLL_INTERVAL_MS) poll = MAX_POLL_INTERVAL_MS;

        String hk = hotkey == null || hotkey.isBlank() ? DEFAULT_HOTKEY : hotkey.trim();

        return new Config(v, hl, persistHistory, fuzzyMatching, capture, startMinimized, st, poll, hk);
    }

    public int version() { return version; }
    public int historyLimit() { return historyLimit; }
    public boolean persistHistory() { return persistHistory; }
    public boolean fuzzyMatching() { return fuzzyMatching; }
    public boolean captureEnabled() { return captureEnabled == null || captureEnabled; }
    public boolean startMinimized() { return startMinimized; }
    public String storage() { return storage; }
    public int pollIntervalMs() { return pollIntervalMs; }
    public String hotkey() { return hotkey; }

    // Withers (for settings)
    public Config withHistoryLimit(int value) {
        return new Config(version, value, persistHistory, fuzzyMatching, captureEnabled, startMinimized, storage, pollIntervalMs, hotkey)
                .normalized();
    }

    public Config withPersistHistory(boolean value) {
        return new Config(version, historyLimit, value, fuzzyMatching, captureEnabled, startMinimized, storage, pollIntervalMs, hotkey)
                .normalized();
    }

    public Config withFuzzyMatching(boolean value) {
        return new Config(version, historyLimit, persistHistory, value, captureEnabled, startMinimized, storage, pollIntervalMs, hotkey)
                .normalized();
    }

    public Config withCaptureEnabled(boolean value) {
        return new Config(version, historyLimit, persistHistory, fuzzyMatching, value, startMinimized, storage, pollIntervalMs, hotkey)
                .normalized();
    }

    public Config withStorage(String value) {
        return new Config(version, historyLimit, persistHistory, fuzzyMatching, captureEnabled, startMinimized, value, pollIntervalMs, hotkey)
                .normalized();
    }

    boolean sameAs(Config o) {
        if (o == this) return true;
        if (o == null) return false;
        return version == o.version
                && historyLimit == o.historyLimit
                && persistHistory == o.persistHistory
                && fuzzyMatching == o.fuzzyMatching
                && captureEnabled() == o.captureEnabled()
                && startMinimized == o.startMinimized
                && java.util.Objects.equals(storage, o.storage)
                && pollIntervalMs == o.pollIntervalMs
                && java.util.Objects.equals(hotkey, o.hotkey);
    }
}
