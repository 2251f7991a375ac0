/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.config;

import java.nio.file.Path;

/**
 * Single source of truth for the ClipTrail filesystem layout.
 *
 * All user data lives in one folder; the "cliptrail.home" system property overrides it.
 */
public final class AppPaths {

    public static final String HOME_PROPERTY = "cliptrail.home";
    public static final String HISTORY_FILE_NAME = "clipboard_history";

    private static final String APP_DIR = ".cliptrail";

    private AppPaths() {}

    public static Path dataDir() {
        String override = System.getProperty(HOME_PROPERTY);
        if (override != null && !override.isBlank()) return Path.of(override);
        return Path.of(System.getProperty("user.home"), APP_DIR);
    }

    public static Path configPath() {
        return dataDir().resolve("config.json");
    }

    public static Path historyPath() {
        return dataDir().resolve(HISTORY_FILE_NAME);
    }

    public static Path dbPath() {
        return dataDir().resolve("history.db");
    }

    public static Path snippetsDir() {
        return dataDir().resolve("snippets");
    }
}
