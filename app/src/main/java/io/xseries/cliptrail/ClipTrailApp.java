/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail;

import io.xseries.cliptrail.config.AppPaths;
import io.xseries.cliptrail.config.Config;
import io.xseries.cliptrail.config.ConfigService;
import io.xseries.cliptrail.config.SettingsService;
import io.xseries.cliptrail.data.db.Database;
import io.xseries.cliptrail.data.storage.HistoryStorage;
import io.xseries.cliptrail.data.storage.JsonHistoryStorage;
import io.xseries.cliptrail.data.storage.SqliteHistoryStorage;
import io.xseries.cliptrail.domain.history.ClipHistory;
import io.xseries.cliptrail.domain.service.ClipService;
import io.xseries.cliptrail.domain.service.HistoryPersistence;
import io.xseries.cliptrail.domain.service.IngestionFilter;
import io.xseries.cliptrail.domain.snippet.FolderSnippetSink;
import io.xseries.cliptrail.domain.snippet.SnippetSink;
import io.xseries.cliptrail.system.clipboard.ClipboardAccess;
import io.xseries.cliptrail.system.clipboard.WatcherController;
import io.xseries.cliptrail.system.hotkey.GlobalHotkey;
import io.xseries.cliptrail.system.hotkey.HotkeyBinding;
import io.xseries.cliptrail.system.paste.RobotPasteSupport;
import io.xseries.cliptrail.system.tray.TrayController;
import io.xseries.cliptrail.ui.PopupWindow;
import io.xseries.cliptrail.ui.SettingsWindow;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

public final class ClipTrailApp extends Application {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClipTrailApp.class);

    private final AtomicBoolean exiting = new AtomicBoolean(false);
    private final AtomicBoolean shutdownOnce = new AtomicBoolean(false);

    private HistoryPersistence persistence;
    private WatcherController watcherController;
    private TrayController tray;
    private GlobalHotkey hotkey;

    @Override
    public void start(Stage unusedStage) {
        Platform.setImplicitExit(false);

        // --- paths + config ---
        ConfigService configService = new ConfigService(AppPaths.configPath());
        Config config = configService.loadOrCreate();
        LOGGER.info("ClipTrail starting, data dir {}", AppPaths.dataDir());

        // --- history ---
        ClipHistory history = new ClipHistory(config.historyLimit());
        SettingsService settings = new SettingsService(configService, history, config);

        persistence = new HistoryPersistence(history, createStorage(config), settings::persistHistory);
        persistence.restore();

        // --- services ---
        ClipboardAccess clipboard = new ClipboardAccess();
        Optional<SnippetSink> snippets = Optional.of(new FolderSnippetSink(AppPaths.snippetsDir()));

        ClipService clipService = new ClipService(
                history,
                new IngestionFilter(),
                clipboard,
                new RobotPasteSupport(),
                snippets,
                settings::fuzzyMatching
        );

        // --- runtime controllers ---
        this.tray = new TrayController(clipService);

        watcherController = new WatcherController(
                clipService::onClipboardTrigger,
                clipService::primeFromClipboard,
                tray::isPaused,
                config.pollIntervalMs()
        );

        SettingsWindow settingsWindow = new SettingsWindow(settings, watcherController);
        PopupWindow popup = new PopupWindow(clipService, settingsWindow::show);

        String shortcut = startHotkey(config, popup);

        tray.install(
                shortcut,
                popup::showOrFocus,
                settingsWindow::show,
                this::exitApplication
        );

        popup.setPaused(tray.isPaused());
        tray.setOnPausedChanged(popup::setPaused);

        watcherController.setEnabled(settings.captureEnabled());

        if (!config.startMinimized()) {
            Platform.runLater(popup::showOrFocus);
        }
    }

    /**
     * @return the active shortcut label, or null when no global shortcut is registered
     */
    private String startHotkey(Config config, PopupWindow popup) {
        if (!GlobalHotkey.isSupported()) return null;

        HotkeyBinding binding = HotkeyBinding.parse(config.hotkey()).orElse(null);
        if (binding == null) {
            LOGGER.warn("Unrecognized hotkey '{}' in config, no global shortcut", config.hotkey());
            return null;
        }

        hotkey = new GlobalHotkey(binding, () -> Platform.runLater(popup::showOrFocus));
        return hotkey.start() ? binding.label() : null;
    }

    private static HistoryStorage createStorage(Config config) {
        if (Config.STORAGE_SQLITE.equals(config.storage())) {
            return new SqliteHistoryStorage(new Database(AppPaths.dbPath()));
        }
        return new JsonHistoryStorage(AppPaths.historyPath());
    }

    private void exitApplication() {
        if (!exiting.compareAndSet(false, true)) return;

        Platform.runLater(() -> {
            try {
                shutdownInternal();
            } finally {
                Platform.exit();
                // AWT tray thread is not a daemon
                System.exit(0);
            }
        });
    }

    @Override
    public void stop() {
        shutdownInternal();
    }

    private void shutdownInternal() {
        if (!shutdownOnce.compareAndSet(false, true)) return;

        // stop capture first so the saved snapshot is final
        if (watcherController != null) {
            watcherController.close();
            watcherController = null;
        }

        if (persistence != null) {
            persistence.flush();
            persistence = null;
        }

        if (hotkey != null) {
            hotkey.close();
            hotkey = null;
        }

        if (tray != null) {
            tray.shutdown();
            tray = null;
        }

        LOGGER.info("ClipTrail stopped");
    }
}
