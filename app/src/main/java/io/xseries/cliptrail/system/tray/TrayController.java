/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.system.tray;

import io.xseries.cliptrail.domain.service.ClipAction;
import io.xseries.cliptrail.domain.service.ClipItem;
import io.xseries.cliptrail.domain.service.ClipService;
import javafx.application.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Tray icon with a "Recent clips" submenu (click copies), pause toggle, settings and exit.
 *
 * The submenu is rebuilt from the history every time the icon is pressed, so it
 * is current when the menu opens. All AWT work happens on the event queue;
 * callbacks into the UI are handed to the FX thread.
 */
public final class TrayController {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrayController.class);

    static final int RECENT_ITEMS = 10;
    static final int LABEL_CHARS = 48;

    private static final String TOOLTIP = "ClipTrail";

    private final ClipService clips;
    private final AtomicBoolean paused = new AtomicBoolean(false);

    private TrayIcon trayIcon;
    private Menu recentMenu;
    private Consumer<Boolean> onPausedChanged = b -> {};

    public TrayController(ClipService clips) {
        this.clips = Objects.requireNonNull(clips);
    }

    /**
     * @param openShortcut label of the global shortcut shown next to "Open", or null
     */
    public void install(String openShortcut, Runnable onOpen, Runnable onSettings, Runnable onExit) {
        if (GraphicsEnvironment.isHeadless() || !SystemTray.isSupported()) {
            LOGGER.info("System tray not supported, running without tray icon");
            return;
        }

        EventQueue.invokeLater(() -> {
            if (trayIcon != null) return;
            try {
                SystemTray tray = SystemTray.getSystemTray();

                MenuItem open = new MenuItem(openShortcut == null ? "Open ClipTrail" : "Open ClipTrail (" + openShortcut + ")");
                open.addActionListener(e -> Platform.runLater(onOpen));

                recentMenu = new Menu("Recent clips");

                CheckboxMenuItem pause = new CheckboxMenuItem("Pause capturing", paused.get());
                pause.addItemListener(e -> setPaused(pause.getState()));

                MenuItem settings = new MenuItem("Settings…");
                settings.addActionListener(e -> Platform.runLater(onSettings));

                MenuItem exit = new MenuItem("Exit");
                exit.addActionListener(e -> Platform.runLater(onExit));

                PopupMenu menu = new PopupMenu();
                menu.add(open);
                menu.add(recentMenu);
                menu.addSeparator();
                menu.add(pause);
                menu.add(settings);
                menu.addSeparator();
                menu.add(exit);

                trayIcon = new TrayIcon(icon(tray.getTrayIconSize().width), TOOLTIP, menu);
                trayIcon.setImageAutoSize(true);
                trayIcon.addActionListener(e -> Platform.runLater(onOpen));
                trayIcon.addMouseListener(new MouseAdapter() {
                    @Override
                    public void mousePressed(MouseEvent e) {
                        refreshRecent();
                    }
                });

                refreshRecent();
                tray.add(trayIcon);
                LOGGER.debug("Tray icon installed");
            } catch (AWTException | RuntimeException ex) {
                LOGGER.warn("Failed installing tray icon", ex);
                trayIcon = null;
            }
        });
    }

    public boolean isPaused() {
        return paused.get();
    }

    public void setOnPausedChanged(Consumer<Boolean> onPausedChanged) {
        this.onPausedChanged = (onPausedChanged != null) ? onPausedChanged : (b -> {});
    }

    private void setPaused(boolean value) {
        if (paused.getAndSet(value) == value) return;
        LOGGER.info(value ? "Clipboard capture paused" : "Clipboard capture resumed");
        updateTooltip();
        Platform.runLater(() -> onPausedChanged.accept(value));
    }

    // event queue only
    private void refreshRecent() {
        if (recentMenu == null) return;

        List<ClipItem> items = clips.recent(RECENT_ITEMS);
        recentMenu.removeAll();
        if (items.isEmpty()) {
            MenuItem none = new MenuItem("(empty)");
            none.setEnabled(false);
            recentMenu.add(none);
        }
        for (ClipItem item : items) {
            MenuItem mi = new MenuItem(menuLabel(item.text()));
            item.action(ClipAction.COPY).ifPresent(copy -> mi.addActionListener(e -> copy.execute()));
            recentMenu.add(mi);
        }
        updateTooltip();
    }

    private void updateTooltip() {
        EventQueue.invokeLater(() -> {
            if (trayIcon == null) return;
            int size = clips.history().size();
            trayIcon.setToolTip(isPaused()
                    ? TOOLTIP + " (paused)"
                    : TOOLTIP + " (" + size + (size == 1 ? " clip)" : " clips)"));
        });
    }

    public void shutdown() {
        EventQueue.invokeLater(() -> {
            if (trayIcon == null) return;
            SystemTray.getSystemTray().remove(trayIcon);
            trayIcon = null;
            recentMenu = null;
        });
    }

    /**
     * One-line menu label: whitespace runs collapse to a single space, long text is cut with an ellipsis.
     */
    static String menuLabel(String text) {
        String line = text.strip().replaceAll("\\s+", " ");
        if (line.length() <= LABEL_CHARS) return line;
        return line.substring(0, LABEL_CHARS - 1) + "…";
    }

    private static Image icon(int size) {
        int s = Math.max(16, size);
        BufferedImage img = new BufferedImage(s, s, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(new Color(70, 130, 200));
            g.fillRoundRect(1, 2, s - 2, s - 3, s / 4, s / 4);
            g.setColor(new Color(230, 230, 230));
            g.fillRect(s / 3, 0, s / 3, s / 5);
        } finally {
            g.dispose();
        }
        return img;
    }
}
