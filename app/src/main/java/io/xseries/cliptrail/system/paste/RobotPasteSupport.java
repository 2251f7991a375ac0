/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.system.paste;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Robot;
import java.awt.event.KeyEvent;
import java.util.Locale;

/**
 * Presses Ctrl+V (Cmd+V on macOS) with {@link Robot}.
 *
 * The popup hides before pasting; the short delay lets focus return to the previous window.
 */
public final class RobotPasteSupport implements PasteSupport {

    private static final Logger LOGGER = LoggerFactory.getLogger(RobotPasteSupport.class);

    private static final int FOCUS_DELAY_MS = 120;

    private final Robot robot;

    public RobotPasteSupport() {
        this.robot = createRobot();
    }

    @Override
    public boolean isSupported() {
        return robot != null;
    }

    @Override
    public void paste() {
        if (robot == null) return;

        int modifier = isMac() ? KeyEvent.VK_META : KeyEvent.VK_CONTROL;
        Thread t = new Thread(() -> {
            try {
                robot.delay(FOCUS_DELAY_MS);
                robot.keyPress(modifier);
                robot.keyPress(KeyEvent.VK_V);
                robot.keyRelease(KeyEvent.VK_V);
                robot.keyRelease(modifier);
            } catch (Exception e) {
                LOGGER.warn("Paste keystroke failed", e);
            }
        }, "cliptrail-paste");
        t.setDaemon(true);
        t.start();
    }

    private static Robot createRobot() {
        if (GraphicsEnvironment.isHeadless()) return null;
        try {
            return new Robot();
        } catch (AWTException | SecurityException e) {
            LOGGER.info("Paste not supported: {}", e.getMessage());
            return null;
        }
    }

    private static boolean isMac() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("mac");
    }
}
