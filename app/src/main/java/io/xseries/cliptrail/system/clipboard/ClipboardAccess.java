/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.system.clipboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.GraphicsEnvironment;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;

/**
 * System clipboard through AWT. Never throws: unreadable or non-text content reads as null.
 */
public final class ClipboardAccess {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClipboardAccess.class);

    public String getTextSafely() {
        Clipboard clipboard = systemClipboard();
        if (clipboard == null) return null;

        try {
            var contents = clipboard.getContents(null);
            if (contents == null) return null;
            if (!contents.isDataFlavorSupported(DataFlavor.stringFlavor)) return null;

            Object data = contents.getTransferData(DataFlavor.stringFlavor);
            return (data instanceof String s) ? s : null;

        } catch (IllegalStateException busy) {
            // another application holds the clipboard; next tick retries
            LOGGER.trace("Clipboard busy", busy);
            return null;
        } catch (Exception e) {
            LOGGER.debug("Failed reading clipboard", e);
            return null;
        }
    }

    public void setTextSafely(String text) {
        if (text == null) return;
        Clipboard clipboard = systemClipboard();
        if (clipboard == null) return;

        try {
            clipboard.setContents(new StringSelection(text), null);
        } catch (Exception e) {
            LOGGER.warn("Failed setting clipboard text", e);
        }
    }

    private Clipboard systemClipboard() {
        if (GraphicsEnvironment.isHeadless()) return null;
        try {
            return Toolkit.getDefaultToolkit().getSystemClipboard();
        } catch (Exception e) {
            LOGGER.debug("System clipboard unavailable", e);
            return null;
        }
    }
}
