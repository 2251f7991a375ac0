/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.system.paste;

/**
 * Sends a paste keystroke to whatever window has focus.
 */
public interface PasteSupport {

    boolean isSupported();

    /**
     * Pastes the current clipboard content into the focused window.
     */
    void paste();
}
