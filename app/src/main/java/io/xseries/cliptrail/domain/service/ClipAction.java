/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.service;

/**
 * Action offered on a search result.
 *
 * @param id stable identifier ("c", "cp", "r", "s")
 * @param label text shown in the UI
 */
public record ClipAction(String id, String label, Runnable run) {

    public static final String COPY_AND_PASTE = "c";
    public static final String COPY = "cp";
    public static final String REMOVE = "r";
    public static final String SAVE_SNIPPET = "s";

    public void execute() {
        run.run();
    }
}
