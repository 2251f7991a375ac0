/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.data.storage;

import io.xseries.cliptrail.data.model.ClipEntry;

import java.util.List;

/**
 * Durable form of the history, most recent entry first.
 *
 * Implementations never throw: a failed load is an empty history,
 * a failed save is skipped. Both are logged.
 */
public interface HistoryStorage {

    List<ClipEntry> load();

    void save(List<ClipEntry> entries);
}
