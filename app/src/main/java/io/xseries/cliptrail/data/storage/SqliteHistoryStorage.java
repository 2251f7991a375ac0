/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.data.storage;

import io.xseries.cliptrail.data.dao.ClipEntryDao;
import io.xseries.cliptrail.data.db.Database;
import io.xseries.cliptrail.data.model.ClipEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * History kept in a SQLite table instead of the JSON file.
 */
public final class SqliteHistoryStorage implements HistoryStorage {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteHistoryStorage.class);

    private final Database db;
    private final ClipEntryDao dao;

    public SqliteHistoryStorage(Database db) {
        this.db = Objects.requireNonNull(db);
        this.dao = new ClipEntryDao(db);
    }

    @Override
    public List<ClipEntry> load() {
        try {
            db.init();
            List<ClipEntry> entries = dao.listAll();
            LOGGER.debug("Read {} history entries from {}", entries.size(), db.dbPath());
            return entries;
        } catch (RuntimeException e) {
            LOGGER.warn("Failed reading clipboard history from {}", db.dbPath(), e);
            return List.of();
        }
    }

    @Override
    public void save(List<ClipEntry> entries) {
        try {
            db.init();
            dao.replaceAll(entries);
            LOGGER.debug("Wrote {} history entries to {}", entries.size(), db.dbPath());
        } catch (RuntimeException e) {
            LOGGER.warn("Failed writing clipboard history to {}", db.dbPath(), e);
        }
    }
}
