/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.data.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SQLite file holding the history when the "sqlite" storage is selected.
 * Connections are short-lived, one per load or save.
 */
public final class Database {

    private static final Logger LOGGER = LoggerFactory.getLogger(Database.class);

    private static final String SCHEMA_RESOURCE = "/db/schema.sql";
    private static final int BUSY_TIMEOUT_MS = 3000;

    // journal mode is stored in the file; the rest is per connection
    private static final List<String> INIT_PRAGMAS = List.of(
            "PRAGMA journal_mode=WAL",
            "PRAGMA synchronous=NORMAL"
    );

    private final Path dbPath;
    private final String jdbcUrl;

    private volatile boolean ready;

    public Database(Path dbPath) {
        this.dbPath = dbPath;
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
    }

    public Path dbPath() {
        return dbPath;
    }

    /**
     * Creates the parent directory and the history table if needed. Only the first call does work.
     */
    public synchronized void init() {
        if (ready) return;

        Path dir = dbPath.toAbsolutePath().getParent();
        try {
            if (dir != null) Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create database directory " + dir, e);
        }

        List<String> schema = schemaStatements();
        try (Connection c = open(); Statement st = c.createStatement()) {
            for (String pragma : INIT_PRAGMAS) st.execute(pragma);
            for (String ddl : schema) st.execute(ddl);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot initialize history database " + dbPath, e);
        }

        ready = true;
        LOGGER.debug("History database ready at {} ({} schema statements)", dbPath, schema.size());
    }

    public Connection open() throws SQLException {
        Connection c = DriverManager.getConnection(jdbcUrl);
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        } catch (SQLException e) {
            c.close();
            throw e;
        }
        return c;
    }

    /**
     * Statements of schema.sql, split on ';' with "--" comment lines removed.
     */
    static List<String> schemaStatements() {
        String script;
        try (InputStream in = Database.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing resource " + SCHEMA_RESOURCE);
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + SCHEMA_RESOURCE, e);
        }

        return Arrays.stream(script.split(";"))
                .map(chunk -> chunk.lines()
                        .filter(line -> !line.strip().startsWith("--"))
                        .collect(Collectors.joining("\n"))
                        .strip())
                .filter(sql -> !sql.isEmpty())
                .collect(Collectors.toList());
    }
}
