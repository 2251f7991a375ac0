/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Objects;

/**
 * Reads and writes config.json.
 *
 * A missing file is created with defaults. An unreadable file is renamed to
 * config.bad-&lt;epoch millis&gt;.json and replaced with defaults. Values are always
 * returned normalized, and rewritten when normalizing changed them.
 */
public final class ConfigService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigService.class);

    private final Path path;
    private final Clock clock;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public ConfigService(Path path) {
        this(path, Clock.systemUTC());
    }

    ConfigService(Path path, Clock clock) {
        this.path = Objects.requireNonNull(path);
        this.clock = Objects.requireNonNull(clock);
    }

    public Config loadOrCreate() {
        if (Files.notExists(path)) {
            LOGGER.info("No config at {}, writing defaults", path);
            return writeDefaults();
        }

        Config stored;
        try {
            stored = read();
        } catch (IOException | JsonParseException e) {
            LOGGER.warn("Unreadable config {}, falling back to defaults", path, e);
            quarantine();
            return writeDefaults();
        }

        Config normalized = stored.normalized();
        if (!stored.sameAs(normalized)) {
            LOGGER.debug("Rewriting normalized config {}", path);
            write(normalized);
        }
        return normalized;
    }

    public void persist(Config cfg) {
        if (cfg == null) return;
        write(cfg.normalized());
    }

    private Config read() throws IOException {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Config cfg = gson.fromJson(r, Config.class);
            if (cfg == null) throw new JsonParseException("empty config file");
            return cfg;
        }
    }

    private Config writeDefaults() {
        Config cfg = Config.defaults();
        write(cfg);
        return cfg;
    }

    // temp file + atomic rename so a crash never leaves a half-written config
    private void write(Config cfg) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(cfg, w);
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Failed writing config {}", path, e);
        }
    }

    private void quarantine() {
        Path bad = path.resolveSibling("config.bad-" + clock.millis() + ".json");
        try {
            Files.move(path, bad, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Kept unreadable config as {}", bad);
        } catch (IOException e) {
            LOGGER.warn("Failed moving unreadable config {}", path, e);
        }
    }
}
