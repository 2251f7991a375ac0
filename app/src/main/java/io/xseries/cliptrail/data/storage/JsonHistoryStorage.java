/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.data.storage;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.xseries.cliptrail.data.model.ClipEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * History as a JSON array:
 * <pre>
 * [ { "text": "...", "datetime": 1700000000 }, ... ]
 * </pre>
 * datetime is whole seconds since the epoch; array order is history order.
 */
public final class JsonHistoryStorage implements HistoryStorage {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonHistoryStorage.class);

    private static final Type RECORDS = new TypeToken<List<StoredClip>>() {}.getType();

    private final Path path;
    private final Gson gson;

    public JsonHistoryStorage(Path path) {
        this.path = Objects.requireNonNull(path);
        this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    }

    @Override
    public List<ClipEntry> load() {
        LOGGER.debug("Reading clipboard history from {}", path);

        List<StoredClip> records;
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            records = gson.fromJson(r, RECORDS);
        } catch (NoSuchFileException missing) {
            LOGGER.debug("No clipboard history at {}", path);
            return List.of();
        } catch (IOException | JsonParseException e) {
            LOGGER.warn("Failed reading clipboard history {}", path, e);
            return List.of();
        }

        if (records == null) return List.of();

        List<ClipEntry> out = new ArrayList<>(records.size());
        for (StoredClip rec : records) {
            if (rec == null || rec.text == null || rec.text.isEmpty()) {
                LOGGER.debug("Skipping empty history record");
                continue;
            }
            try {
                out.add(ClipEntry.ofEpochSecond(rec.text, rec.datetime));
            } catch (DateTimeException e) {
                LOGGER.warn("Skipping history record with out-of-range datetime {}", rec.datetime);
            }
        }
        return out;
    }

    @Override
    public void save(List<ClipEntry> entries) {
        List<StoredClip> records = new ArrayList<>(entries.size());
        for (ClipEntry e : entries) records.add(new StoredClip(e.text(), e.epochSecond()));

        Path dir = path.toAbsolutePath().getParent();
        try {
            if (dir != null) Files.createDirectories(dir);
        } catch (IOException e) {
            LOGGER.warn("Failed creating data dir {}", dir, e);
            return;
        }

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(records, RECORDS, w);
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOGGER.debug("Wrote {} history entries to {}", records.size(), path);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Failed writing history file {}", path, e);
        }
    }

    // on-disk record, field names are the file format
    private static final class StoredClip {
        String text;
        long datetime;

        StoredClip(String text, long datetime) {
            this.text = text;
            this.datetime = datetime;
        }
    }
}
