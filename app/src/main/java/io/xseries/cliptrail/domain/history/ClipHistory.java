/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.history;

import io.xseries.cliptrail.data.model.ClipEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Bounded, deduplicated clipboard history, most recent entry first.
 *
 * Guarantees (after every mutating call):
 * - no two entries share the same text
 * - size() <= limit()
 * - entries beyond the limit are dropped from the tail (oldest)
 *
 * One read/write lock guards the entries and the limit together.
 * Readers run in parallel, mutations are exclusive and never observed half-done.
 */
public final class ClipHistory {

    public static final int DEFAULT_LIMIT = 100;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // index 0 = most recent
    private final List<ClipEntry> entries = new ArrayList<>();
    private int limit;

    public ClipHistory() {
        this(DEFAULT_LIMIT);
    }

    public ClipHistory(int limit) {
        this.limit = requireValidLimit(limit);
    }

    /**
     * Inserts at the front. An entry with the same text moves to the front
     * carrying the new timestamp.
     */
    public void insert(ClipEntry entry) {
        Objects.requireNonNull(entry, "entry");

        lock.writeLock().lock();
        try {
            removeText(entry.text());
            entries.add(0, entry);
            truncate();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return true if an entry with this text was present
     */
    public boolean remove(String text) {
        if (text == null) return false;

        lock.writeLock().lock();
        try {
            return removeText(text);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setLimit(int newLimit) {
        requireValidLimit(newLimit);

        lock.writeLock().lock();
        try {
            limit = newLimit;
            truncate();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the whole content with previously stored entries.
     * The first occurrence of a text wins; the result is cut to the current limit.
     */
    public void restore(List<ClipEntry> loaded) {
        Objects.requireNonNull(loaded, "loaded");

        List<ClipEntry> unique = new ArrayList<>(loaded.size());
        Set<String> seen = new HashSet<>();
        for (ClipEntry e : loaded) {
            if (e != null && seen.add(e.text())) unique.add(e);
        }

        lock.writeLock().lock();
        try {
            entries.clear();
            entries.addAll(unique);
            truncate();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs {@code reader} against an unmodifiable view while the read lock is held.
     * The view must not escape the reader.
     */
    public <T> T read(Function<List<ClipEntry>, T> reader) {
        Objects.requireNonNull(reader, "reader");

        lock.readLock().lock();
        try {
            return reader.apply(Collections.unmodifiableList(entries));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ClipEntry> snapshot() {
        return read(List::copyOf);
    }

    public int limit() {
        lock.readLock().lock();
        try {
            return limit;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        return read(List::size);
    }

    // --- callers hold the write lock ---

    private boolean removeText(String text) {
        return entries.removeIf(e -> e.text().equals(text));
    }

    private void truncate() {
        if (entries.size() > limit) {
            entries.subList(limit, entries.size()).clear();
        }
    }

    private static int requireValidLimit(int value) {
        if (value < 1) throw new IllegalArgumentException("history limit must be >= 1, got " + value);
        return value;
    }
}
