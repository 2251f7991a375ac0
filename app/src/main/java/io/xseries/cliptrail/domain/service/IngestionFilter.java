/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.service;

import io.xseries.cliptrail.data.model.ClipEntry;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether an observed clipboard value becomes a history entry.
 *
 * Rejected:
 * - null, empty or whitespace-only text (images, pixmaps, incidental selections)
 * - text identical to the last accepted value, even if that entry was removed since
 *
 * The filter does not touch the history; callers insert the returned entry.
 */
public final class IngestionFilter {

    private final Clock clock;

    // last accepted raw candidate, kept even after the entry is removed from history
    private String lastAccepted;

    public IngestionFilter() {
        this(Clock.systemDefaultZone());
    }

    public IngestionFilter(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    public synchronized Optional<ClipEntry> observe(String candidate) {
        if (isBlank(candidate)) return Optional.empty();
        if (candidate.equals(lastAccepted)) return Optional.empty();

        lastAccepted = candidate;
        return Optional.of(new ClipEntry(candidate, clock.instant()));
    }

    /**
     * Marks {@code current} as already seen without producing an entry.
     * Used when capture starts so the text already on the clipboard is not captured.
     */
    public synchronized void prime(String current) {
        if (isBlank(current)) return;
        lastAccepted = current;
    }

    // Unicode spaces count too (NBSP, EM SPACE, ideographic space)
    static boolean isBlank(String text) {
        return text == null
                || text.codePoints().allMatch(cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp));
    }

    synchronized String lastAccepted() {
        return lastAccepted;
    }
}
