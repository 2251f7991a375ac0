/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.data.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One captured clipboard text with the moment it was observed.
 * The text is the identity used for deduplication.
 */
public record ClipEntry(String text, Instant capturedAt) {

    public ClipEntry {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(capturedAt, "capturedAt");
        if (text.isEmpty()) throw new IllegalArgumentException("text must not be empty");
    }

    public static ClipEntry ofEpochSecond(String text, long epochSecond) {
        return new ClipEntry(text, Instant.ofEpochSecond(epochSecond));
    }

    public long epochSecond() {
        return capturedAt.getEpochSecond();
    }
}
