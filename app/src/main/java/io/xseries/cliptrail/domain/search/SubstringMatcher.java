/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.search;

/**
 * Case-insensitive containment. The empty query matches everything.
 */
public final class SubstringMatcher implements ClipMatcher {

    private final String needle;

    public SubstringMatcher(String query) {
        this.needle = ClipMatcher.fold(query);
    }

    @Override
    public boolean matches(String text) {
        if (needle.isEmpty()) return true;
        if (text == null) return false;
        return ClipMatcher.fold(text).contains(needle);
    }
}
