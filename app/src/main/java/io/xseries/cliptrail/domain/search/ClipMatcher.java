/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.search;

import java.util.Locale;

/**
 * Text predicate built once per query.
 *
 * Fuzzy matching accepts everything exact matching accepts.
 */
public interface ClipMatcher {

    boolean matches(String text);

    static ClipMatcher forQuery(String query, boolean fuzzy) {
        String q = query == null ? "" : query;
        return fuzzy ? new FuzzyMatcher(q) : new SubstringMatcher(q);
    }

    static String fold(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
