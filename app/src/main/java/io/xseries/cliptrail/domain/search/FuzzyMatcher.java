/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.search;

/**
 * Case-insensitive subsequence match: every character of the query must
 * appear in the text in order, gaps allowed.
 */
public final class FuzzyMatcher implements ClipMatcher {

    private final String needle;

    public FuzzyMatcher(String query) {
        this.needle = ClipMatcher.fold(query);
    }

    @Override
    public boolean matches(String text) {
        if (needle.isEmpty()) return true;
        if (text == null) return false;

        String hay = ClipMatcher.fold(text);
        int n = needle.length();
        if (n > hay.length()) return false;

        int i = 0;
        for (int j = 0; j < hay.length() && i < n; j++) {
            if (hay.charAt(j) == needle.charAt(i)) i++;
        }
        return i == n;
    }
}
