/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.search;

import io.xseries.cliptrail.data.model.ClipEntry;
import io.xseries.cliptrail.domain.history.ClipHistory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Filters the history under its read lock.
 *
 * Results keep recency order. Text relevance only decides membership;
 * the rank shown next to a hit is its position in the full history.
 */
public final class HistorySearch {

    private final ClipHistory history;

    public HistorySearch(ClipHistory history) {
        this.history = Objects.requireNonNull(history);
    }

    public List<SearchHit> search(String query, boolean fuzzy) {
        ClipMatcher matcher = ClipMatcher.forQuery(query, fuzzy);

        return history.read(entries -> {
            List<SearchHit> hits = new ArrayList<>();
            int rank = 0;
            for (ClipEntry e : entries) {
                ++rank;
                if (matcher.matches(e.text())) hits.add(new SearchHit(rank, e));
            }
            return hits;
        });
    }
}
