/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.service;

import io.xseries.cliptrail.data.model.ClipEntry;
import io.xseries.cliptrail.domain.history.ClipHistory;
import io.xseries.cliptrail.domain.search.HistorySearch;
import io.xseries.cliptrail.domain.search.SearchHit;
import io.xseries.cliptrail.domain.snippet.SnippetSink;
import io.xseries.cliptrail.system.clipboard.ClipboardAccess;
import io.xseries.cliptrail.system.paste.PasteSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Entry point for the clipboard trigger and for search requests.
 *
 * Ingestion: trigger -> read clipboard -> {@link IngestionFilter} -> {@link ClipHistory#insert}.
 * Search: {@link HistorySearch} under the read lock, then actions are attached per result.
 * Actions re-enter the history on their own (write lock), never inside the search.
 */
public final class ClipService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClipService.class);

    private final ClipHistory history;
    private final IngestionFilter filter;
    private final HistorySearch search;
    private final ClipboardAccess clipboard;
    private final PasteSupport paste;
    private final Optional<SnippetSink> snippets;
    private final BooleanSupplier fuzzyMatching;
    private final DateTimeFormatter timeFormat;

    public ClipService(
            ClipHistory history,
            IngestionFilter filter,
            ClipboardAccess clipboard,
            PasteSupport paste,
            Optional<SnippetSink> snippets,
            BooleanSupplier fuzzyMatching
    ) {
        this(history, filter, clipboard, paste, snippets, fuzzyMatching,
                DateTimeFormatter.ofLocalizedDateTime(FormatStyle.LONG).withZone(ZoneId.systemDefault()));
    }

    public ClipService(
            ClipHistory history,
            IngestionFilter filter,
            ClipboardAccess clipboard,
            PasteSupport paste,
            Optional<SnippetSink> snippets,
            BooleanSupplier fuzzyMatching,
            DateTimeFormatter timeFormat
    ) {
        this.history = Objects.requireNonNull(history);
        this.filter = Objects.requireNonNull(filter);
        this.search = new HistorySearch(history);
        this.clipboard = Objects.requireNonNull(clipboard);
        this.paste = Objects.requireNonNull(paste);
        this.snippets = Objects.requireNonNull(snippets);
        this.fuzzyMatching = Objects.requireNonNull(fuzzyMatching);
        this.timeFormat = Objects.requireNonNull(timeFormat);
    }

    public ClipHistory history() {
        return history;
    }

    // -------------------------
    // Ingestion
    // -------------------------

    /**
     * "Check the clipboard now". Triggers must arrive serialized (one watcher thread).
     */
    public void onClipboardTrigger() {
        ingestText(clipboard.getTextSafely());
    }

    /**
     * @return true if the text became the newest history entry
     */
    public boolean ingestText(String text) {
        Optional<ClipEntry> accepted = filter.observe(text);
        if (accepted.isEmpty()) return false;

        history.insert(accepted.get());
        LOGGER.trace("Captured clipboard text ({} chars)", text.length());
        return true;
    }

    /**
     * Treats the current clipboard content as already seen.
     */
    public void primeFromClipboard() {
        filter.prime(clipboard.getTextSafely());
    }

    // -------------------------
    // Search
    // -------------------------

    public List<ClipItem> query(String query) {
        List<SearchHit> hits = search.search(query, fuzzyMatching.getAsBoolean());

        List<ClipItem> items = new ArrayList<>(hits.size());
        for (SearchHit hit : hits) items.add(toItem(hit.rank(), hit.entry()));
        return items;
    }

    /**
     * The {@code max} newest entries, ranked like an empty query but without scanning the whole history.
     */
    public List<ClipItem> recent(int max) {
        List<ClipEntry> newest = history.read(entries -> List.copyOf(entries.subList(0, Math.min(Math.max(max, 0), entries.size()))));

        List<ClipItem> items = new ArrayList<>(newest.size());
        for (int i = 0; i < newest.size(); i++) items.add(toItem(i + 1, newest.get(i)));
        return items;
    }

    private ClipItem toItem(int rank, ClipEntry e) {
        String subtitle = "#" + rank + " " + timeFormat.format(e.capturedAt());
        return new ClipItem(rank, e.text(), subtitle, actionsFor(e.text()));
    }

    public boolean remove(String text) {
        boolean removed = history.remove(text);
        if (removed) LOGGER.debug("Removed history entry ({} chars)", text.length());
        return removed;
    }

    private List<ClipAction> actionsFor(String text) {
        List<ClipAction> actions = new ArrayList<>(4);

        if (paste.isSupported()) {
            actions.add(new ClipAction(ClipAction.COPY_AND_PASTE, "Copy and paste", () -> {
                clipboard.setTextSafely(text);
                paste.paste();
            }));
        }

        actions.add(new ClipAction(ClipAction.COPY, "Copy", () -> clipboard.setTextSafely(text)));

        actions.add(new ClipAction(ClipAction.REMOVE, "Remove", () -> remove(text)));

        snippets.ifPresent(sink ->
                actions.add(new ClipAction(ClipAction.SAVE_SNIPPET, "Save as snippet", () -> sink.addSnippet(text))));

        return actions;
    }
}
