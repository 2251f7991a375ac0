/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.snippet;

/**
 * Receiver for the "Save as snippet" action.
 */
public interface SnippetSink {

    void addSnippet(String text);
}
