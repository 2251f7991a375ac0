/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.service;

import java.util.List;
import java.util.Optional;

/**
 * A search result ready for display.
 *
 * @param subtitle "#rank" followed by the locale formatted capture time
 */
public record ClipItem(int rank, String text, String subtitle, List<ClipAction> actions) {

    public ClipItem {
        actions = List.copyOf(actions);
    }

    public Optional<ClipAction> action(String id) {
        return actions.stream().filter(a -> a.id().equals(id)).findFirst();
    }

    public Optional<ClipAction> defaultAction() {
        return actions.stream().findFirst();
    }
}
