/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.search;

import io.xseries.cliptrail.data.model.ClipEntry;

/**
 * @param rank 1-based position in the history (how far back in time), not a relevance score
 */
public record SearchHit(int rank, ClipEntry entry) {}
