/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.domain.snippet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.Objects;

/**
 * Stores every snippet as its own UTF-8 text file.
 *
 * File names come from the first words of the snippet ("hello-world.txt"),
 * with "-2", "-3", ... appended when the name is taken.
 */
public final class FolderSnippetSink implements SnippetSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(FolderSnippetSink.class);

    private static final int MAX_NAME_CHARS = 40;
    private static final int MAX_ATTEMPTS = 1_000;

    private final Path dir;

    public FolderSnippetSink(Path dir) {
        this.dir = Objects.requireNonNull(dir);
    }

    public Path dir() {
        return dir;
    }

    @Override
    public void addSnippet(String text) {
        if (text == null || text.isBlank()) return;

        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            LOGGER.warn("Failed creating snippets dir {}", dir, e);
            return;
        }

        String base = baseName(text);
        for (int n = 1; n <= MAX_ATTEMPTS; n++) {
            Path file = dir.resolve(n == 1 ? base + ".txt" : base + "-" + n + ".txt");
            try {
                Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
                LOGGER.debug("Saved snippet to {}", file);
                return;
            } catch (FileAlreadyExistsException taken) {
                // next suffix
            } catch (IOException e) {
                LOGGER.warn("Failed writing snippet {}", file, e);
                return;
            }
        }
        LOGGER.warn("No free snippet file name for '{}' in {}", base, dir);
    }

    static String baseName(String text) {
        StringBuilder sb = new StringBuilder();
        boolean dash = false;
        for (int i = 0; i < text.length() && sb.length() < MAX_NAME_CHARS; i++) {
            char ch = text.charAt(i);
            if (Character.isLetterOrDigit(ch)) {
                if (dash && sb.length() > 0) sb.append('-');
                sb.append(ch);
                dash = false;
            } else {
                dash = true;
            }
        }
        String name = sb.toString().toLowerCase(Locale.ROOT);
        return name.isEmpty() ? "snippet" : name;
    }
}
