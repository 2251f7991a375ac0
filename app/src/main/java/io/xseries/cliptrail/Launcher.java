/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail;

import javafx.application.Application;

/**
 * Classpath entry point; JavaFX refuses a main class that extends Application
 * unless it runs from the module path.
 */
public final class Launcher {

    private Launcher() {}

    public static void main(String[] args) {
        Application.launch(ClipTrailApp.class, args);
    }
}
