/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.system.hotkey;

import java.util.Locale;
import java.util.Optional;

/**
 * A parsed shortcut such as {@code Ctrl+Shift+V}: Win32 modifier flags plus a virtual-key code.
 *
 * Accepted keys are A-Z, 0-9, F1-F12, Space and Insert, with at least one of
 * Ctrl, Alt, Shift or Win. Names are case-insensitive.
 *
 * @param modifiers MOD_* flags as passed to RegisterHotKey
 * @param keyCode   Win32 virtual-key code
 * @param label     canonical spelling, used in menus
 */
public record HotkeyBinding(int modifiers, int keyCode, String label) {

    public static final int MOD_ALT = 0x0001;
    public static final int MOD_CONTROL = 0x0002;
    public static final int MOD_SHIFT = 0x0004;
    public static final int MOD_WIN = 0x0008;

    private static final int VK_SPACE = 0x20;
    private static final int VK_INSERT = 0x2D;
    private static final int VK_F1 = 0x70;

    public static Optional<HotkeyBinding> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        int modifiers = 0;
        int keyCode = -1;
        String keyName = null;

        for (String part : text.split("\\+", -1)) {
            String token = part.trim().toUpperCase(Locale.ROOT);
            int flag = modifierFlag(token);
            if (flag != 0) {
                modifiers |= flag;
                continue;
            }
            if (keyCode != -1) return Optional.empty(); // two keys
            keyCode = virtualKey(token);
            if (keyCode == -1) return Optional.empty();
            keyName = token.length() == 1 ? token : token.charAt(0) + token.substring(1).toLowerCase(Locale.ROOT);
        }

        if (modifiers == 0 || keyCode == -1) return Optional.empty();
        return Optional.of(new HotkeyBinding(modifiers, keyCode, label(modifiers, keyName)));
    }

    private static int modifierFlag(String token) {
        switch (token) {
            case "CTRL":
            case "CONTROL":
                return MOD_CONTROL;
            case "ALT":
                return MOD_ALT;
            case "SHIFT":
                return MOD_SHIFT;
            case "WIN":
            case "META":
                return MOD_WIN;
            default:
                return 0;
        }
    }

    private static int virtualKey(String token) {
        if (token.length() == 1) {
            char c = token.charAt(0);
            // VK codes for letters and digits are their ASCII upper-case codes
            if ((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) return c;
            return -1;
        }
        if (token.equals("SPACE")) return VK_SPACE;
        if (token.equals("INSERT")) return VK_INSERT;
        if (token.matches("F([1-9]|1[0-2])")) return VK_F1 + Integer.parseInt(token.substring(1)) - 1;
        return -1;
    }

    private static String label(int modifiers, String keyName) {
        StringBuilder sb = new StringBuilder();
        if ((modifiers & MOD_CONTROL) != 0) sb.append("Ctrl+");
        if ((modifiers & MOD_ALT) != 0) sb.append("Alt+");
        if ((modifiers & MOD_SHIFT) != 0) sb.append("Shift+");
        if ((modifiers & MOD_WIN) != 0) sb.append("Win+");
        return sb.append(keyName).toString();
    }
}
