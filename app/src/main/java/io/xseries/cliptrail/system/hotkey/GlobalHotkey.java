/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.system.hotkey;

import com.sun.jna.platform.win32.Kernel32;
import com.sun.jna.platform.win32.User32;
import com.sun.jna.platform.win32.WinDef;
import com.sun.jna.platform.win32.WinUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * System-wide shortcut registered through User32 (Windows only).
 *
 * RegisterHotKey binds the shortcut to the registering thread, so registration,
 * the message loop and unregistration all run on one dedicated daemon thread.
 * {@link #close()} posts WM_QUIT to that thread.
 */
public final class GlobalHotkey implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalHotkey.class);

    private static final int HOTKEY_ID = 0x0C71;
    private static final int MOD_NOREPEAT = 0x4000;

    private final HotkeyBinding binding;
    private final Runnable onPressed;

    private final CountDownLatch started = new CountDownLatch(1);
    private volatile int loopThreadId;
    private volatile boolean registered;
    private Thread loop;

    public GlobalHotkey(HotkeyBinding binding, Runnable onPressed) {
        this.binding = Objects.requireNonNull(binding);
        this.onPressed = Objects.requireNonNull(onPressed);
    }

    public static boolean isSupported() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    public HotkeyBinding binding() {
        return binding;
    }

    /**
     * Registers the shortcut and waits briefly for the outcome.
     *
     * @return true if the shortcut is active
     */
    public synchronized boolean start() {
        if (loop != null) return registered;
        if (!isSupported()) return false;

        loop = new Thread(this::runLoop, "cliptrail-hotkey");
        loop.setDaemon(true);
        loop.start();

        try {
            started.await(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return registered;
    }

    private void runLoop() {
        User32 user32 = User32.INSTANCE;
        loopThreadId = Kernel32.INSTANCE.GetCurrentThreadId();

        registered = user32.RegisterHotKey(null, HOTKEY_ID, binding.modifiers() | MOD_NOREPEAT, binding.keyCode());
        started.countDown();
        if (!registered) {
            LOGGER.warn("Could not register hotkey {} (error {}), it may be taken by another program",
                    binding.label(), Kernel32.INSTANCE.GetLastError());
            return;
        }
        LOGGER.info("Hotkey {} opens the popup", binding.label());

        try {
            WinUser.MSG msg = new WinUser.MSG();
            // GetMessage returns 0 on WM_QUIT and -1 on error
            while (user32.GetMessage(msg, null, 0, 0) > 0) {
                if (msg.message == WinUser.WM_HOTKEY && msg.wParam.intValue() == HOTKEY_ID) {
                    try {
                        onPressed.run();
                    } catch (RuntimeException e) {
                        LOGGER.warn("Hotkey handler failed", e);
                    }
                }
            }
        } finally {
            user32.UnregisterHotKey(null, HOTKEY_ID);
            registered = false;
            LOGGER.debug("Hotkey {} released", binding.label());
        }
    }

    @Override
    public synchronized void close() {
        Thread t = loop;
        if (t == null) return;
        loop = null;

        if (t.isAlive() && loopThreadId != 0) {
            User32.INSTANCE.PostThreadMessage(loopThreadId, WinUser.WM_QUIT, new WinDef.WPARAM(0), new WinDef.LPARAM(0));
        }
        try {
            t.join(250);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
