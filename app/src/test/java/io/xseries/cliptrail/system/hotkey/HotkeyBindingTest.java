package io.xseries.cliptrail.system.hotkey;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class HotkeyBindingTest {

    @Test
    @DisplayName("Default shortcut parses to Ctrl|Shift and VK_V")
    void parse_Default() {
        HotkeyBinding b = HotkeyBinding.parse("Ctrl+Shift+V").orElseThrow();

        assertThat(b.modifiers()).isEqualTo(HotkeyBinding.MOD_CONTROL | HotkeyBinding.MOD_SHIFT);
        assertThat(b.keyCode()).isEqualTo(0x56);
        assertThat(b.label()).isEqualTo("Ctrl+Shift+V");
    }

    @Test
    @DisplayName("Names are case-insensitive, spacing is ignored and the label is canonical")
    void parse_LooseSpelling_Canonicalized() {
        HotkeyBinding b = HotkeyBinding.parse(" shift + control + f12 ").orElseThrow();

        assertThat(b.modifiers()).isEqualTo(HotkeyBinding.MOD_CONTROL | HotkeyBinding.MOD_SHIFT);
        assertThat(b.keyCode()).isEqualTo(0x7B);
        assertThat(b.label()).isEqualTo("Ctrl+Shift+F12");
    }

    @Test
    @DisplayName("Digits, Space and Insert are valid keys")
    void parse_OtherKeys() {
        assertThat(HotkeyBinding.parse("Alt+1").map(HotkeyBinding::keyCode)).contains((int) '1');
        assertThat(HotkeyBinding.parse("Win+Space").map(HotkeyBinding::label)).contains("Win+Space");
        assertThat(HotkeyBinding.parse("Ctrl+Insert").map(HotkeyBinding::keyCode)).contains(0x2D);
    }

    @Test
    @DisplayName("Shortcuts without a modifier, without a key or with unknown parts are rejected")
    void parse_Invalid_Empty() {
        assertThat(HotkeyBinding.parse(null)).isEqualTo(Optional.empty());
        assertThat(HotkeyBinding.parse("  ")).isEmpty();
        assertThat(HotkeyBinding.parse("V")).isEmpty();
        assertThat(HotkeyBinding.parse("Ctrl+Shift")).isEmpty();
        assertThat(HotkeyBinding.parse("Ctrl+V+B")).isEmpty();
        assertThat(HotkeyBinding.parse("Ctrl+Banana")).isEmpty();
        assertThat(HotkeyBinding.parse("Ctrl++V")).isEmpty();
        assertThat(HotkeyBinding.parse("Ctrl+F13")).isEmpty();
    }
}
