package io.xseries.cliptrail.system.tray;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TrayControllerTest {

    @Test
    @DisplayName("Menu labels are single-line with collapsed whitespace")
    void menuLabel_MultiLine_Collapsed() {
        assertThat(TrayController.menuLabel("  first line\n\tsecond   line  ")).isEqualTo("first line second line");
    }

    @Test
    @DisplayName("Long text is cut to the label width with an ellipsis")
    void menuLabel_Long_Truncated() {
        String label = TrayController.menuLabel("x".repeat(200));

        assertThat(label).hasSize(TrayController.LABEL_CHARS).endsWith("…");
    }

    @Test
    @DisplayName("Short text is kept as is")
    void menuLabel_Short_Unchanged() {
        String exact = "y".repeat(TrayController.LABEL_CHARS);

        assertThat(TrayController.menuLabel("short")).isEqualTo("short");
        assertThat(TrayController.menuLabel(exact)).isEqualTo(exact);
    }
}
