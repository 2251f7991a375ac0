package io.xseries.cliptrail.domain.service;

import io.xseries.cliptrail.data.model.ClipEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class IngestionFilterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final IngestionFilter filter = new IngestionFilter(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Accepts new text and stamps it with the clock")
    void observe_NewText_Accepted() {
        Optional<ClipEntry> capture = filter.observe("hello");

        assertThat(capture).contains(new ClipEntry("hello", NOW));
        assertThat(filter.lastAccepted()).isEqualTo("hello");
    }

    @Test
    @DisplayName("Same text twice in a row yields one capture")
    void observe_Unchanged_RejectedSecondTime() {
        assertThat(filter.observe("same")).isPresent();
        assertThat(filter.observe("same")).isEmpty();
    }

    @Test
    @DisplayName("Empty, null and whitespace-only values are rejected")
    void observe_Blank_Rejected() {
        assertThat(filter.observe(null)).isEmpty();
        assertThat(filter.observe("")).isEmpty();
        assertThat(filter.observe("  \t\n ")).isEmpty();
        assertThat(filter.lastAccepted()).isNull();
    }

    @Test
    @DisplayName("Text made only of Unicode spaces is rejected")
    void observe_UnicodeSpaces_Rejected() {
        assertThat(filter.observe("\u2003\u3000")).isEmpty();
        assertThat(filter.observe("\u00A0 \u2009")).isEmpty();
        assertThat(filter.lastAccepted()).isNull();

        filter.prime("\u3000");
        assertThat(filter.lastAccepted()).isNull();
    }

    @Test
    @DisplayName("Unicode spaces around visible text do not make it blank")
    void observe_UnicodeSpacesAroundText_Accepted() {
        assertThat(filter.observe("\u00A0x\u3000")).map(ClipEntry::text).contains("\u00A0x\u3000");
    }

    @Test
    @DisplayName("Rejected blanks do not reset the last accepted value")
    void observe_BlankBetweenRepeats_StillRejectsRepeat() {
        filter.observe("a");
        filter.observe("   ");

        assertThat(filter.observe("a")).isEmpty();
    }

    @Test
    @DisplayName("Text with surrounding whitespace is kept verbatim")
    void observe_Padded_KeepsRawText() {
        assertThat(filter.observe("  x  ")).map(ClipEntry::text).contains("  x  ");
        assertThat(filter.observe("x")).isPresent();
    }

    @Test
    @DisplayName("Alternating values are all accepted")
    void observe_Alternating_Accepted() {
        assertThat(filter.observe("a")).isPresent();
        assertThat(filter.observe("b")).isPresent();
        assertThat(filter.observe("a")).isPresent();
    }

    @Test
    @DisplayName("Primed text is treated as already seen")
    void prime_ThenSameText_Rejected() {
        filter.prime("on clipboard at start");

        assertThat(filter.observe("on clipboard at start")).isEmpty();
        assertThat(filter.observe("next")).isPresent();
    }

    @Test
    @DisplayName("Priming with blank text changes nothing")
    void prime_Blank_Ignored() {
        filter.observe("a");
        filter.prime("   ");

        assertThat(filter.lastAccepted()).isEqualTo("a");
    }
}
