package io.xseries.cliptrail.config;

import io.xseries.cliptrail.data.model.ClipEntry;
import io.xseries.cliptrail.domain.history.ClipHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class SettingsServiceTest {

    @TempDir
    Path tmp;

    private ConfigService configService;
    private ClipHistory history;
    private SettingsService settings;

    @BeforeEach
    void setUp() {
        configService = new ConfigService(tmp.resolve("config.json"));
        Config cfg = configService.loadOrCreate();
        history = new ClipHistory(cfg.historyLimit());
        settings = new SettingsService(configService, history, cfg);
    }

    @Test
    @DisplayName("Shrinking the limit truncates and persists")
    void setHistoryLimit_Smaller_TruncatesAndPersists() {
        history.insert(ClipEntry.ofEpochSecond("C", 3));
        history.insert(ClipEntry.ofEpochSecond("B", 4));
        history.insert(ClipEntry.ofEpochSecond("A", 5));

        assertThat(settings.setHistoryLimit(2)).isTrue();

        assertThat(history.snapshot()).extracting(ClipEntry::text).containsExactly("A", "B");
        assertThat(settings.historyLimit()).isEqualTo(2);
        assertThat(configService.loadOrCreate().historyLimit()).isEqualTo(2);
    }

    @Test
    @DisplayName("A zero limit is rejected and nothing changes")
    void setHistoryLimit_Zero_Rejected() {
        history.insert(ClipEntry.ofEpochSecond("A", 1));

        assertThat(settings.setHistoryLimit(0)).isFalse();

        assertThat(history.limit()).isEqualTo(Config.DEFAULT_HISTORY_LIMIT);
        assertThat(history.size()).isEqualTo(1);
        assertThat(configService.loadOrCreate().historyLimit()).isEqualTo(Config.DEFAULT_HISTORY_LIMIT);
    }

    @Test
    @DisplayName("Boolean settings are written to config.json")
    void toggles_Persisted() {
        settings.setPersistHistory(true);
        settings.setFuzzyMatching(true);
        settings.setCaptureEnabled(false);

        assertThat(settings.persistHistory()).isTrue();
        assertThat(settings.fuzzyMatching()).isTrue();
        assertThat(settings.captureEnabled()).isFalse();

        Config reloaded = configService.loadOrCreate();
        assertThat(reloaded.persistHistory()).isTrue();
        assertThat(reloaded.fuzzyMatching()).isTrue();
        assertThat(reloaded.captureEnabled()).isFalse();
    }
}
