package io.xseries.cliptrail.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigServiceTest {

    @TempDir
    Path tmp;

    @Test
    @DisplayName("Missing file creates defaults on disk")
    void loadOrCreate_Missing_WritesDefaults() {
        Path path = tmp.resolve("cfg").resolve("config.json");

        Config cfg = new ConfigService(path).loadOrCreate();

        assertThat(path).exists();
        assertThat(cfg.historyLimit()).isEqualTo(100);
        assertThat(cfg.persistHistory()).isFalse();
        assertThat(cfg.fuzzyMatching()).isFalse();
        assertThat(cfg.captureEnabled()).isTrue();
        assertThat(cfg.storage()).isEqualTo(Config.STORAGE_JSON);
    }

    @Test
    @DisplayName("Persisted values survive a reload")
    void persist_ThenLoad_SameValues() {
        Path path = tmp.resolve("config.json");
        ConfigService service = new ConfigService(path);

        service.persist(Config.defaults()
                .withHistoryLimit(7)
                .withPersistHistory(true)
                .withFuzzyMatching(true)
                .withCaptureEnabled(false)
                .withStorage("SQLite"));

        Config loaded = new ConfigService(path).loadOrCreate();
        assertThat(loaded.historyLimit()).isEqualTo(7);
        assertThat(loaded.persistHistory()).isTrue();
        assertThat(loaded.fuzzyMatching()).isTrue();
        assertThat(loaded.captureEnabled()).isFalse();
        assertThat(loaded.storage()).isEqualTo(Config.STORAGE_SQLITE);
    }

    @Test
    @DisplayName("Absent and out-of-range fields are normalized")
    void loadOrCreate_PartialFile_Normalized() throws Exception {
        Path path = tmp.resolve("config.json");
        Files.writeString(path, """
                { "historyLimit": 0, "persistHistory": true, "pollIntervalMs": 5, "storage": "floppy" }
                """, StandardCharsets.UTF_8);

        Config cfg = new ConfigService(path).loadOrCreate();

        assertThat(cfg.historyLimit()).isEqualTo(Config.DEFAULT_HISTORY_LIMIT);
        assertThat(cfg.persistHistory()).isTrue();
        assertThat(cfg.captureEnabled()).isTrue();
        assertThat(cfg.pollIntervalMs()).isEqualTo(Config.MIN_POLL_INTERVAL_MS);
        assertThat(cfg.storage()).isEqualTo(Config.STORAGE_JSON);
    }

    @Test
    @DisplayName("Corrupt file is backed up and replaced with defaults")
    void loadOrCreate_Corrupt_BacksUp() throws Exception {
        Path path = tmp.resolve("config.json");
        Files.writeString(path, "{{{ nope", StandardCharsets.UTF_8);

        Config cfg = new ConfigService(path).loadOrCreate();

        assertThat(cfg.historyLimit()).isEqualTo(Config.DEFAULT_HISTORY_LIMIT);
        try (Stream<Path> files = Files.list(tmp)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .anyMatch(n -> n.startsWith("config.bad-") && n.endsWith(".json"))
                    .contains("config.json");
        }
    }

    @Test
    @DisplayName("History limit is clamped to the supported range")
    void withHistoryLimit_Clamped() {
        assertThat(Config.defaults().withHistoryLimit(Integer.MAX_VALUE).historyLimit())
                .isEqualTo(Config.MAX_HISTORY_LIMIT);
        assertThat(Config.defaults().withHistoryLimit(1).historyLimit()).isEqualTo(1);
    }

    @Test
    @DisplayName("Corrupt file is kept under a name stamped with the clock")
    void loadOrCreate_Corrupt_BackupNamedFromClock() throws Exception {
        Path path = tmp.resolve("config.json");
        Files.writeString(path, "null", StandardCharsets.UTF_8);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_234_567L), ZoneOffset.UTC);

        new ConfigService(path, clock).loadOrCreate();

        assertThat(tmp.resolve("config.bad-1234567.json")).hasContent("null");
        assertThat(path).exists();
    }

    @Test
    @DisplayName("Missing or blank hotkey falls back to the default shortcut")
    void loadOrCreate_Hotkey_Normalized() throws Exception {
        Path path = tmp.resolve("config.json");
        Files.writeString(path, "{ \"hotkey\": \"   \" }", StandardCharsets.UTF_8);
        assertThat(new ConfigService(path).loadOrCreate().hotkey()).isEqualTo(Config.DEFAULT_HOTKEY);

        Files.writeString(path, "{ \"hotkey\": \" Alt+F9 \" }", StandardCharsets.UTF_8);
        assertThat(new ConfigService(path).loadOrCreate().hotkey()).isEqualTo("Alt+F9");
    }
}
