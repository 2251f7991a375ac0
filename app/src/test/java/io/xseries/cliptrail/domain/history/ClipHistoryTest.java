package io.xseries.cliptrail.domain.history;

import io.xseries.cliptrail.data.model.ClipEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ClipHistoryTest {

    private static ClipEntry entry(String text, long epochSecond) {
        return ClipEntry.ofEpochSecond(text, epochSecond);
    }

    private static List<String> texts(ClipHistory history) {
        return history.snapshot().stream().map(ClipEntry::text).toList();
    }

    @Test
    @DisplayName("Newest insert is at the front")
    void insert_Sequence_KeepsRecencyOrder() {
        ClipHistory history = new ClipHistory(10);

        history.insert(entry("a", 1));
        history.insert(entry("b", 2));
        history.insert(entry("c", 3));

        assertThat(texts(history)).containsExactly("c", "b", "a");
    }

    @Test
    @DisplayName("Duplicate text moves to the front with the later timestamp")
    void insert_Duplicate_MovesToFront() {
        ClipHistory history = new ClipHistory(10);

        history.insert(entry("t", 10));
        history.insert(entry("x", 11));
        history.insert(entry("t", 20));

        List<ClipEntry> snapshot = history.snapshot();
        assertThat(snapshot).hasSize(2);
        assertThat(snapshot.get(0)).isEqualTo(entry("t", 20));
        assertThat(snapshot.get(1).text()).isEqualTo("x");
    }

    @Test
    @DisplayName("Texts stay unique across any insert sequence")
    void insert_ManyWithRepeats_TextsUnique() {
        ClipHistory history = new ClipHistory(5);
        String[] seq = {"a", "b", "a", "c", "b", "d", "e", "a", "f", "g", "c"};

        long t = 0;
        for (String s : seq) {
            history.insert(entry(s, t++));
            List<String> texts = texts(history);
            assertThat(new HashSet<>(texts)).hasSize(texts.size());
            assertThat(texts.size()).isLessThanOrEqualTo(history.limit());
        }
        assertThat(texts(history)).containsExactly("c", "g", "f", "a", "e");
    }

    @Test
    @DisplayName("Exceeding the limit drops the oldest entry")
    void insert_OverLimit_DropsTail() {
        ClipHistory history = new ClipHistory(2);

        history.insert(entry("a", 1));
        history.insert(entry("b", 2));
        history.insert(entry("c", 3));

        assertThat(texts(history)).containsExactly("c", "b");
    }

    @Test
    @DisplayName("Lowering the limit truncates the tail immediately")
    void setLimit_Smaller_TruncatesTail() {
        ClipHistory history = new ClipHistory(10);
        history.insert(entry("C", 3));
        history.insert(entry("B", 4));
        history.insert(entry("A", 5));

        history.setLimit(2);

        assertThat(history.limit()).isEqualTo(2);
        assertThat(history.snapshot()).containsExactly(entry("A", 5), entry("B", 4));
    }

    @Test
    @DisplayName("Raising the limit keeps every entry")
    void setLimit_Larger_KeepsEntries() {
        ClipHistory history = new ClipHistory(2);
        history.insert(entry("a", 1));
        history.insert(entry("b", 2));

        history.setLimit(50);
        history.insert(entry("c", 3));

        assertThat(texts(history)).containsExactly("c", "b", "a");
    }

    @Test
    @DisplayName("Limits below one are rejected")
    void setLimit_Zero_Throws() {
        ClipHistory history = new ClipHistory(3);

        assertThatThrownBy(() -> history.setLimit(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ClipHistory(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(history.limit()).isEqualTo(3);
    }

    @Test
    @DisplayName("Remove deletes the matching entry and ignores unknown text")
    void remove_PresentAndAbsent() {
        ClipHistory history = new ClipHistory(10);
        history.insert(entry("a", 1));
        history.insert(entry("b", 2));

        assertThat(history.remove("a")).isTrue();
        assertThat(history.remove("zzz")).isFalse();
        assertThat(history.remove(null)).isFalse();
        assertThat(texts(history)).containsExactly("b");
    }

    @Test
    @DisplayName("Restore keeps order, drops repeated texts and applies the limit")
    void restore_LoadedEntries_DedupAndBound() {
        ClipHistory history = new ClipHistory(3);
        history.insert(entry("old", 1));

        history.restore(List.of(
                entry("x", 100), entry("y", 90), entry("x", 80), entry("z", 70), entry("w", 60)));

        assertThat(history.snapshot()).containsExactly(entry("x", 100), entry("y", 90), entry("z", 70));
    }

    @Test
    @DisplayName("Snapshot is a detached copy")
    void snapshot_LaterInsert_DoesNotChangeCopy() {
        ClipHistory history = new ClipHistory(10);
        history.insert(entry("a", 1));

        List<ClipEntry> before = history.snapshot();
        history.insert(entry("b", 2));

        assertThat(before).extracting(ClipEntry::text).containsExactly("a");
        assertThatThrownBy(() -> before.add(entry("c", 3))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Readers never observe a broken invariant while writers run")
    void concurrentWritersAndReaders_InvariantsHold() throws Exception {
        ClipHistory history = new ClipHistory(20);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int w = 0; w < 3; w++) {
                final int writer = w;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 2_000; i++) {
                        history.insert(entry("t" + (i % 37), i));
                        if (i % 50 == 0) history.setLimit(5 + (i + writer) % 20);
                        if (i % 7 == 0) history.remove("t" + (i % 11));
                    }
                    return null;
                }));
            }
            for (int r = 0; r < 3; r++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 2_000; i++) {
                        history.read(entries -> {
                            Set<String> seen = new HashSet<>();
                            for (ClipEntry e : entries) assertThat(seen.add(e.text())).isTrue();
                            assertThat(entries.size()).isLessThanOrEqualTo(history.limit());
                            return null;
                        });
                    }
                    return null;
                }));
            }

            go.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(history.size()).isLessThanOrEqualTo(history.limit());
    }
}
