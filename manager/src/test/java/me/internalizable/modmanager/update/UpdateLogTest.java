package me.internalizable.modmanager.update;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpdateLogTest {

    private static UpdateLogEntry entry(String slug) {
        return new UpdateLogEntry(Instant.EPOCH, slug, "1.0", "1.1", UpdateStatus.SUCCESS, "Updated");
    }

    @Test
    void returnsNewestFirst() {
        UpdateLog log = new UpdateLog(10);
        log.add(entry("a"));
        log.add(entry("b"));
        log.add(entry("c"));

        assertThat(log.getLogs(0)).extracting(UpdateLogEntry::slug).containsExactly("c", "b", "a");
        assertThat(log.getLogs(2)).extracting(UpdateLogEntry::slug).containsExactly("c", "b");
        assertThat(log.getLogs(50)).hasSize(3);
    }

    @Test
    void dropsOldestBeyondCapacity() {
        UpdateLog log = new UpdateLog(2);
        log.add(entry("a"));
        log.add(entry("b"));
        log.add(entry("c"));

        assertThat(log.size()).isEqualTo(2);
        assertThat(log.getLogs(0)).extracting(UpdateLogEntry::slug).containsExactly("c", "b");
    }

    @Test
    void trimKeepsNewestEntries() {
        UpdateLog log = new UpdateLog(10);
        for (String slug : new String[]{"a", "b", "c", "d"}) {
            log.add(entry(slug));
        }

        assertThat(log.trim(2)).isEqualTo(2);
        assertThat(log.getLogs(0)).extracting(UpdateLogEntry::slug).containsExactly("d", "c");
        assertThat(log.trim(5)).isZero();
    }

    @Test
    void clearEmptiesLog() {
        UpdateLog log = new UpdateLog(10);
        log.add(entry("a"));

        log.clear();

        assertThat(log.size()).isZero();
        assertThat(log.getLogs(10)).isEmpty();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new UpdateLog(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusIdsAreLowercase() {
        assertThat(UpdateStatus.SUCCESS.getId()).isEqualTo("success");
        assertThat(UpdateStatus.SKIPPED.getId()).isEqualTo("skipped");
        assertThat(UpdateStatus.FAILED.getId()).isEqualTo("failed");
    }
}
