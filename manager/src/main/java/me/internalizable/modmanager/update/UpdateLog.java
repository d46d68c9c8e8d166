package me.internalizable.modmanager.update;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded in-memory audit trail of auto-update results.
 *
 * <p>Holds at most {@code capacity} entries; adding beyond that drops the
 * oldest.</p>
 */
public class UpdateLog {

    private final int capacity;
    private final LinkedList<UpdateLogEntry> entries = new LinkedList<>();

    /**
     * Create a log.
     *
     * @param capacity maximum number of entries kept
     */
    public UpdateLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append an entry.
     *
     * @param entry the entry
     */
    public synchronized void add(@Nonnull UpdateLogEntry entry) {
        entries.addLast(Objects.requireNonNull(entry, "entry"));
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * Get recent entries, newest first.
     *
     * @param limit maximum number of entries, or a non-positive value for all
     * @return list of entries
     */
    @Nonnull
    public synchronized List<UpdateLogEntry> getLogs(int limit) {
        int count = limit <= 0 ? entries.size() : Math.min(limit, entries.size());
        List<UpdateLogEntry> result = new ArrayList<>(count);
        Iterator<UpdateLogEntry> newestFirst = entries.descendingIterator();
        while (result.size() < count && newestFirst.hasNext()) {
            result.add(newestFirst.next());
        }
        return result;
    }

    /**
     * Drop all but the newest entries.
     *
     * @param retain number of entries to keep
     * @return number of entries dropped
     */
    public synchronized int trim(int retain) {
        int dropped = 0;
        while (entries.size() > Math.max(0, retain)) {
            entries.removeFirst();
            dropped++;
        }
        return dropped;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
