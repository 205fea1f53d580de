package com.bqwatch.backend.logging;

import java.util.List;

/**
 * Append-only record of executed checks. Entries are never rewritten or removed.
 */
public interface CheckLogStore {

    void append(LogEntry entry);

    /**
     * Zero-based index of the last entry, {@code -1} when the log is empty.
     */
    long lastIndex();

    /**
     * The last {@code count} entries, oldest first.
     */
    List<LogEntry> readRecent(int count);
}
