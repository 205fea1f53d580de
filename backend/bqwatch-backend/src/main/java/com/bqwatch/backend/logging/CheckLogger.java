package com.bqwatch.backend.logging;

import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one entry per executed check. Store failures are reported through the application log and
 * never reach the caller.
 */
public class CheckLogger {

    private static final Logger LOGGER = LoggerFactory.getLogger(CheckLogger.class);

    private final CheckLogStore store;
    private final CheckLogProperties properties;
    private final Clock clock;

    public CheckLogger(CheckLogStore store, CheckLogProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    public void log(String message) {
        LogEntry entry = new LogEntry(clock.instant(), message);
        try {
            store.append(entry);
            LOGGER.info("{}", message);
        } catch (RuntimeException ex) {
            LOGGER.warn("Unable to record check log entry '{}'", message, ex);
        }
    }

    public long lastIndex() {
        return store.lastIndex();
    }

    public List<LogEntry> recent(Integer requestedLines) {
        return store.readRecent(normalizeLines(requestedLines));
    }

    private int normalizeLines(Integer requestedLines) {
        if (requestedLines == null) {
            return properties.getDefaultLines();
        }
        if (requestedLines <= 0) {
            throw new IllegalArgumentException("lines parameter must be greater than zero");
        }
        return Math.min(requestedLines, properties.getMaxLines());
    }
}
