package com.bqwatch.backend.logging;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the check log as a text file with one {@code timestamp<TAB>message} line per entry.
 */
public class FileCheckLogStore implements CheckLogStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileCheckLogStore.class);
    private static final char SEPARATOR = '\t';

    private final Path logFilePath;

    public FileCheckLogStore(String logFilePath) {
        this.logFilePath = Paths.get(logFilePath).toAbsolutePath();
    }

    public Path getLogFilePath() {
        return logFilePath;
    }

    @Override
    public synchronized void append(LogEntry entry) {
        String line = entry.timestamp().toString() + SEPARATOR + sanitize(entry.message()) + System.lineSeparator();
        try {
            Path parent = logFilePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    logFilePath,
                    line,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (IOException ex) {
            throw new CheckLogException("Failed to append to check log " + logFilePath, ex);
        }
    }

    @Override
    public synchronized long lastIndex() {
        return readLines().size() - 1L;
    }

    @Override
    public synchronized List<LogEntry> readRecent(int count) {
        List<String> lines = readLines();
        int start = Math.max(lines.size() - count, 0);
        List<LogEntry> entries = new ArrayList<>();
        for (String line : lines.subList(start, lines.size())) {
            entries.add(parse(line));
        }
        return entries;
    }

    private List<String> readLines() {
        if (!Files.exists(logFilePath)) {
            return List.of();
        }
        try {
            return Files.readAllLines(logFilePath, StandardCharsets.UTF_8).stream()
                    .filter(line -> !line.isBlank())
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new CheckLogException("Failed to read check log " + logFilePath, ex);
        }
    }

    private LogEntry parse(String line) {
        int separator = line.indexOf(SEPARATOR);
        if (separator < 0) {
            return new LogEntry(null, line);
        }
        try {
            return new LogEntry(Instant.parse(line.substring(0, separator)), line.substring(separator + 1));
        } catch (DateTimeParseException ex) {
            LOGGER.debug("Unparseable timestamp in check log line '{}'", line, ex);
            return new LogEntry(null, line);
        }
    }

    private String sanitize(String message) {
        if (message == null) {
            return "";
        }
        return message.replace('\t', ' ').replace('\r', ' ').replace('\n', ' ');
    }
}
