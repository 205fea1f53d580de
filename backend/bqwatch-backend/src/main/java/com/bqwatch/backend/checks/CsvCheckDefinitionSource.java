package com.bqwatch.backend.checks;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

/**
 * Reads checks from a CSV table. Row 1 is the header; data starts on row 2 with the columns
 * {@code title}, {@code sql} and an optional delimiter separated {@code recipients}.
 */
public class CsvCheckDefinitionSource implements CheckDefinitionSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvCheckDefinitionSource.class);
    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final int FIRST_DATA_ROW = 2;

    private final String location;
    private final Pattern recipientSplitter;
    private final CsvMapper csvMapper;

    public CsvCheckDefinitionSource(String location, String recipientDelimiter) {
        this.location = location;
        this.recipientSplitter = Pattern.compile(Pattern.quote(recipientDelimiter));
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    @Override
    public List<CheckDefinition> load() {
        Resource resource = resolve();
        if (!resource.exists()) {
            throw new CheckDefinitionException("Check definitions file " + location + " not found");
        }
        List<CheckDefinition> definitions = new ArrayList<>();
        try (InputStream inputStream = resource.getInputStream();
                MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(inputStream)) {
            int row = 0;
            while (rows.hasNext()) {
                String[] columns = rows.next();
                row++;
                if (row < FIRST_DATA_ROW) {
                    continue;
                }
                definitions.add(toDefinition(row, columns));
            }
        } catch (IOException | RuntimeException ex) {
            throw new CheckDefinitionException("Unable to read check definitions from " + location, ex);
        }
        LOGGER.debug("Loaded {} check rows from {}", definitions.size(), location);
        return definitions;
    }

    @Override
    public String describe() {
        return location;
    }

    private CheckDefinition toDefinition(int row, String[] columns) {
        String title = column(columns, 0);
        String sql = column(columns, 1);
        String recipients = column(columns, 2);
        return new CheckDefinition(row, title, sql, splitRecipients(recipients));
    }

    private List<String> splitRecipients(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(recipientSplitter.split(raw))
                .map(String::trim)
                .filter(address -> !address.isEmpty())
                .collect(Collectors.toList());
    }

    private String column(String[] columns, int index) {
        if (columns == null || index >= columns.length || columns[index] == null) {
            return "";
        }
        return columns[index].trim();
    }

    private Resource resolve() {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(location);
    }
}
