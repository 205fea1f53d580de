package com.bqwatch.backend.report;

import com.bqwatch.backend.query.QueryResult;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders a query result as plain text: the header line, then one line per row. Cells are joined with a
 * comma and are not escaped, so a cell that contains a comma makes the line ambiguous to re-parse.
 */
public class ResultFormatter {

    static final String DELIMITER = ",";
    static final String LINE_SEPARATOR = "\n";

    public String format(QueryResult result) {
        StringJoiner lines = new StringJoiner(LINE_SEPARATOR);
        lines.add(joinCells(result.headers()));
        for (List<String> row : result.rows()) {
            lines.add(joinCells(row));
        }
        return lines.toString();
    }

    private String joinCells(List<String> cells) {
        StringJoiner line = new StringJoiner(DELIMITER);
        for (String cell : cells) {
            line.add(cell != null ? cell : "");
        }
        return line.toString();
    }
}
