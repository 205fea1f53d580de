package com.bqwatch.backend.query;

import java.util.List;

public record QueryResult(List<String> headers, List<List<String>> rows, long totalRows) {

    public QueryResult {
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int rowCount() {
        return rows.size();
    }
}
