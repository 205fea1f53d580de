package com.bqwatch.backend.query;

import java.util.List;

/**
 * One response of the query execution service: either a pending job, or one page of a completed job's
 * result set. {@code pageToken} is present while more pages remain.
 */
public record JobResultsPage(
        String jobId,
        boolean complete,
        List<String> headers,
        List<List<String>> rows,
        long totalRows,
        String pageToken) {

    public JobResultsPage {
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static JobResultsPage pending(String jobId) {
        return new JobResultsPage(jobId, false, List.of(), List.of(), 0L, null);
    }

    public JobHandle handle() {
        return new JobHandle(jobId, complete, pageToken);
    }
}
