package com.bqwatch.backend.query;

/**
 * Remote warehouse that runs SQL as asynchronous jobs.
 */
public interface QueryExecutionService {

    /**
     * Submits {@code sql} as a standard SQL query job. The returned page is incomplete unless the job
     * already finished, in which case it carries the first page of results.
     */
    JobResultsPage submit(String sql);

    /**
     * Refreshes a job. Returns a pending page while the job runs, otherwise the page addressed by
     * {@code pageToken} ({@code null} for the first page).
     */
    JobResultsPage getJobResults(String jobId, String pageToken);
}
