package com.bqwatch.backend.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one SQL check to completion: submit, poll with doubling backoff, then read every result page in
 * order. A job moves {@code SUBMITTED -> POLLING -> COMPLETED | FAILED} and is never resubmitted.
 */
public class QueryRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryRunner.class);

    private final QueryExecutionService executionService;
    private final QueryPollingProperties properties;
    private final BackoffWaiter waiter;

    public QueryRunner(
            QueryExecutionService executionService, QueryPollingProperties properties, BackoffWaiter waiter) {
        this.executionService = executionService;
        this.properties = properties;
        this.waiter = waiter;
    }

    public QueryResult execute(String sql) {
        JobResultsPage submitted = executionService.submit(sql);
        String jobId = submitted.jobId();
        LOGGER.debug("Query job {} is {}", jobId, JobState.SUBMITTED);
        try {
            JobResultsPage firstPage = awaitCompletion(jobId, submitted);
            QueryResult result = readAllPages(jobId, firstPage);
            LOGGER.debug("Query job {} is {} with {} rows", jobId, JobState.COMPLETED, result.rowCount());
            return result;
        } catch (QueryExecutionException ex) {
            LOGGER.debug("Query job {} is {}: {}", jobId, JobState.FAILED, ex.getMessage());
            throw ex;
        }
    }

    private JobResultsPage awaitCompletion(String jobId, JobResultsPage submitted) {
        Duration backoff = properties.getBaseBackoff();
        Duration maxWait = properties.getMaxWait();
        Duration waited = Duration.ZERO;
        JobResultsPage page = submitted;
        JobState state = JobState.SUBMITTED.next(page.complete());
        while (state == JobState.POLLING) {
            if (maxWait != null && waited.plus(backoff).compareTo(maxWait) > 0) {
                throw new QueryExecutionException(
                        jobId, "Query job " + jobId + " did not complete within " + maxWait);
            }
            LOGGER.trace("Query job {} is {}, waiting {} ms", jobId, state, backoff.toMillis());
            pause(jobId, backoff);
            waited = waited.plus(backoff);
            backoff = backoff.multipliedBy(2);
            page = executionService.getJobResults(jobId, null);
            state = state.next(page.complete());
        }
        return page;
    }

    private QueryResult readAllPages(String jobId, JobResultsPage firstPage) {
        List<List<String>> rows = new ArrayList<>(firstPage.rows());
        JobHandle handle = firstPage.handle();
        int pages = 1;
        while (handle.hasNextPage()) {
            JobResultsPage page = executionService.getJobResults(jobId, handle.pageToken());
            rows.addAll(page.rows());
            handle = page.handle();
            pages++;
        }
        if (rows.size() != firstPage.totalRows()) {
            LOGGER.warn(
                    "Query job {} reported {} rows but {} were read across {} pages",
                    jobId,
                    firstPage.totalRows(),
                    rows.size(),
                    pages);
        }
        return new QueryResult(firstPage.headers(), rows, firstPage.totalRows());
    }

    private void pause(String jobId, Duration interval) {
        try {
            waiter.await(interval);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException(jobId, "Interrupted while waiting for query job " + jobId, ex);
        }
    }
}
