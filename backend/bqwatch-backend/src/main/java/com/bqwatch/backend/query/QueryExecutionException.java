package com.bqwatch.backend.query;

public class QueryExecutionException extends RuntimeException {

    private final String jobId;

    public QueryExecutionException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public QueryExecutionException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    /**
     * Identifier of the failed job, or {@code null} when the submission itself was rejected.
     */
    public String getJobId() {
        return jobId;
    }
}
