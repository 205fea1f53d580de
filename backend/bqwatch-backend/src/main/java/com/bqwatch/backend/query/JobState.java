package com.bqwatch.backend.query;

/**
 * Lifecycle of one query job: {@code SUBMITTED -> POLLING -> COMPLETED | FAILED}. A job leaves
 * {@code POLLING} only once the service reports it complete or an error ends it.
 */
public enum JobState {
    SUBMITTED,
    POLLING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * State after the service answered for a job in this state.
     */
    public JobState next(boolean complete) {
        if (isTerminal()) {
            throw new IllegalStateException("Query job is already " + this);
        }
        return complete ? COMPLETED : POLLING;
    }
}
