package com.bqwatch.backend.checks;

import java.time.Instant;
import java.util.List;

public record CheckRunSummary(
        Instant startedAt,
        Instant finishedAt,
        int definitionsLoaded,
        boolean truncated,
        List<CheckOutcome> outcomes) {

    public CheckRunSummary {
        outcomes = List.copyOf(outcomes);
    }

    public int executedChecks() {
        return outcomes.size();
    }

    public long failedChecks() {
        return outcomes.stream().filter(outcome -> outcome.status() == CheckStatus.FAILED).count();
    }
}
