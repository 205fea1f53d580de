package com.bqwatch.backend.checks;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * One configured check. {@code row} is the position in the source and identifies the check; checks run in
 * row order.
 */
public record CheckDefinition(int row, String title, String sql, List<String> recipients) {

    public CheckDefinition {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    /**
     * A blank title or query marks the end of the runnable checks.
     */
    @JsonIgnore
    public boolean isRunnable() {
        return title != null && !title.isBlank() && sql != null && !sql.isBlank();
    }
}
