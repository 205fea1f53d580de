package com.bqwatch.backend.query;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bqwatch.polling")
public class QueryPollingProperties {

    private Duration baseBackoff = Duration.ofMillis(500);

    /**
     * Upper bound on the accumulated wait for a single job. Unset means poll until the job completes.
     */
    private Duration maxWait;

    public Duration getBaseBackoff() {
        return baseBackoff;
    }

    public void setBaseBackoff(Duration baseBackoff) {
        if (baseBackoff != null && !baseBackoff.isNegative() && !baseBackoff.isZero()) {
            this.baseBackoff = baseBackoff;
        }
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public void setMaxWait(Duration maxWait) {
        if (maxWait == null || maxWait.isNegative() || maxWait.isZero()) {
            this.maxWait = null;
            return;
        }
        this.maxWait = maxWait;
    }
}
