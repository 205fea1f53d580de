package com.bqwatch.backend.checks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "bqwatch", name = {"schedule.enabled", "bigquery.enabled"}, havingValue = "true")
public class CheckRunScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(CheckRunScheduler.class);

    private final CheckOrchestrator orchestrator;

    public CheckRunScheduler(CheckOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(cron = "${bqwatch.schedule.cron:0 0 7 * * *}", zone = "${bqwatch.schedule.zone:}")
    public void runDailyChecks() {
        LOGGER.info("Starting scheduled check run");
        try {
            orchestrator.runAll();
        } catch (CheckRunInProgressException ex) {
            LOGGER.warn("Skipping scheduled check run: {}", ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Scheduled check run aborted", ex);
        }
    }
}
