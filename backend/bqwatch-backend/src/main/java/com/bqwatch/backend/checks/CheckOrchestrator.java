package com.bqwatch.backend.checks;

import com.bqwatch.backend.logging.CheckLogger;
import com.bqwatch.backend.notification.NotificationException;
import com.bqwatch.backend.notification.NotificationOutcome;
import com.bqwatch.backend.notification.Notifier;
import com.bqwatch.backend.query.QueryExecutionException;
import com.bqwatch.backend.query.QueryResult;
import com.bqwatch.backend.query.QueryRunner;
import com.bqwatch.backend.report.ResultFormatter;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the configured checks one after the other in source order. The first row with a blank title or
 * query ends the run; rows after it are never executed. Every executed check writes exactly one check log
 * entry, whatever its outcome. Interrupting the running thread ends the run after the current check is
 * logged.
 */
public class CheckOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CheckOrchestrator.class);

    private final CheckDefinitionSource source;
    private final QueryRunner queryRunner;
    private final ResultFormatter formatter;
    private final Notifier notifier;
    private final CheckLogger checkLogger;
    private final CheckDefinitionProperties properties;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    public CheckOrchestrator(
            CheckDefinitionSource source,
            QueryRunner queryRunner,
            ResultFormatter formatter,
            Notifier notifier,
            CheckLogger checkLogger,
            CheckDefinitionProperties properties,
            Clock clock) {
        this.source = source;
        this.queryRunner = queryRunner;
        this.formatter = formatter;
        this.notifier = notifier;
        this.checkLogger = checkLogger;
        this.properties = properties;
        this.clock = clock;
    }

    public CheckRunSummary runAll() {
        if (!runLock.tryLock()) {
            throw new CheckRunInProgressException("A check run is already in progress");
        }
        try {
            Instant startedAt = clock.instant();
            List<CheckDefinition> definitions = source.load();
            List<CheckOutcome> outcomes = new ArrayList<>();
            boolean truncated = false;
            for (CheckDefinition definition : definitions) {
                if (Thread.currentThread().isInterrupted()) {
                    LOGGER.warn("Check run interrupted before row {}, remaining checks skipped", definition.row());
                    break;
                }
                if (!definition.isRunnable()) {
                    LOGGER.info(
                            "Row {} of {} has a blank title or query, ignoring it and the rows after it",
                            definition.row(),
                            source.describe());
                    truncated = true;
                    break;
                }
                outcomes.add(runCheck(definition));
            }
            CheckRunSummary summary =
                    new CheckRunSummary(startedAt, clock.instant(), definitions.size(), truncated, outcomes);
            LOGGER.info(
                    "Check run finished: {} executed, {} failed, truncated={}",
                    summary.executedChecks(),
                    summary.failedChecks(),
                    truncated);
            return summary;
        } finally {
            runLock.unlock();
        }
    }

    public List<CheckDefinition> definitions() {
        return source.load();
    }

    private CheckOutcome runCheck(CheckDefinition definition) {
        LOGGER.debug("Running check '{}' (row {})", definition.title(), definition.row());
        QueryResult result;
        try {
            result = queryRunner.execute(definition.sql());
        } catch (QueryExecutionException ex) {
            String message = definition.title() + " Query failed: " + ex.getMessage();
            // interruptible file channels refuse writes while the flag is set
            boolean interrupted = Thread.interrupted();
            try {
                checkLogger.log(message);
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
            if (interrupted) {
                LOGGER.warn("Check run interrupted during '{}', remaining checks skipped", definition.title());
                throw ex;
            }
            if (!properties.isIsolateFailures()) {
                throw ex;
            }
            LOGGER.error("Check '{}' failed (job {})", definition.title(), ex.getJobId(), ex);
            return CheckOutcome.failed(definition, message, ex.getMessage());
        }

        if (result.isEmpty()) {
            String message = definition.title() + " No rows returned.";
            checkLogger.log(message);
            return CheckOutcome.empty(definition, message);
        }

        String message = definition.title() + " " + result.rowCount() + " rows returned.";
        NotificationOutcome notification;
        try {
            notification = notifier.notify(definition.title(), formatter.format(result), definition.recipients());
        } catch (NotificationException ex) {
            checkLogger.log(message);
            if (!properties.isIsolateFailures()) {
                throw ex;
            }
            LOGGER.error("Alert for check '{}' could not be sent", definition.title(), ex);
            return CheckOutcome.alerted(
                    definition,
                    result.rowCount(),
                    NotificationOutcome.failed(),
                    message);
        }
        checkLogger.log(message);
        return CheckOutcome.alerted(definition, result.rowCount(), notification, message);
    }
}
