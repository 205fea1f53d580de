package com.bqwatch.backend.checks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.bqwatch.backend.logging.CheckLogProperties;
import com.bqwatch.backend.logging.CheckLogStore;
import com.bqwatch.backend.logging.CheckLogger;
import com.bqwatch.backend.logging.LogEntry;
import com.bqwatch.backend.notification.NotificationException;
import com.bqwatch.backend.notification.NotificationGateway;
import com.bqwatch.backend.notification.NotificationProperties;
import com.bqwatch.backend.notification.NotificationStatus;
import com.bqwatch.backend.notification.Notifier;
import com.bqwatch.backend.notification.OutboundMessage;
import com.bqwatch.backend.query.JobResultsPage;
import com.bqwatch.backend.query.QueryExecutionException;
import com.bqwatch.backend.query.QueryExecutionService;
import com.bqwatch.backend.query.QueryPollingProperties;
import com.bqwatch.backend.query.QueryRunner;
import com.bqwatch.backend.report.ResultFormatter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class CheckOrchestratorTest {

    private static final String SQL_A = "SELECT table_id FROM freshness WHERE lag_hours > 24";
    private static final String SQL_B = "SELECT event_id, COUNT(*) AS copies FROM events GROUP BY 1 HAVING copies > 1";
    private static final String SQL_C = "SELECT day FROM calendar LEFT JOIN partitions USING (day) WHERE rows IS NULL";
    private static final Instant NOW = Instant.parse("2024-11-03T07:00:00Z");

    private final CheckDefinitionSource source = mock(CheckDefinitionSource.class);
    private final QueryExecutionService executionService = mock(QueryExecutionService.class);
    private final NotificationGateway gateway = mock(NotificationGateway.class);
    private final InMemoryCheckLogStore logStore = new InMemoryCheckLogStore();
    private final CheckDefinitionProperties properties = new CheckDefinitionProperties();
    private final List<Duration> waits = new ArrayList<>();
    private CheckOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        QueryRunner queryRunner = new QueryRunner(executionService, new QueryPollingProperties(), waits::add);
        Notifier notifier = new Notifier(gateway, new NotificationProperties(), "classpath:checks/sample-checks.csv");
        CheckLogger checkLogger = new CheckLogger(logStore, new CheckLogProperties(), clock);
        orchestrator = new CheckOrchestrator(
                source, queryRunner, new ResultFormatter(), notifier, checkLogger, properties, clock);
        given(source.describe()).willReturn("classpath:checks/sample-checks.csv");
        given(gateway.remainingDailyQuota()).willReturn(100);
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void shouldOnlyLogWhenCheckReturnsNoRows() {
        given(source.load()).willReturn(List.of(new CheckDefinition(2, "Staleness", SQL_A, List.of("a@example.com"))));
        given(executionService.submit(SQL_A)).willReturn(completePage("job-a", List.of(), null));

        CheckRunSummary summary = orchestrator.runAll();

        assertThat(logStore.messages()).containsExactly("Staleness No rows returned.");
        assertThat(logStore.entries.get(0).timestamp()).isEqualTo(NOW);
        assertThat(summary.outcomes()).extracting(CheckOutcome::status).containsExactly(CheckStatus.EMPTY);
        assertThat(waits).isEmpty();
        verify(gateway, never()).send(any());
    }

    @Test
    void shouldNotifyAndLogWhenCheckReturnsRows() {
        given(source.load()).willReturn(List.of(new CheckDefinition(3, "Dup check", SQL_B, List.of("oncall@example.com"))));
        given(executionService.submit(SQL_B)).willReturn(JobResultsPage.pending("job-b"));
        given(executionService.getJobResults("job-b", null))
                .willReturn(
                        JobResultsPage.pending("job-b"),
                        completePage("job-b", List.of(List.of("evt-1"), List.of("evt-7"), List.of("evt-9")), null));

        CheckRunSummary summary = orchestrator.runAll();

        assertThat(waits).containsExactly(Duration.ofMillis(500), Duration.ofMillis(1000));
        ArgumentCaptor<OutboundMessage> captor = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(gateway).send(captor.capture());
        assertThat(captor.getValue().subject()).isEqualTo("[Alert] Dup check");
        assertThat(captor.getValue().to()).containsExactly("oncall@example.com");
        assertThat(captor.getValue().body()).startsWith("event_id\nevt-1\nevt-7\nevt-9\n\n");
        assertThat(logStore.messages()).containsExactly("Dup check 3 rows returned.");
        CheckOutcome outcome = summary.outcomes().get(0);
        assertThat(outcome.status()).isEqualTo(CheckStatus.ALERTED);
        assertThat(outcome.rowCount()).isEqualTo(3);
        assertThat(outcome.notification().status()).isEqualTo(NotificationStatus.SENT);
    }

    @Test
    void shouldStopAtFirstBlankTitle() {
        given(source.load()).willReturn(List.of(
                new CheckDefinition(2, "Staleness", SQL_A, List.of()),
                new CheckDefinition(3, "", SQL_B, List.of()),
                new CheckDefinition(4, "Missing partitions", SQL_C, List.of())));
        given(executionService.submit(SQL_A)).willReturn(completePage("job-a", List.of(), null));

        CheckRunSummary summary = orchestrator.runAll();

        assertThat(logStore.messages()).hasSize(1);
        assertThat(summary.truncated()).isTrue();
        assertThat(summary.definitionsLoaded()).isEqualTo(3);
        assertThat(summary.executedChecks()).isEqualTo(1);
        verify(executionService, never()).submit(SQL_B);
        verify(executionService, never()).submit(SQL_C);
    }

    @Test
    void shouldStopAtFirstBlankQuery() {
        given(source.load()).willReturn(List.of(
                new CheckDefinition(2, "Staleness", " ", List.of()),
                new CheckDefinition(3, "Dup check", SQL_B, List.of())));

        CheckRunSummary summary = orchestrator.runAll();

        assertThat(summary.executedChecks()).isZero();
        assertThat(logStore.messages()).isEmpty();
        verify(executionService, never()).submit(anyString());
    }

    @Test
    void shouldLogRowCountWhenQuotaIsExhausted() {
        given(gateway.remainingDailyQuota()).willReturn(0);
        given(source.load()).willReturn(List.of(new CheckDefinition(3, "Dup check", SQL_B, List.of("oncall@example.com"))));
        given(executionService.submit(SQL_B))
                .willReturn(completePage("job-b", List.of(List.of("evt-1"), List.of("evt-2")), null));

        CheckRunSummary summary = orchestrator.runAll();

        verify(gateway, never()).send(any());
        assertThat(logStore.messages()).containsExactly("Dup check 2 rows returned.");
        assertThat(summary.outcomes().get(0).notification().status())
                .isEqualTo(NotificationStatus.SKIPPED_QUOTA_EXHAUSTED);
    }

    @Test
    void shouldContinueAfterFailedCheckWhenIsolated() {
        given(source.load()).willReturn(List.of(
                new CheckDefinition(2, "Staleness", SQL_A, List.of()),
                new CheckDefinition(3, "Dup check", SQL_B, List.of())));
        given(executionService.submit(SQL_A)).willThrow(new QueryExecutionException("job-a", "Access Denied"));
        given(executionService.submit(SQL_B)).willReturn(completePage("job-b", List.of(), null));

        CheckRunSummary summary = orchestrator.runAll();

        assertThat(logStore.messages())
                .containsExactly("Staleness Query failed: Access Denied", "Dup check No rows returned.");
        assertThat(summary.failedChecks()).isEqualTo(1L);
        assertThat(summary.outcomes().get(0).error()).isEqualTo("Access Denied");
    }

    @Test
    void shouldLogAndRethrowFailureWhenNotIsolated() {
        properties.setIsolateFailures(false);
        given(source.load()).willReturn(List.of(
                new CheckDefinition(2, "Staleness", SQL_A, List.of()),
                new CheckDefinition(3, "Dup check", SQL_B, List.of())));
        given(executionService.submit(SQL_A)).willThrow(new QueryExecutionException("job-a", "Access Denied"));

        assertThatThrownBy(() -> orchestrator.runAll()).isInstanceOf(QueryExecutionException.class);

        assertThat(logStore.messages()).containsExactly("Staleness Query failed: Access Denied");
        verify(executionService, never()).submit(SQL_B);
    }

    @Test
    void shouldRecordFailedNotificationAndStillLog() {
        given(source.load()).willReturn(List.of(new CheckDefinition(3, "Dup check", SQL_B, List.of("oncall@example.com"))));
        given(executionService.submit(SQL_B)).willReturn(completePage("job-b", List.of(List.of("evt-1")), null));
        willThrow(new NotificationException("Failed to send '[Alert] Dup check'")).given(gateway).send(any());

        CheckRunSummary summary = orchestrator.runAll();

        assertThat(logStore.messages()).containsExactly("Dup check 1 rows returned.");
        assertThat(summary.outcomes().get(0).notification().status()).isEqualTo(NotificationStatus.FAILED);
    }

    @Test
    void shouldWriteOneLogEntryPerExecutedCheck() {
        given(source.load()).willReturn(List.of(
                new CheckDefinition(2, "Staleness", SQL_A, List.of()),
                new CheckDefinition(3, "Dup check", SQL_B, List.of("oncall@example.com")),
                new CheckDefinition(4, "Missing partitions", SQL_C, List.of())));
        given(executionService.submit(SQL_A)).willReturn(completePage("job-a", List.of(), null));
        given(executionService.submit(SQL_B)).willReturn(completePage("job-b", List.of(List.of("evt-1")), null));
        given(executionService.submit(SQL_C)).willThrow(new QueryExecutionException(null, "Failed to submit"));

        CheckRunSummary summary = orchestrator.runAll();

        assertThat(logStore.messages()).hasSize(summary.executedChecks()).hasSize(3);
    }

    @Test
    void shouldConcatenatePagesBeforeFormatting() {
        given(source.load()).willReturn(List.of(new CheckDefinition(3, "Dup check", SQL_B, List.of("oncall@example.com"))));
        given(executionService.submit(SQL_B))
                .willReturn(new JobResultsPage("job-b", true, List.of("event_id"), List.of(List.of("evt-1")), 2L, "p2"));
        given(executionService.getJobResults("job-b", "p2"))
                .willReturn(new JobResultsPage("job-b", true, List.of("event_id"), List.of(List.of("evt-2")), 2L, null));

        orchestrator.runAll();

        assertThat(logStore.messages()).containsExactly("Dup check 2 rows returned.");
    }

    @Test
    void shouldRejectOverlappingRuns() {
        AtomicReference<Throwable> concurrentFailure = new AtomicReference<>();
        given(source.load()).willAnswer(invocation -> {
            Thread other = new Thread(() -> {
                try {
                    orchestrator.runAll();
                } catch (RuntimeException ex) {
                    concurrentFailure.set(ex);
                }
            });
            other.start();
            other.join();
            return List.of();
        });

        orchestrator.runAll();

        assertThat(concurrentFailure.get()).isInstanceOf(CheckRunInProgressException.class);
    }

    @Test
    void shouldStopRunWhenPollingIsInterrupted() {
        QueryRunner interruptedRunner = new QueryRunner(executionService, new QueryPollingProperties(), interval -> {
            throw new InterruptedException("shutdown");
        });
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CheckOrchestrator cancellable = new CheckOrchestrator(
                source,
                interruptedRunner,
                new ResultFormatter(),
                new Notifier(gateway, new NotificationProperties(), "classpath:checks/sample-checks.csv"),
                new CheckLogger(logStore, new CheckLogProperties(), clock),
                properties,
                clock);
        given(source.load()).willReturn(List.of(
                new CheckDefinition(2, "Staleness", SQL_A, List.of()),
                new CheckDefinition(3, "Dup check", SQL_B, List.of())));
        given(executionService.submit(SQL_A)).willReturn(JobResultsPage.pending("job-a"));

        assertThatThrownBy(cancellable::runAll)
                .isInstanceOf(QueryExecutionException.class)
                .hasCauseInstanceOf(InterruptedException.class);

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(logStore.messages())
                .containsExactly("Staleness Query failed: Interrupted while waiting for query job job-a");
        verify(executionService, never()).submit(SQL_B);
    }

    @Test
    void shouldNotStartChecksOnceThreadIsInterrupted() {
        given(source.load()).willReturn(List.of(new CheckDefinition(2, "Staleness", SQL_A, List.of())));
        Thread.currentThread().interrupt();

        CheckRunSummary summary = orchestrator.runAll();

        assertThat(summary.executedChecks()).isZero();
        verify(executionService, never()).submit(anyString());
    }

    private static JobResultsPage completePage(String jobId, List<List<String>> rows, String pageToken) {
        return new JobResultsPage(jobId, true, List.of("event_id"), rows, rows.size(), pageToken);
    }

    private static final class InMemoryCheckLogStore implements CheckLogStore {

        private final List<LogEntry> entries = new ArrayList<>();

        @Override
        public void append(LogEntry entry) {
            entries.add(entry);
        }

        @Override
        public long lastIndex() {
            return entries.size() - 1L;
        }

        @Override
        public List<LogEntry> readRecent(int count) {
            return entries.subList(Math.max(entries.size() - count, 0), entries.size());
        }

        List<String> messages() {
            return entries.stream().map(LogEntry::message).collect(Collectors.toList());
        }
    }
}
