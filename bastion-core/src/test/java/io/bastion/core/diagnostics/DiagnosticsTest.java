package io.bastion.core.diagnostics;

import io.bastion.api.status.DiagnosticsSnapshot;
import io.bastion.api.status.Issue;
import io.bastion.api.status.Severity;
import io.bastion.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DiagnosticsTest {

    private MutableClock clock;
    private StubMonitor monitor;
    private Diagnostics diagnostics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        monitor = new StubMonitor();
        diagnostics = new Diagnostics(clock, monitor);
    }

    // --- recording ---

    @Test
    void shouldCountCurrentIssuesBySeverityAndCategory() {
        diagnostics.recordIssue("api", Severity.ERROR, "boom", Map.of());
        diagnostics.recordIssue("api", Severity.WARNING, "slow", Map.of());
        diagnostics.recordIssue("rate_limit", Severity.WARNING, "limited", Map.of());
        diagnostics.recordIssue("api", Severity.INFO, "fyi", Map.of());

        DiagnosticsSnapshot snapshot = diagnostics.getDiagnostics();

        assertThat(snapshot.currentIssues()).isEqualTo(3);
        assertThat(snapshot.totalIssues()).isEqualTo(4);
        assertThat(snapshot.bySeverity())
                .containsEntry(Severity.ERROR, 1)
                .containsEntry(Severity.WARNING, 2);
        assertThat(snapshot.byCategory())
                .containsEntry("api", 2)
                .containsEntry("rate_limit", 1);
    }

    @Test
    void shouldCaptureStackSnapshotAndContext() {
        diagnostics.recordIssue("api", Severity.ERROR, "boom", Map.of("endpoint", "orders"));

        Issue issue = diagnostics.recentIssues().get(0);

        assertThat(issue.timestamp()).isEqualTo(clock.instant());
        assertThat(issue.context()).containsEntry("endpoint", "orders");
        assertThat(issue.stackSnapshot()).isNotEmpty();
        assertThat(issue.stackSnapshot().get(0)).contains("DiagnosticsTest");
    }

    @Test
    void shouldCapIssueRing() {
        for (int i = 0; i < Diagnostics.ISSUE_HISTORY_LIMIT + 5; i++) {
            diagnostics.recordIssue("api", Severity.INFO, "issue " + i, Map.of());
        }

        List<Issue> recent = diagnostics.recentIssues();

        assertThat(recent).hasSize(Diagnostics.ISSUE_HISTORY_LIMIT);
        assertThat(recent.get(0).message()).isEqualTo("issue 5");
    }

    @Test
    void shouldKeepOnlyTrailingHourOfSlowRequests() {
        diagnostics.recordSlowRequest("orders", Duration.ofSeconds(2), Map.of());
        clock.advance(Duration.ofMinutes(61));
        diagnostics.recordSlowRequest("orders", Duration.ofSeconds(4), Map.of());

        DiagnosticsSnapshot.SlowEndpoint slow = diagnostics.getDiagnostics().slowEndpoints().get("orders");

        assertThat(slow.count()).isEqualTo(1);
        assertThat(slow.averageDurationSeconds()).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void shouldSummarizeConnectionIssuesPerHost() {
        diagnostics.recordConnectionIssue("https://api.example.com", new IOException("refused"), Map.of());
        diagnostics.recordConnectionIssue("https://api.example.com", new IOException("reset"), Map.of());

        DiagnosticsSnapshot.ConnectionIssues issues =
                diagnostics.getDiagnostics().connectionIssues().get("https://api.example.com");

        assertThat(issues.count()).isEqualTo(2);
        assertThat(issues.lastError()).isEqualTo("reset");
    }

    @Test
    void shouldReturnReadOnlySnapshot() {
        diagnostics.recordIssue("api", Severity.ERROR, "boom", Map.of());
        DiagnosticsSnapshot snapshot = diagnostics.getDiagnostics();

        assertThatThrownBy(() -> snapshot.byCategory().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);

        diagnostics.recordIssue("api", Severity.ERROR, "boom again", Map.of());
        assertThat(snapshot.currentIssues()).isEqualTo(1);
    }

    // --- self-check ---

    @Test
    void shouldFlagEndpointWithFiveSlowRequests() {
        for (int i = 1; i <= 5; i++) {
            diagnostics.recordSlowRequest("orders", Duration.ofSeconds(i), Map.of());
        }

        int findings = diagnostics.runSelfCheck();

        assertThat(findings).isEqualTo(1);
        Issue issue = lastIssue();
        assertThat(issue.category()).isEqualTo("performance");
        assertThat(issue.severity()).isEqualTo(Severity.WARNING);
        assertThat(issue.message()).isEqualTo("Slow endpoint detected: orders");
        assertThat((Double) issue.context().get("avg_duration")).isCloseTo(3.0, within(1e-9));
        assertThat(issue.context()).containsEntry("request_count", 5);
    }

    @Test
    void shouldNotFlagEndpointWithFewerSlowRequests() {
        for (int i = 0; i < 4; i++) {
            diagnostics.recordSlowRequest("orders", Duration.ofSeconds(2), Map.of());
        }

        assertThat(diagnostics.runSelfCheck()).isZero();
    }

    @Test
    void shouldWarnOnRecurringErrorPatternAndResetTally() {
        for (int i = 0; i < Diagnostics.ERROR_PATTERN_THRESHOLD; i++) {
            diagnostics.recordIssue("api", Severity.ERROR, "failed",
                    Map.of(Diagnostics.ERROR_TYPE, "ServerException"));
        }
        assertThat(diagnostics.getDiagnostics().errorPatterns()).containsEntry("ServerException", 10);

        int findings = diagnostics.runSelfCheck();

        assertThat(findings).isEqualTo(1);
        assertThat(lastIssue().message()).isEqualTo("Frequent error pattern detected: ServerException");
        assertThat(diagnostics.getDiagnostics().errorPatterns()).isEmpty();
    }

    @Test
    void shouldWarnOnHighResourceUsage() {
        monitor.values.put(SystemMonitor.CPU_PERCENT, 95.0);
        monitor.values.put(SystemMonitor.DISK_PERCENT, 81.0);

        int findings = diagnostics.runSelfCheck();

        assertThat(findings).isEqualTo(2);
        assertThat(diagnostics.recentIssues())
                .extracting(Issue::message)
                .containsExactly("High CPU usage: 95.0%", "High disk usage: 81.0%");
    }

    @Test
    void shouldSurviveMonitorFailure() {
        var broken = new Diagnostics(clock, new SystemMonitor() {
            @Override
            public Map<String, Double> sample() {
                throw new IllegalStateException("no management beans");
            }
        });

        assertThat(broken.runSelfCheck()).isZero();
    }

    @Test
    void shouldPurgeIssuesOlderThanOneDay() {
        diagnostics.recordIssue("api", Severity.ERROR, "old", Map.of());
        clock.advance(Duration.ofHours(25));
        diagnostics.recordIssue("api", Severity.ERROR, "new", Map.of());

        diagnostics.runSelfCheck();

        DiagnosticsSnapshot snapshot = diagnostics.getDiagnostics();
        assertThat(snapshot.currentIssues()).isEqualTo(1);
        assertThat(snapshot.totalIssues()).isEqualTo(2);
    }

    private Issue lastIssue() {
        List<Issue> recent = diagnostics.recentIssues();
        return recent.get(recent.size() - 1);
    }

    private static class StubMonitor extends SystemMonitor {

        final Map<String, Double> values = new HashMap<>(Map.of(
                CPU_PERCENT, 10.0,
                MEMORY_PERCENT, 20.0,
                DISK_PERCENT, 30.0,
                THREADS, 12.0,
                OPEN_FILES, 40.0));

        @Override
        public Map<String, Double> sample() {
            return Map.copyOf(values);
        }
    }
}
