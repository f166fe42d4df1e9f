package io.bastion.api.status;

import java.util.Map;

/**
 * Read-only summary of the diagnostics ledger.
 *
 * @param currentIssues   warnings and errors retained in the trailing 24 hours
 * @param totalIssues     entries in the recent-issue ring
 * @param bySeverity      current issues per severity
 * @param byCategory      current issues per category
 * @param slowEndpoints   slow-request summary per endpoint
 * @param connectionIssues connection-issue summary per host
 * @param errorPatterns   occurrences per error type since the last self-check
 */
public record DiagnosticsSnapshot(
        int currentIssues,
        int totalIssues,
        Map<Severity, Integer> bySeverity,
        Map<String, Integer> byCategory,
        Map<String, SlowEndpoint> slowEndpoints,
        Map<String, ConnectionIssues> connectionIssues,
        Map<String, Integer> errorPatterns
) {

    public record SlowEndpoint(int count, double averageDurationSeconds) {}

    public record ConnectionIssues(int count, String lastError) {}
}
