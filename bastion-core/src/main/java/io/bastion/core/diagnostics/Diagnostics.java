package io.bastion.core.diagnostics;

import io.bastion.api.status.DiagnosticsSnapshot;
import io.bastion.api.status.DiagnosticsSnapshot.ConnectionIssues;
import io.bastion.api.status.DiagnosticsSnapshot.SlowEndpoint;
import io.bastion.api.status.Issue;
import io.bastion.api.status.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Ledger of issues, slow requests and connection problems, with a periodic self-check
 * that turns resource pressure, recurring errors and slow endpoints into issues of
 * their own.
 * <p>
 * All state is guarded by one lock; readers take it too. {@link #getDiagnostics()}
 * returns copies only.
 */
public class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    static final int ISSUE_HISTORY_LIMIT = 1000;
    static final int ERROR_PATTERN_THRESHOLD = 10;
    static final int SLOW_ENDPOINT_THRESHOLD = 5;
    static final double RESOURCE_THRESHOLD_PERCENT = 80.0;
    static final Duration EVENT_RETENTION = Duration.ofHours(1);
    static final Duration ISSUE_RETENTION = Duration.ofHours(24);
    private static final int STACK_SNAPSHOT_DEPTH = 20;

    public static final String ERROR_TYPE = "error_type";

    private final Clock clock;
    private final SystemMonitor systemMonitor;

    private final Object lock = new Object();
    private final Deque<Issue> issueHistory = new ArrayDeque<>();
    private final List<Issue> errors = new ArrayList<>();
    private final List<Issue> warnings = new ArrayList<>();
    private final Map<String, Integer> errorPatterns = new HashMap<>();
    private final Map<String, List<SlowRequest>> slowRequests = new HashMap<>();
    private final Map<String, List<ConnectionEvent>> connectionEvents = new HashMap<>();

    public Diagnostics(Clock clock, SystemMonitor systemMonitor) {
        this.clock = clock;
        this.systemMonitor = systemMonitor;
    }

    /**
     * Record an issue. A context entry under {@value #ERROR_TYPE} is tallied as an error pattern.
     */
    public void recordIssue(String category, Severity severity, String message, Map<String, Object> context) {
        Issue issue = new Issue(clock.instant(), category, severity, message, context, stackSnapshot());
        synchronized (lock) {
            issueHistory.addLast(issue);
            while (issueHistory.size() > ISSUE_HISTORY_LIMIT) {
                issueHistory.pollFirst();
            }
            if (severity == Severity.ERROR) {
                errors.add(issue);
            } else if (severity == Severity.WARNING) {
                warnings.add(issue);
            }
            Object errorType = issue.context().get(ERROR_TYPE);
            if (errorType != null) {
                errorPatterns.merge(errorType.toString(), 1, Integer::sum);
            }
        }
        log.debug("Recorded {} issue in '{}': {}", severity, category, message);
    }

    public void recordSlowRequest(String endpoint, Duration duration, Map<String, Object> context) {
        Instant now = clock.instant();
        synchronized (lock) {
            List<SlowRequest> requests = slowRequests.computeIfAbsent(endpoint, k -> new ArrayList<>());
            requests.add(new SlowRequest(now, duration.toNanos() / 1_000_000_000.0, context));
            requests.removeIf(r -> r.timestamp().isBefore(now.minus(EVENT_RETENTION)));
        }
    }

    public void recordConnectionIssue(String host, Throwable error, Map<String, Object> context) {
        Instant now = clock.instant();
        synchronized (lock) {
            List<ConnectionEvent> events = connectionEvents.computeIfAbsent(host, k -> new ArrayList<>());
            events.add(new ConnectionEvent(now, String.valueOf(error.getMessage()),
                    error.getClass().getSimpleName(), context));
            events.removeIf(e -> e.timestamp().isBefore(now.minus(EVENT_RETENTION)));
        }
    }

    /**
     * Run one pass of the self-check: resource usage, error patterns, slow endpoints,
     * then cleanup of data older than the retention bounds.
     *
     * @return number of findings recorded as issues
     */
    public int runSelfCheck() {
        List<Finding> findings = new ArrayList<>();
        checkSystemHealth(findings);

        synchronized (lock) {
            errorPatterns.forEach((type, count) -> {
                if (count >= ERROR_PATTERN_THRESHOLD) {
                    findings.add(new Finding("errors", "Frequent error pattern detected: " + type,
                            Map.of(ERROR_TYPE, type, "count", count)));
                }
            });
            slowRequests.forEach((endpoint, requests) -> {
                if (requests.size() >= SLOW_ENDPOINT_THRESHOLD) {
                    findings.add(new Finding("performance", "Slow endpoint detected: " + endpoint,
                            Map.of("endpoint", endpoint,
                                    "avg_duration", averageDuration(requests),
                                    "request_count", requests.size())));
                }
            });
        }

        for (Finding finding : findings) {
            recordIssue(finding.category(), Severity.WARNING, finding.message(), finding.context());
        }
        cleanup();

        if (!findings.isEmpty()) {
            log.warn("Diagnostics self-check raised {} warnings", findings.size());
        }
        return findings.size();
    }

    public DiagnosticsSnapshot getDiagnostics() {
        synchronized (lock) {
            List<Issue> current = new ArrayList<>(errors);
            current.addAll(warnings);

            Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
            bySeverity.put(Severity.ERROR, errors.size());
            bySeverity.put(Severity.WARNING, warnings.size());

            Map<String, Integer> byCategory = new TreeMap<>();
            current.forEach(i -> byCategory.merge(i.category(), 1, Integer::sum));

            Map<String, SlowEndpoint> slow = new TreeMap<>();
            slowRequests.forEach((endpoint, requests) -> {
                if (!requests.isEmpty()) {
                    slow.put(endpoint, new SlowEndpoint(requests.size(), averageDuration(requests)));
                }
            });

            Map<String, ConnectionIssues> connections = new TreeMap<>();
            connectionEvents.forEach((host, events) -> {
                if (!events.isEmpty()) {
                    connections.put(host, new ConnectionIssues(events.size(), events.get(events.size() - 1).error()));
                }
            });

            return new DiagnosticsSnapshot(
                    current.size(),
                    issueHistory.size(),
                    Collections.unmodifiableMap(bySeverity),
                    Collections.unmodifiableMap(byCategory),
                    Collections.unmodifiableMap(slow),
                    Collections.unmodifiableMap(connections),
                    Map.copyOf(errorPatterns));
        }
    }

    /**
     * @return the most recent issues, oldest first
     */
    public List<Issue> recentIssues() {
        synchronized (lock) {
            return List.copyOf(issueHistory);
        }
    }

    private void checkSystemHealth(List<Finding> findings) {
        Map<String, Double> sample;
        try {
            sample = systemMonitor.sample();
        } catch (RuntimeException e) {
            log.error("Failed to sample system resources", e);
            return;
        }
        addResourceFinding(findings, sample, SystemMonitor.CPU_PERCENT, "CPU");
        addResourceFinding(findings, sample, SystemMonitor.MEMORY_PERCENT, "memory");
        addResourceFinding(findings, sample, SystemMonitor.DISK_PERCENT, "disk");
    }

    private static void addResourceFinding(List<Finding> findings, Map<String, Double> sample, String key, String label) {
        Double value = sample.get(key);
        if (value != null && value > RESOURCE_THRESHOLD_PERCENT) {
            findings.add(new Finding("system",
                    String.format(Locale.ROOT, "High %s usage: %.1f%%", label, value),
                    Map.of(key, value)));
        }
    }

    private void cleanup() {
        Instant now = clock.instant();
        Instant issueCutoff = now.minus(ISSUE_RETENTION);
        Instant eventCutoff = now.minus(EVENT_RETENTION);
        synchronized (lock) {
            errors.removeIf(i -> i.timestamp().isBefore(issueCutoff));
            warnings.removeIf(i -> i.timestamp().isBefore(issueCutoff));
            errorPatterns.clear();

            slowRequests.values().forEach(list -> list.removeIf(r -> r.timestamp().isBefore(eventCutoff)));
            slowRequests.values().removeIf(List::isEmpty);
            connectionEvents.values().forEach(list -> list.removeIf(e -> e.timestamp().isBefore(eventCutoff)));
            connectionEvents.values().removeIf(List::isEmpty);
        }
    }

    private static double averageDuration(List<SlowRequest> requests) {
        return requests.stream().mapToDouble(SlowRequest::durationSeconds).average().orElse(0.0);
    }

    private static List<String> stackSnapshot() {
        StackTraceElement[] frames = Thread.currentThread().getStackTrace();
        List<String> snapshot = new ArrayList<>();
        // skip getStackTrace, stackSnapshot and recordIssue
        for (int i = 3; i < frames.length && snapshot.size() < STACK_SNAPSHOT_DEPTH; i++) {
            snapshot.add(frames[i].toString());
        }
        return snapshot;
    }

    private record SlowRequest(Instant timestamp, double durationSeconds, Map<String, Object> context) {}

    private record ConnectionEvent(Instant timestamp, String error, String errorType, Map<String, Object> context) {}

    private record Finding(String category, String message, Map<String, Object> context) {}
}
