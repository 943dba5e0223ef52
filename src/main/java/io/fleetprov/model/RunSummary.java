package io.fleetprov.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate result of one orchestration run. {@code failedTargets} holds target
 * names exactly as they appear in the inventory so a follow-up run can select them.
 */
public record RunSummary(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        long durationMs,
        int total,
        int succeeded,
        int failed,
        int totalAttempts,
        int retriedTargets,
        int peakRunning,
        boolean interrupted,
        int aggregationErrors,
        Map<ExecutionErrorKind, Integer> failuresByKind,
        List<TargetOutcome> outcomes,
        List<String> failedTargets
) {
    public RunSummary {
        failuresByKind = failuresByKind == null ? Map.of() : Map.copyOf(failuresByKind);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        failedTargets = failedTargets == null ? List.of() : List.copyOf(failedTargets);
    }

    public boolean allSucceeded() {
        return total == succeeded && failed == 0;
    }
}
