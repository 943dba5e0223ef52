package io.fleetprov.model;

/**
 * Final state of one target in a run summary.
 */
public record TargetOutcome(
        String name,
        JobStatus status,
        int attempts,
        long durationMs,
        ExecutionErrorKind lastErrorKind,
        String lastError,
        String errorPreview,
        String logFile
) {
    public boolean failed() {
        return status == JobStatus.FAILED;
    }
}
