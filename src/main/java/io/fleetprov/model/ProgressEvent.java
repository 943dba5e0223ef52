package io.fleetprov.model;

import java.time.Instant;

/**
 * One state transition of one job, as reported to the run reporter.
 *
 * @param index       1-based position of the target in the inventory, used for console alignment
 * @param attempt     attempt number the transition belongs to, 0 for a job that never ran
 * @param elapsedMs   time since the job's first attempt started
 */
public record ProgressEvent(
        String target,
        int index,
        JobStatus status,
        int attempt,
        int maxAttempts,
        long elapsedMs,
        ExecutionErrorKind errorKind,
        String error,
        String errorPreview,
        Instant at
) {
    public static ProgressEvent of(Job job, int maxAttempts, Instant now) {
        JobStatus status = job.status();
        boolean failure = status == JobStatus.FAILED || status == JobStatus.AWAITING_RETRY;
        return new ProgressEvent(
                job.name(),
                job.index(),
                status,
                job.attempts(),
                maxAttempts,
                job.elapsed(now).toMillis(),
                failure ? job.lastErrorKind() : null,
                failure ? job.lastError() : null,
                failure ? job.lastErrorPreview() : null,
                now
        );
    }

    public boolean terminal() {
        return status.isTerminal();
    }
}
