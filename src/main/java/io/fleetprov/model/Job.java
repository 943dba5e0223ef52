package io.fleetprov.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Mutable execution record for one target during a run.
 *
 * <p>All state changes go through the transition methods below, which are
 * synchronized and refuse moves the state machine does not allow. That is what
 * keeps a single attempt in flight per target and makes the terminal transition
 * happen exactly once even when an operator abort races a worker.
 */
public final class Job {
    private final Target target;
    private final int index;
    private final Path logFile;

    private JobStatus status = JobStatus.PENDING;
    private int attempts;
    private Instant firstStartedAt;
    private Instant attemptStartedAt;
    private Instant attemptEndedAt;
    private Integer lastExitStatus;
    private ExecutionErrorKind lastErrorKind;
    private String lastError;
    private String lastErrorPreview;

    public Job(Target target, int index, Path logFile) {
        this.target = target;
        this.index = index;
        this.logFile = logFile;
    }

    public Target target() {
        return target;
    }

    public String name() {
        return target.name();
    }

    public int index() {
        return index;
    }

    public Path logFile() {
        return logFile;
    }

    public synchronized JobStatus status() {
        return status;
    }

    public synchronized int attempts() {
        return attempts;
    }

    public synchronized Integer lastExitStatus() {
        return lastExitStatus;
    }

    public synchronized ExecutionErrorKind lastErrorKind() {
        return lastErrorKind;
    }

    public synchronized String lastError() {
        return lastError;
    }

    public synchronized String lastErrorPreview() {
        return lastErrorPreview;
    }

    public synchronized Instant attemptStartedAt() {
        return attemptStartedAt;
    }

    public synchronized Instant attemptEndedAt() {
        return attemptEndedAt;
    }

    /**
     * Time since the first attempt started, zero if the job never ran.
     */
    public synchronized Duration elapsed(Instant now) {
        if (firstStartedAt == null) {
            return Duration.ZERO;
        }
        Instant end = status.isTerminal() && attemptEndedAt != null ? attemptEndedAt : now;
        return Duration.between(firstStartedAt, end);
    }

    /**
     * PENDING or AWAITING_RETRY to RUNNING. Increments the attempt counter.
     *
     * @return false if the job is already running or terminal
     */
    public synchronized boolean beginAttempt(Instant now) {
        if (status != JobStatus.PENDING && status != JobStatus.AWAITING_RETRY) {
            return false;
        }
        status = JobStatus.RUNNING;
        attempts++;
        attemptStartedAt = now;
        attemptEndedAt = null;
        if (firstStartedAt == null) {
            firstStartedAt = now;
        }
        return true;
    }

    /**
     * Stores the outcome of the running attempt without changing state, so the
     * retry policy can look at it before the next transition is chosen.
     */
    public synchronized void recordFailure(ExecutionErrorKind kind, String error, ExecutionResult partial, Instant now) {
        lastErrorKind = kind;
        lastError = error;
        attemptEndedAt = now;
        if (partial != null) {
            lastExitStatus = partial.exitStatus();
            String preview = partial.errorPreview();
            lastErrorPreview = preview.isBlank() ? null : preview;
        }
    }

    public synchronized boolean markSucceeded(ExecutionResult result, Instant now) {
        if (status != JobStatus.RUNNING) {
            return false;
        }
        status = JobStatus.SUCCEEDED;
        attemptEndedAt = now;
        lastExitStatus = result.exitStatus();
        return true;
    }

    public synchronized boolean markAwaitingRetry() {
        if (status != JobStatus.RUNNING) {
            return false;
        }
        status = JobStatus.AWAITING_RETRY;
        return true;
    }

    /**
     * RUNNING to FAILED after the retry policy gave up.
     */
    public synchronized boolean markFailed() {
        if (status != JobStatus.RUNNING) {
            return false;
        }
        status = JobStatus.FAILED;
        return true;
    }

    /**
     * Terminates a job that is not currently running because the run was aborted.
     * A pending job keeps an attempt count of zero.
     *
     * @return false if the job is running (its worker reports the interruption) or already terminal
     */
    public synchronized boolean markInterrupted(String reason, Instant now) {
        if (status != JobStatus.PENDING && status != JobStatus.AWAITING_RETRY) {
            return false;
        }
        status = JobStatus.FAILED;
        lastErrorKind = ExecutionErrorKind.INTERRUPTED;
        lastError = reason;
        if (firstStartedAt != null) {
            attemptEndedAt = now;
        }
        return true;
    }

    @Override
    public synchronized String toString() {
        return "Job[" + target.name() + ", " + status + ", attempts=" + attempts + "]";
    }
}
