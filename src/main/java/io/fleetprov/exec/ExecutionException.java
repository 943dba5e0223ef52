package io.fleetprov.exec;

import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.model.ExecutionResult;

/**
 * One attempt failed. {@link #partialResult()} carries whatever output was
 * captured before the failure, or {@code null} when the command never started.
 */
public final class ExecutionException extends Exception {
    private final ExecutionErrorKind kind;
    private final transient ExecutionResult partialResult;

    public ExecutionException(ExecutionErrorKind kind, String message, ExecutionResult partialResult) {
        this(kind, message, partialResult, null);
    }

    public ExecutionException(ExecutionErrorKind kind, String message, ExecutionResult partialResult, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.partialResult = partialResult;
    }

    public ExecutionErrorKind kind() {
        return kind;
    }

    public ExecutionResult partialResult() {
        return partialResult;
    }
}
