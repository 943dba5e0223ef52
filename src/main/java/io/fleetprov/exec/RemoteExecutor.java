package io.fleetprov.exec;

import io.fleetprov.model.ExecutionResult;
import io.fleetprov.model.Target;
import io.fleetprov.report.TargetLog;

import java.time.Duration;

/**
 * Runs the provisioning command on one target, blocking the calling worker.
 *
 * <p>Implementations append output to {@code log} while it streams, so an attempt
 * that is killed or times out still leaves evidence behind. A worker interrupt
 * must end the attempt with {@link io.fleetprov.model.ExecutionErrorKind#INTERRUPTED}.
 */
public interface RemoteExecutor {
    ExecutionResult run(Target target, CommandTemplate template, Duration timeout, TargetLog log)
            throws ExecutionException;
}
