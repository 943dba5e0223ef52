package io.fleetprov.retry;

import io.fleetprov.config.RunSettings;
import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.model.Job;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a failed job gets another attempt.
 *
 * <p>A job may run at most {@code maxRetries + 1} times. Delays grow linearly
 * with the attempt count in {@link DelayMode#LINEAR} mode and never exceed
 * {@code maxDelay}. The failure kind is ignored except for
 * {@link ExecutionErrorKind#INTERRUPTED}, which never retries, and any kinds the
 * operator listed as non-retryable.
 */
public final class RetryPolicy {
    private final int maxRetries;
    private final Duration baseDelay;
    private final DelayMode mode;
    private final Duration maxDelay;
    private final Set<ExecutionErrorKind> nonRetryable;

    public RetryPolicy(int maxRetries, Duration baseDelay, DelayMode mode, Duration maxDelay,
                       Set<ExecutionErrorKind> nonRetryable) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        this.mode = mode == null ? DelayMode.FIXED : mode;
        this.maxDelay = maxDelay == null || maxDelay.compareTo(this.baseDelay) < 0 ? this.baseDelay : maxDelay;
        this.nonRetryable = nonRetryable == null || nonRetryable.isEmpty()
                ? EnumSet.noneOf(ExecutionErrorKind.class)
                : EnumSet.copyOf(nonRetryable);
        this.nonRetryable.add(ExecutionErrorKind.INTERRUPTED);
    }

    public static RetryPolicy from(RunSettings settings) {
        return new RetryPolicy(
                settings.maxRetries(),
                settings.retryDelay(),
                settings.retryDelayMode(),
                settings.retryDelayMax(),
                settings.nonRetryableKinds()
        );
    }

    public static RetryPolicy fixed(int maxRetries, Duration delay) {
        return new RetryPolicy(maxRetries, delay, DelayMode.FIXED, delay, Set.of());
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public RetryDecision nextAction(Job job) {
        int attempts = job.attempts();
        if (attempts >= maxAttempts()) {
            return RetryDecision.giveUp();
        }
        ExecutionErrorKind kind = job.lastErrorKind();
        if (kind != null && nonRetryable.contains(kind)) {
            return RetryDecision.giveUp();
        }
        return RetryDecision.retryAfter(delayAfter(attempts));
    }

    Duration delayAfter(int attempts) {
        Duration delay = mode == DelayMode.LINEAR
                ? baseDelay.multipliedBy(Math.max(1, attempts))
                : baseDelay;
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
