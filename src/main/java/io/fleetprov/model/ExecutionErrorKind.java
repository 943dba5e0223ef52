package io.fleetprov.model;

/**
 * Why a single attempt against a target failed.
 *
 * <p>The scheduler treats every kind as an attempt failure. Only
 * {@link #INTERRUPTED} is terminal on its own; the others are handed to the
 * retry policy.
 */
public enum ExecutionErrorKind {
    RELAY_UNREACHABLE,
    AUTH_REJECTED,
    CONNECTION_DROPPED,
    TIMEOUT,
    NON_ZERO_EXIT,
    LAUNCH_FAILED,
    INTERRUPTED;

    public static ExecutionErrorKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("error kind cannot be empty");
        }
        String normalized = raw.trim().replace('-', '_');
        for (ExecutionErrorKind value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown error kind: " + raw);
    }
}
