package io.fleetprov.retry;

import java.time.Duration;

public record RetryDecision(boolean retry, Duration delay) {
    private static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay == null || delay.isNegative() ? Duration.ZERO : delay);
    }

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }
}
