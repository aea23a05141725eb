package com.pulsefocus.backend.client;

import java.time.Duration;

/**
 * Polling cadence as a value: faster during a focus run, doubled after each
 * consecutive failure up to {@code ceiling}, back to base on success.
 */
public record PollSchedule(Duration activeInterval, Duration idleInterval, Duration ceiling, int failures) {

    private static final int MAX_DOUBLINGS = 16;

    public static PollSchedule defaults() {
        return new PollSchedule(Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofMinutes(5), 0);
    }

    public Duration nextDelay(boolean focusRunActive) {
        Duration base = focusRunActive ? activeInterval : idleInterval;
        if (failures == 0) {
            return base;
        }
        Duration backedOff = base.multipliedBy(1L << Math.min(failures, MAX_DOUBLINGS));
        return backedOff.compareTo(ceiling) > 0 ? ceiling : backedOff;
    }

    public PollSchedule onSuccess() {
        return failures == 0 ? this : new PollSchedule(activeInterval, idleInterval, ceiling, 0);
    }

    public PollSchedule onFailure() {
        return new PollSchedule(activeInterval, idleInterval, ceiling, Math.min(failures + 1, MAX_DOUBLINGS));
    }
}
