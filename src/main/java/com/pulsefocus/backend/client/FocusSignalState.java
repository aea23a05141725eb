package com.pulsefocus.backend.client;

import java.time.Instant;

/**
 * Engine state between polls.
 *
 * @param session             statistics of the active run, {@code null} when idle
 * @param nextAlertEligibleAt earliest time another auto-pause may fire; survives run resets
 * @param lastWindowTimestamp latest sample timestamp already counted as a window
 */
public record FocusSignalState(
        FocusSignal signal,
        int consecutiveHighWindows,
        SessionAccumulator session,
        Instant nextAlertEligibleAt,
        String lastWindowTimestamp
) {

    public static FocusSignalState initial() {
        return new FocusSignalState(FocusSignal.STEADY, 0, null, null, null);
    }

    /** Fresh run state; only the alert cooldown carries over. */
    FocusSignalState startRun(Instant startedAt) {
        return new FocusSignalState(FocusSignal.STEADY, 0, SessionAccumulator.start(startedAt), nextAlertEligibleAt, null);
    }

    FocusSignalState idle(FocusSignal signal) {
        return new FocusSignalState(signal, 0, null, nextAlertEligibleAt, null);
    }
}
