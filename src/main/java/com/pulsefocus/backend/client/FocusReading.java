package com.pulsefocus.backend.client;

/**
 * Result of evaluating one poll.
 *
 * @param autoPause true exactly when the timer should be paused now
 */
public record FocusReading(
        FocusSignal signal,
        Double rollingAverageBpm,
        Double effectiveBaselineBpm,
        BaselineSource baselineSource,
        Double thresholdBpm,
        boolean above,
        boolean autoPause
) {

    public enum BaselineSource { SESSION, PROFILE, ROLLING, NONE }

    static FocusReading noData(FocusSignal signal) {
        return new FocusReading(signal, null, null, BaselineSource.NONE, null, false, false);
    }
}
