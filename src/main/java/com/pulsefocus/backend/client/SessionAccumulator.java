package com.pulsefocus.backend.client;

import com.pulsefocus.backend.dto.FocusTelemetryRequest;

import java.time.Instant;
import java.util.Optional;

/**
 * Statistics of one focus run. Created when the run starts, advanced once per
 * evaluated window, and turned into telemetry when the run ends.
 *
 * @param referenceBaselineBpm baseline the last window was judged against
 *                             (session or learned), used when the run never
 *                             settled a session baseline
 */
public record SessionAccumulator(
        Instant startedAt,
        Double sessionBaselineBpm,
        Double referenceBaselineBpm,
        double peakRollingBpm,
        double rollingSum,
        int rollingCount,
        int alertWindows
) {

    public static SessionAccumulator start(Instant startedAt) {
        return new SessionAccumulator(startedAt, null, null, 0.0, 0.0, 0, 0);
    }

    public SessionAccumulator withSessionBaseline(double bpm) {
        return new SessionAccumulator(startedAt, bpm, referenceBaselineBpm, peakRollingBpm, rollingSum,
                rollingCount, alertWindows);
    }

    public SessionAccumulator withWindow(double rollingBpm, boolean elevated, Double referenceBaseline) {
        return new SessionAccumulator(
                startedAt,
                sessionBaselineBpm,
                referenceBaseline != null ? referenceBaseline : referenceBaselineBpm,
                Math.max(peakRollingBpm, rollingBpm),
                rollingSum + rollingBpm,
                rollingCount + 1,
                alertWindows + (elevated ? 1 : 0));
    }

    public double averageRollingBpm() {
        return rollingCount == 0 ? 0.0 : rollingSum / rollingCount;
    }

    /**
     * Telemetry for the finished run; empty when no window was evaluated.
     * Baseline preference: session, then reference, then the run's own mean.
     */
    public Optional<FocusTelemetryRequest> toTelemetry(Instant endedAt) {
        if (rollingCount == 0) {
            return Optional.empty();
        }
        double avg = round1(averageRollingBpm());
        Double baseline = sessionBaselineBpm != null ? sessionBaselineBpm
                : referenceBaselineBpm != null ? referenceBaselineBpm : avg;
        return Optional.of(new FocusTelemetryRequest(
                startedAt.toString(),
                endedAt.toString(),
                round1(baseline),
                round1(peakRollingBpm),
                avg,
                alertWindows));
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
