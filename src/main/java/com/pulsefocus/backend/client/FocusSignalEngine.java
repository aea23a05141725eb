package com.pulsefocus.backend.client;

import com.pulsefocus.backend.client.FocusReading.BaselineSource;
import com.pulsefocus.backend.dto.FocusTelemetryRequest;
import com.pulsefocus.backend.dto.HeartRateSample;
import com.pulsefocus.backend.dto.ProfileSnapshot;
import com.pulsefocus.backend.service.BiofeedbackAggregator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hysteresis on the 5-minute rolling heart rate.
 *
 * <p>During a focus run the first window above threshold moves the signal to
 * {@link FocusSignal#SLOW_DOWN}; a second consecutive one moves it to
 * {@link FocusSignal#TAKE_BREAK} and requests an auto-pause, at most once per
 * {@link #ALERT_COOLDOWN}. A window back under threshold returns to
 * {@link FocusSignal#STEADY}. A window is counted only when the latest sample
 * is newer than the one the previous window saw. Outside a run the signal just
 * reflects whether the rolling average is above threshold.
 *
 * <p>Transitions are computed by the pure {@link #step}; this class only holds
 * the current state and publishes each transition with a compare-and-set, so
 * {@link #startRun} and {@link #endRun} from another thread are never lost.
 */
@Slf4j
public class FocusSignalEngine {

    static final Duration SESSION_BASELINE_WINDOW = Duration.ofMinutes(5);
    static final int SESSION_BASELINE_MIN_SAMPLES = 3;
    static final Duration ALERT_COOLDOWN = Duration.ofMinutes(10);
    static final double MIN_MARGIN_BPM = 6.0;
    static final double DEFAULT_DRIFT_BPM = 6.0;
    static final double DRIFT_MARGIN_BPM = 2.0;

    private final AtomicReference<FocusSignalState> state = new AtomicReference<>(FocusSignalState.initial());

    public record Step(FocusSignalState state, FocusReading reading) {}

    public FocusSignalState state() {
        return state.get();
    }

    /** Reset session statistics for a new focus run. */
    public void startRun(Instant startedAt) {
        state.updateAndGet(s -> s.startRun(startedAt));
    }

    public FocusReading evaluate(List<HeartRateSample> samples, ProfileSnapshot profile,
                                 boolean runActive, Instant runStartedAt, Instant now) {
        boolean active = runActive;
        while (true) {
            FocusSignalState observed = state.get();
            FocusSignalState base = observed;
            if (active && needsNewRun(base, runStartedAt)) {
                base = base.startRun(runStartedAt != null ? runStartedAt : now);
            }
            Step next = step(base, samples, profile, active, runStartedAt, now);
            if (state.compareAndSet(observed, next.state())) {
                if (next.reading().autoPause()) {
                    log.info("Heart rate elevated for {} windows; requesting auto-pause",
                            next.state().consecutiveHighWindows());
                }
                return next.reading();
            }
            // a run that ended while this step was computed must not be revived
            if (active && observed.session() != null && state.get().session() == null) {
                active = false;
            }
        }
    }

    /**
     * End the active run: returns its telemetry (if any window was counted)
     * and clears session state. Safe to call when no run is active.
     */
    public Optional<FocusTelemetryRequest> endRun(Instant endedAt) {
        FocusSignalState ended = state.getAndUpdate(s -> s.idle(FocusSignal.STEADY));
        if (ended.session() == null) {
            return Optional.empty();
        }
        return ended.session().toTelemetry(endedAt);
    }

    public static Step step(FocusSignalState s, List<HeartRateSample> samples, ProfileSnapshot profile,
                            boolean runActive, Instant runStartedAt, Instant now) {
        OptionalDouble rollingOpt = BiofeedbackAggregator.rollingAverage(samples);
        if (rollingOpt.isEmpty()) {
            if (!runActive) {
                return new Step(s.idle(FocusSignal.STEADY), FocusReading.noData(FocusSignal.STEADY));
            }
            return new Step(s, FocusReading.noData(s.signal()));
        }
        double rolling = rollingOpt.getAsDouble();

        SessionAccumulator session = s.session();
        if (runActive && session == null) {
            session = SessionAccumulator.start(runStartedAt != null ? runStartedAt : now);
        }
        if (runActive && session.sessionBaselineBpm() == null) {
            OptionalDouble sb = sessionBaseline(samples, session.startedAt());
            if (sb.isPresent()) {
                session = session.withSessionBaseline(sb.getAsDouble());
            }
        }

        Double sessionBaseline = runActive ? session.sessionBaselineBpm() : null;
        Double profileBaseline = profile != null ? profile.baselineMedianBpm() : null;
        BaselineSource source;
        double baseline;
        if (sessionBaseline != null) {
            source = BaselineSource.SESSION;
            baseline = sessionBaseline;
        } else if (profileBaseline != null) {
            source = BaselineSource.PROFILE;
            baseline = profileBaseline;
        } else {
            source = BaselineSource.ROLLING;
            baseline = rolling;
        }
        double threshold = threshold(baseline, profile != null ? profile.typicalDriftBpm() : null);
        boolean above = source != BaselineSource.ROLLING && rolling > threshold;

        if (!runActive) {
            FocusSignal signal = above ? FocusSignal.SLOW_DOWN : FocusSignal.STEADY;
            return new Step(s.idle(signal), new FocusReading(signal, rolling, baseline, source, threshold, above, false));
        }

        String latestTs = samples.get(samples.size() - 1).timestamp();
        if (latestTs.equals(s.lastWindowTimestamp())) {
            FocusSignalState held = new FocusSignalState(s.signal(), s.consecutiveHighWindows(), session,
                    s.nextAlertEligibleAt(), s.lastWindowTimestamp());
            return new Step(held, new FocusReading(s.signal(), rolling, baseline, source, threshold, above, false));
        }

        Double reference = source == BaselineSource.ROLLING ? null : baseline;
        session = session.withWindow(rolling, above, reference);

        if (!above) {
            FocusSignalState next = new FocusSignalState(FocusSignal.STEADY, 0, session, s.nextAlertEligibleAt(), latestTs);
            return new Step(next, new FocusReading(FocusSignal.STEADY, rolling, baseline, source, threshold, false, false));
        }

        int windows = s.consecutiveHighWindows() + 1;
        FocusSignal signal = windows >= 2 ? FocusSignal.TAKE_BREAK : FocusSignal.SLOW_DOWN;
        Instant eligibleAt = s.nextAlertEligibleAt();
        boolean autoPause = false;
        if (signal == FocusSignal.TAKE_BREAK && (eligibleAt == null || !now.isBefore(eligibleAt))) {
            autoPause = true;
            eligibleAt = now.plus(ALERT_COOLDOWN);
        }
        FocusSignalState next = new FocusSignalState(signal, windows, session, eligibleAt, latestTs);
        return new Step(next, new FocusReading(signal, rolling, baseline, source, threshold, true, autoPause));
    }

    /** {@code baseline + max(6, drift + 2)}, with an unknown drift taken as 6. */
    public static double threshold(double baseline, Double typicalDriftBpm) {
        double drift = typicalDriftBpm != null ? typicalDriftBpm : DEFAULT_DRIFT_BPM;
        return baseline + Math.max(MIN_MARGIN_BPM, drift + DRIFT_MARGIN_BPM);
    }

    /** Mean of the samples in the first five minutes of the run, once there are at least three. */
    static OptionalDouble sessionBaseline(List<HeartRateSample> samples, Instant runStartedAt) {
        if (runStartedAt == null) return OptionalDouble.empty();
        Instant end = runStartedAt.plus(SESSION_BASELINE_WINDOW);
        double[] early = samples.stream()
                .filter(x -> {
                    Instant i = x.instant();
                    return i != null && !i.isBefore(runStartedAt) && !i.isAfter(end);
                })
                .mapToDouble(HeartRateSample::bpm)
                .toArray();
        if (early.length < SESSION_BASELINE_MIN_SAMPLES) return OptionalDouble.empty();
        double sum = 0;
        for (double v : early) sum += v;
        return OptionalDouble.of(sum / early.length);
    }

    private static boolean needsNewRun(FocusSignalState s, Instant runStartedAt) {
        return s.session() == null
                || (runStartedAt != null && !runStartedAt.equals(s.session().startedAt()));
    }
}
