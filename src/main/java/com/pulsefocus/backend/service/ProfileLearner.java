package com.pulsefocus.backend.service;

import com.pulsefocus.backend.config.OuraSettings;
import com.pulsefocus.backend.dto.FocusTelemetryRequest;
import com.pulsefocus.backend.dto.HeartRateSample;
import com.pulsefocus.backend.dto.ProfileSnapshot;
import com.pulsefocus.backend.entity.FocusProfile;
import com.pulsefocus.backend.entity.FocusTelemetry;
import com.pulsefocus.backend.exception.TelemetryValidationException;
import com.pulsefocus.backend.repository.FocusProfileRepository;
import com.pulsefocus.backend.repository.FocusTelemetryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;

/**
 * Learns each user's resting-focus heart rate and how far it typically rises
 * during a run, from the telemetry posted when a focus run ends.
 *
 * <p>The first session initializes the profile; later sessions move it 20%
 * of the way toward the new observation. Profile writes are versioned; a
 * write that lost a race with another session is recomputed from a fresh read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileLearner {

    static final double BLEND_WEIGHT = 0.2;
    static final double MIN_DRIFT_BPM = 4.0;
    static final double MIN_BPM = 30.0;
    static final double MAX_BPM = 220.0;
    static final int MAX_PROFILE_RETRIES = 5;

    private final FocusProfileRepository profiles;
    private final FocusTelemetryRepository telemetry;
    private final OuraSettings settings;
    private final Clock clock;

    public Mono<ProfileSnapshot> profile(String userId) {
        return Mono.fromCallable(() -> ProfileSnapshot.of(profiles.findById(userId).orElse(null)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /** Validate, append the telemetry row, and fold it into the profile. */
    public Mono<ProfileSnapshot> recordSession(String userId, FocusTelemetryRequest request) {
        return Mono.fromCallable(() -> validate(request))
                .flatMap(t -> Mono.fromRunnable(() -> appendTelemetry(userId, t, clock.instant()))
                        .then(Mono.fromCallable(() -> updateProfile(userId, t))
                                .retryWhen(Retry.max(MAX_PROFILE_RETRIES).filter(ProfileLearner::isWriteConflict)
                                        .doBeforeRetry(sig -> log.info("Focus profile for user {} changed concurrently; retrying",
                                                userId)))))
                .map(ProfileSnapshot::of)
                .subscribeOn(Schedulers.boundedElastic());
    }

    FocusProfile updateProfile(String userId, ValidTelemetry t) {
        Instant now = clock.instant();
        FocusProfile existing = profiles.findById(userId).orElseGet(() -> FocusProfile.empty(userId));
        double drift = Math.max(0.0, t.peak() - t.baseline());
        boolean first = existing.getSampleCount() == 0 || existing.getBaselineMedianBpm() == null;
        double weight = first ? 1.0 : BLEND_WEIGHT;

        double baseline = blend(existing.getBaselineMedianBpm(), t.baseline(), weight);
        double typicalDrift = Math.max(MIN_DRIFT_BPM, blend(existing.getTypicalDriftBpm(), drift, weight));

        FocusProfile next = new FocusProfile(userId, baseline, typicalDrift, existing.getSampleCount() + 1, now,
                existing.getVersion());
        FocusProfile saved = profiles.save(next);
        log.info("Focus profile for user {} -> baseline={} drift={} samples={}",
                userId, saved.getBaselineMedianBpm(), saved.getTypicalDriftBpm(), saved.getSampleCount());
        return saved;
    }

    private static boolean isWriteConflict(Throwable e) {
        return e instanceof OptimisticLockingFailureException || e instanceof DuplicateKeyException;
    }

    /** {@code existing*(1-w) + observed*w}, one decimal; a missing value takes the observation. */
    static double blend(Double existing, double observed, double weight) {
        double base = existing != null ? existing : observed;
        return StressDurations.round1(base * (1 - weight) + observed * weight);
    }

    static ValidTelemetry validate(FocusTelemetryRequest r) {
        if (r == null) {
            throw new TelemetryValidationException("Missing telemetry body");
        }
        if (r.sessionStartedAt() == null || r.sessionEndedAt() == null) {
            throw new TelemetryValidationException("Missing session timestamps");
        }
        Instant started = HeartRateSample.parseInstant(r.sessionStartedAt());
        Instant ended = HeartRateSample.parseInstant(r.sessionEndedAt());
        if (started == null || ended == null) {
            throw new TelemetryValidationException("Session timestamps must be ISO-8601");
        }
        if (ended.isBefore(started)) {
            throw new TelemetryValidationException("Session ends before it starts");
        }
        double baseline = bpm("baselineBpm", r.baselineBpm());
        double peak = bpm("peakRollingBpm", r.peakRollingBpm());
        double avg = bpm("avgRollingBpm", r.avgRollingBpm());
        int alerts = r.alertWindows() != null ? r.alertWindows() : 0;
        if (alerts < 0) {
            throw new TelemetryValidationException("alertWindows must not be negative");
        }
        return new ValidTelemetry(started, ended, baseline, peak, avg, alerts);
    }

    private static double bpm(String name, Double value) {
        if (value == null || !Double.isFinite(value) || value < MIN_BPM || value > MAX_BPM) {
            throw new TelemetryValidationException(name + " must be between 30 and 220");
        }
        return value;
    }

    /**
     * The audit row is best effort: deployments without the collection, or
     * with auditing switched off, still learn.
     */
    private void appendTelemetry(String userId, ValidTelemetry t, Instant now) {
        if (!settings.telemetryAuditEnabled()) {
            return;
        }
        try {
            telemetry.insert(new FocusTelemetry(null, userId, t.started(), t.ended(),
                    t.baseline(), t.peak(), t.avg(), t.alertWindows(), now));
        } catch (DataAccessException e) {
            log.warn("Skipping focus telemetry audit row for user {}: {}", userId, e.getMessage());
        }
    }

    record ValidTelemetry(Instant started, Instant ended, double baseline, double peak, double avg, int alertWindows) {}
}
