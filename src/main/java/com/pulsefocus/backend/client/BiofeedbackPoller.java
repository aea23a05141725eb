package com.pulsefocus.backend.client;

import com.pulsefocus.backend.controller.OuraController;
import com.pulsefocus.backend.dto.FocusTelemetryRequest;
import com.pulsefocus.backend.dto.MetricsResponse;
import com.pulsefocus.backend.exception.RateLimitedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Dashboard-side loop: reads {@code /api/oura/metrics}, feeds the
 * {@link FocusSignalEngine}, pauses the timer when the engine asks, and posts
 * telemetry when a focus run ends. A poll never throws; failures and
 * timeouts only stretch the delay before the next tick.
 */
@Slf4j
public class BiofeedbackPoller {

    static final String METRICS_PATH = "/api/oura/metrics";
    static final String TELEMETRY_PATH = "/api/oura/focus-telemetry";

    private final WebClient client;
    private final String userId;
    private final FocusSignalEngine engine;
    private final FocusTimer timer;
    private final Clock clock;
    private final Duration requestTimeout;
    private final Scheduler scheduler;

    private final AtomicReference<PollSchedule> schedule;
    private final AtomicReference<Disposable> pending = new AtomicReference<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean wasActive = new AtomicBoolean(false);
    private volatile Consumer<PollOutcome> listener = o -> { };

    /** What one tick produced. {@code failure} is null on success. */
    public record PollOutcome(FocusReading reading, MetricsResponse metrics, Failure failure, Duration nextDelay) {}

    public enum Failure { TIMED_OUT, RATE_LIMITED, UNAVAILABLE }

    public BiofeedbackPoller(WebClient client, String userId, FocusSignalEngine engine, FocusTimer timer,
                             Clock clock, PollSchedule schedule, Duration requestTimeout, Scheduler scheduler) {
        this.client = client;
        this.userId = userId;
        this.engine = engine;
        this.timer = timer;
        this.clock = clock;
        this.schedule = new AtomicReference<>(schedule);
        this.requestTimeout = requestTimeout;
        this.scheduler = scheduler;
    }

    public BiofeedbackPoller(WebClient client, String userId, FocusSignalEngine engine, FocusTimer timer) {
        this(client, userId, engine, timer, Clock.systemUTC(), PollSchedule.defaults(),
                Duration.ofSeconds(10), Schedulers.parallel());
    }

    public void onOutcome(Consumer<PollOutcome> listener) {
        this.listener = listener != null ? listener : o -> { };
    }

    public PollSchedule schedule() {
        return schedule.get();
    }

    /** Poll now and then keep polling on the schedule until {@link #stop()}. */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduleNext(Duration.ZERO);
        }
    }

    public void stop() {
        running.set(false);
        Disposable d = pending.getAndSet(null);
        if (d != null) {
            d.dispose();
        }
    }

    /** One tick. Completes with an outcome; never errors. */
    public Mono<PollOutcome> pollOnce() {
        return Mono.defer(() -> {
            boolean active = timer.isFocusRunActive();
            Instant runStart = active ? timer.focusRunStartedAt() : null;
            Mono<Void> flush = trackRunTransition(active, runStart);
            return flush.then(fetchMetrics(runStart))
                    .map(m -> applyMetrics(m, active, runStart))
                    .onErrorResume(e -> Mono.just(failed(e, active)));
        }).doOnNext(this::notifyListener);
    }

    private void notifyListener(PollOutcome outcome) {
        try {
            listener.accept(outcome);
        } catch (RuntimeException e) {
            log.warn("Poll outcome listener for user {} failed: {}", userId, e.toString());
        }
    }

    /**
     * Flush the finished run's telemetry. The timer may call this on pause,
     * mode switch, or completion; ticks also detect the transition.
     */
    public Mono<Void> focusRunEnded() {
        wasActive.set(false);
        return engine.endRun(clock.instant())
                .map(this::postTelemetry)
                .orElse(Mono.empty());
    }

    private Mono<Void> trackRunTransition(boolean active, Instant runStart) {
        boolean previous = wasActive.getAndSet(active);
        if (active && !previous) {
            engine.startRun(runStart != null ? runStart : clock.instant());
            return Mono.empty();
        }
        if (!active && previous) {
            return focusRunEnded();
        }
        return Mono.empty();
    }

    private Mono<MetricsResponse> fetchMetrics(Instant runStart) {
        return client.get()
                .uri(b -> {
                    b.path(METRICS_PATH);
                    if (runStart != null) {
                        b.queryParam("focusStart", runStart.toString());
                    }
                    return b.build();
                })
                .header(OuraController.USER_HEADER, userId)
                .retrieve()
                .onStatus(s -> s.value() == HttpStatus.TOO_MANY_REQUESTS.value(),
                        resp -> Mono.just(new RateLimitedException(METRICS_PATH)))
                .bodyToMono(MetricsResponse.class)
                .timeout(requestTimeout);
    }

    private PollOutcome applyMetrics(MetricsResponse m, boolean active, Instant runStart) {
        FocusReading reading = engine.evaluate(m.heartRateSamples(), m.profile(), active, runStart, clock.instant());
        if (reading.autoPause()) {
            timer.autoPause();
        }
        PollSchedule next = schedule.updateAndGet(s -> m.rateLimited() ? s.onFailure() : s.onSuccess());
        Failure failure = m.rateLimited() ? Failure.RATE_LIMITED : null;
        return new PollOutcome(reading, m, failure, next.nextDelay(active));
    }

    private PollOutcome failed(Throwable e, boolean active) {
        Failure failure;
        if (e instanceof TimeoutException) {
            failure = Failure.TIMED_OUT;
        } else if (e instanceof RateLimitedException) {
            failure = Failure.RATE_LIMITED;
        } else {
            failure = Failure.UNAVAILABLE;
        }
        PollSchedule next = schedule.updateAndGet(PollSchedule::onFailure);
        log.warn("Biofeedback poll failed ({}), retrying in {}", failure, next.nextDelay(active));
        return new PollOutcome(null, null, failure, next.nextDelay(active));
    }

    private Mono<Void> postTelemetry(FocusTelemetryRequest body) {
        return client.post()
                .uri(TELEMETRY_PATH)
                .header(OuraController.USER_HEADER, userId)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(requestTimeout)
                .doOnSuccess(r -> log.info("Focus telemetry submitted (peak={}, avg={}, alerts={})",
                        body.peakRollingBpm(), body.avgRollingBpm(), body.alertWindows()))
                .onErrorResume(e -> {
                    log.warn("Focus telemetry submission failed: {}", e.toString());
                    return Mono.empty();
                })
                .then();
    }

    private void scheduleNext(Duration delay) {
        if (!running.get()) {
            return;
        }
        Disposable d = Mono.delay(delay, scheduler)
                .filter(tick -> running.get())
                .flatMap(tick -> pollOnce())
                .subscribe(outcome -> scheduleNext(outcome.nextDelay()));
        pending.set(d);
        if (!running.get()) {
            d.dispose();
        }
    }
}
