package com.pulsefocus.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsefocus.backend.config.OuraSettings;
import com.pulsefocus.backend.dto.BiofeedbackSummary;
import com.pulsefocus.backend.dto.HeartRateSample;
import com.pulsefocus.backend.dto.MetricsResponse;
import com.pulsefocus.backend.dto.ProfileSnapshot;
import com.pulsefocus.backend.exception.AuthExpiredException;
import com.pulsefocus.backend.exception.VendorUnavailableException;
import com.pulsefocus.backend.service.OuraCollectionFetcher.CollectionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Read path behind {@code GET /api/oura/metrics}: token, both collections in
 * parallel, aggregation, and the learned profile. The returned mono never
 * errors; every failure becomes a displayable payload with a warning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OuraMetricsService {

    static final String RECONNECT_WARNING = "Oura session expired. Please reconnect Oura.";
    static final String TOKEN_UNAVAILABLE_WARNING = "Oura is unreachable right now; showing your saved profile.";
    static final String UNEXPECTED_WARNING = "Unexpected Oura error. Please reconnect Oura.";
    static final String RATE_LIMITED_WARNING = "Oura is rate limiting requests; retrying shortly.";
    static final String HEART_RATE_UNAVAILABLE_WARNING = "Heart-rate data is temporarily unavailable.";
    static final String NO_SAMPLES_WARNING = "No recent heart-rate data from Oura yet. Open the Oura app to sync.";

    private final OuraSettings settings;
    private final OuraTokenService tokens;
    private final OuraCollectionFetcher fetcher;
    private final BiofeedbackAggregator aggregator;
    private final ProfileLearner learner;

    public Mono<MetricsResponse> metrics(String userId, String focusStart) {
        if (!settings.isConfigured()) {
            return Mono.just(MetricsResponse.notConfigured(settings.missing()));
        }
        Instant focusStartAt = HeartRateSample.parseInstant(focusStart);
        Mono<ProfileSnapshot> profile = learner.profile(userId)
                .onErrorResume(e -> {
                    log.warn("Could not load focus profile for user {}: {}", userId, e.toString());
                    return Mono.just(ProfileSnapshot.empty());
                });

        return profile.flatMap(p -> tokens.getValidAccessToken(userId)
                        .flatMap(token -> readConnected(userId, token, focusStartAt, p))
                        .switchIfEmpty(Mono.fromSupplier(() -> MetricsResponse.disconnected(p, null)))
                        .onErrorResume(AuthExpiredException.class, e -> revokeAndDisconnect(userId, p, e))
                        .onErrorResume(VendorUnavailableException.class, e -> {
                            log.warn("Oura token endpoint unavailable for user {}: {}", userId, e.getMessage());
                            return Mono.just(new MetricsResponse(true, List.of(), true, List.of(), null, null, null,
                                    p, TOKEN_UNAVAILABLE_WARNING, e.getStatus() == 429));
                        }))
                .onErrorResume(e -> {
                    log.error("Oura metrics read failed for user {}", userId, e);
                    return Mono.just(MetricsResponse.disconnected(ProfileSnapshot.empty(), UNEXPECTED_WARNING));
                });
    }

    private Mono<MetricsResponse> readConnected(String userId, String token, Instant focusStart,
                                                ProfileSnapshot profile) {
        return Mono.zip(fetcher.fetchHeartRate(userId, token, focusStart), fetcher.fetchDailyStress(userId, token))
                .map(t -> {
                    CollectionResult heart = t.getT1();
                    CollectionResult stress = t.getT2();
                    List<JsonNode> stressRows = stress.rows();
                    JsonNode latestStress = stressRows.isEmpty() ? null : stressRows.get(stressRows.size() - 1);
                    BiofeedbackSummary summary = aggregator.summarize(heart.rows(), latestStress);
                    boolean rateLimited = heart.rateLimited() || stress.rateLimited();
                    return MetricsResponse.connected(summary, profile, warning(heart, summary, rateLimited), rateLimited);
                });
    }

    private Mono<MetricsResponse> revokeAndDisconnect(String userId, ProfileSnapshot profile, AuthExpiredException e) {
        log.warn("Oura credential for user {} is no longer usable: {}", userId, e.getMessage());
        return tokens.revoke(userId)
                .onErrorResume(err -> {
                    log.error("Failed to revoke Oura credential for user {}", userId, err);
                    return Mono.empty();
                })
                .thenReturn(MetricsResponse.disconnected(profile, RECONNECT_WARNING));
    }

    private static String warning(CollectionResult heart, BiofeedbackSummary summary, boolean rateLimited) {
        if (rateLimited) return RATE_LIMITED_WARNING;
        if (heart.failed()) return HEART_RATE_UNAVAILABLE_WARNING;
        if (summary.samples().isEmpty()) return NO_SAMPLES_WARNING;
        return null;
    }
}
