package com.pulsefocus.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsefocus.backend.config.OuraSettings;
import com.pulsefocus.backend.exception.AuthExpiredException;
import com.pulsefocus.backend.exception.RateLimitedException;
import com.pulsefocus.backend.exception.VendorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads Oura usercollection endpoints page by page.
 *
 * <p>Heart rate is read from the last 24 hours (stretched back to two hours
 * before the focus start) and, when that window is empty, from the last seven
 * days, because rings upload in batches. Daily stress is read for today only.
 * The {@code fetchHeartRate}/{@code fetchDailyStress} entry points take an
 * access token the caller already resolved. They only fail with
 * {@link AuthExpiredException} when Oura rejects that token; other errors
 * degrade to an empty {@link CollectionResult}.
 */
@Service
@Slf4j
public class OuraCollectionFetcher {

    static final Duration PRIMARY_WINDOW = Duration.ofHours(24);
    static final Duration FOCUS_LOOKBACK = Duration.ofHours(2);
    static final Duration FALLBACK_WINDOW = Duration.ofDays(7);

    private final WebClient webClient;
    private final BiofeedbackAggregator aggregator;
    private final OuraSettings settings;
    private final Clock clock;

    public OuraCollectionFetcher(WebClient ouraWebClient, BiofeedbackAggregator aggregator, OuraSettings settings,
                                 Clock clock) {
        this.webClient = ouraWebClient;
        this.aggregator = aggregator;
        this.settings = settings;
        this.clock = clock;
    }

    public enum CollectionKind {
        HEART_RATE("/v2/usercollection/heartrate", "start_datetime", "end_datetime"),
        DAILY_STRESS("/v2/usercollection/daily_stress", "start_date", "end_date");

        final String path;
        final String startParam;
        final String endParam;

        CollectionKind(String path, String startParam, String endParam) {
            this.path = path;
            this.startParam = startParam;
            this.endParam = endParam;
        }
    }

    /** Rows of one collection read plus why it came back short, if it did. */
    public record CollectionResult(List<JsonNode> rows, boolean failed, boolean rateLimited) {
        public static CollectionResult of(List<JsonNode> rows) {
            return new CollectionResult(rows, false, false);
        }

        public static CollectionResult failure(Throwable e) {
            return new CollectionResult(List.of(), true, e instanceof RateLimitedException);
        }
    }

    /**
     * Fetch every page of {@code kind} between {@code start} and {@code end}
     * (ISO instants for heart rate, ISO dates for stress), stopping at the
     * page ceiling. Rows keep page order. Fails on any vendor error.
     */
    public Mono<List<JsonNode>> fetchWindow(CollectionKind kind, String token, String start, String end) {
        return Mono.defer(() -> fetchPages(kind, token, start, end, null, 1, new ArrayList<>()));
    }

    /**
     * Heart-rate rows, trying the primary window first and the 7-day window
     * when the primary one yields no usable sample.
     */
    public Mono<CollectionResult> fetchHeartRate(String userId, String token, Instant focusStart) {
        Instant end = clock.instant();
        Instant start = end.minus(PRIMARY_WINDOW);
        if (focusStart != null && focusStart.minus(FOCUS_LOOKBACK).isBefore(start)) {
            start = focusStart.minus(FOCUS_LOOKBACK);
        }
        Instant fallbackStart = end.minus(FALLBACK_WINDOW);
        return fetchWindow(CollectionKind.HEART_RATE, token, start.toString(), end.toString())
                .flatMap(rows -> {
                    if (!aggregator.toSamples(rows).isEmpty()) {
                        return Mono.just(rows);
                    }
                    log.info("No usable heart rate in primary window for user {}; trying 7-day window", userId);
                    return fetchWindow(CollectionKind.HEART_RATE, token, fallbackStart.toString(), end.toString());
                })
                .map(CollectionResult::of)
                .onErrorResume(e -> degrade(CollectionKind.HEART_RATE, userId, e));
    }

    /** Today's stress rows only; the vendor computes one summary per day. */
    public Mono<CollectionResult> fetchDailyStress(String userId, String token) {
        String today = LocalDate.now(clock.withZone(settings.zone())).toString();
        return fetchWindow(CollectionKind.DAILY_STRESS, token, today, today)
                .map(CollectionResult::of)
                .onErrorResume(e -> degrade(CollectionKind.DAILY_STRESS, userId, e));
    }

    private Mono<List<JsonNode>> fetchPages(CollectionKind kind, String token, String start, String end,
                                            String nextToken, int page, List<JsonNode> acc) {
        return fetchPage(kind, token, start, end, nextToken)
                .flatMap(body -> {
                    JsonNode data = body.path("data");
                    if (data.isArray()) {
                        data.forEach(acc::add);
                    }
                    String next = body.path("next_token").asText(null);
                    if (next == null || next.isBlank()) {
                        return Mono.just(acc);
                    }
                    if (page >= settings.pageCeiling()) {
                        log.warn("Stopped paging {} after {} pages ({} rows)", kind.path, page, acc.size());
                        return Mono.just(acc);
                    }
                    return fetchPages(kind, token, start, end, next, page + 1, acc);
                });
    }

    private Mono<JsonNode> fetchPage(CollectionKind kind, String token, String start, String end, String nextToken) {
        return webClient.get()
                .uri(b -> pageUri(b, kind, start, end, nextToken))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(s -> s.value() == HttpStatus.UNAUTHORIZED.value(),
                        resp -> Mono.just(new AuthExpiredException("Oura rejected access token for " + kind.path)))
                .onStatus(s -> s.value() == HttpStatus.TOO_MANY_REQUESTS.value(),
                        resp -> Mono.just(new RateLimitedException(kind.path)))
                .onStatus(HttpStatusCode::isError, resp -> Mono.just(
                        new VendorUnavailableException("Oura request failed for " + kind.path, resp.statusCode().value())))
                .bodyToMono(JsonNode.class)
                .timeout(settings.requestTimeout());
    }

    private URI pageUri(UriBuilder b, CollectionKind kind, String start, String end, String nextToken) {
        b.path(kind.path)
                .queryParam(kind.startParam, start)
                .queryParam(kind.endParam, end);
        if (nextToken != null) {
            b.queryParam("next_token", nextToken);
        }
        return b.build();
    }

    private Mono<CollectionResult> degrade(CollectionKind kind, String userId, Throwable e) {
        if (e instanceof AuthExpiredException) {
            return Mono.error(e);
        }
        if (e instanceof RateLimitedException) {
            log.warn("Oura rate limited {} for user {}", kind.path, userId);
        } else {
            log.warn("Oura {} unavailable for user {}: {}", kind.path, userId, e.toString());
        }
        return Mono.just(CollectionResult.failure(e));
    }
}
