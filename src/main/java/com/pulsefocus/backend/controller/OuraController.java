package com.pulsefocus.backend.controller;

import com.pulsefocus.backend.dto.FocusTelemetryRequest;
import com.pulsefocus.backend.dto.MetricsResponse;
import com.pulsefocus.backend.dto.ScopeDebug;
import com.pulsefocus.backend.service.OuraMetricsService;
import com.pulsefocus.backend.service.OuraTokenService;
import com.pulsefocus.backend.service.ProfileLearner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Oura endpoints for the dashboard. The app's own login lives upstream; the
 * gateway forwards the authenticated user in {@value #USER_HEADER}.
 */
@RestController
@RequestMapping("/api/oura")
@RequiredArgsConstructor
@Slf4j
public class OuraController {

    public static final String USER_HEADER = "X-User-Id";
    static final String STATE_COOKIE = "oura_oauth_state";
    static final String NEXT_COOKIE = "oura_oauth_next";
    private static final Duration COOKIE_TTL = Duration.ofMinutes(10);
    private static final String DEFAULT_NEXT = "/settings";

    private final OuraTokenService tokens;
    private final OuraMetricsService metricsService;
    private final ProfileLearner learner;

    /** Start OAuth: remember a CSRF state and bounce the browser to Oura. */
    @GetMapping("/connect")
    public ResponseEntity<Void> connect(@RequestHeader(USER_HEADER) String userId,
                                        @RequestParam(value = "next", required = false) String next) {
        String state = UUID.randomUUID().toString();
        String authorizeUrl = tokens.buildAuthorizeUrl(state);
        log.info("Starting Oura OAuth for user {}", userId);
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(authorizeUrl))
                .header(HttpHeaders.SET_COOKIE, cookie(STATE_COOKIE, state, COOKIE_TTL).toString())
                .header(HttpHeaders.SET_COOKIE, cookie(NEXT_COOKIE, safeNext(next), COOKIE_TTL).toString())
                .build();
    }

    /** Redirect target registered with Oura. */
    @GetMapping("/callback")
    public Mono<ResponseEntity<Void>> callback(@RequestHeader(USER_HEADER) String userId,
                                               @RequestParam(value = "code", required = false) String code,
                                               @RequestParam(value = "state", required = false) String state,
                                               ServerHttpRequest request) {
        HttpCookie stateCookie = request.getCookies().getFirst(STATE_COOKIE);
        HttpCookie nextCookie = request.getCookies().getFirst(NEXT_COOKIE);
        String next = safeNext(nextCookie != null ? nextCookie.getValue() : null);

        if (code == null || code.isBlank() || state == null || stateCookie == null
                || !state.equals(stateCookie.getValue())) {
            log.warn("Oura callback for user {} with invalid state", userId);
            return Mono.just(redirect(next, "invalid_state", false));
        }

        return tokens.exchangeCode(userId, code)
                .thenReturn(redirect(next, "connected", true))
                .onErrorResume(e -> {
                    log.error("Oura code exchange failed for user {}", userId, e);
                    return Mono.just(redirect(next, "connect_failed", true));
                });
    }

    @PostMapping("/disconnect")
    public Mono<Map<String, Object>> disconnect(@RequestHeader(USER_HEADER) String userId) {
        return tokens.revoke(userId).thenReturn(Map.of("ok", true));
    }

    @GetMapping("/metrics")
    public Mono<MetricsResponse> metrics(@RequestHeader(USER_HEADER) String userId,
                                         @RequestParam(value = "focusStart", required = false) String focusStart) {
        return metricsService.metrics(userId, focusStart);
    }

    @PostMapping("/focus-telemetry")
    public Mono<Map<String, Object>> focusTelemetry(@RequestHeader(USER_HEADER) String userId,
                                                    @RequestBody FocusTelemetryRequest body) {
        return learner.recordSession(userId, body)
                .map(profile -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("ok", true);
                    m.put("profile", profile);
                    return m;
                });
    }

    @GetMapping("/debug")
    public Mono<ScopeDebug> debug(@RequestHeader(USER_HEADER) String userId) {
        return tokens.scopeDebug(userId);
    }

    static String safeNext(String next) {
        // only same-site paths; "//host" would be protocol-relative
        if (next == null || !next.startsWith("/") || next.startsWith("//")) {
            return DEFAULT_NEXT;
        }
        return next;
    }

    private static ResponseEntity<Void> redirect(String next, String outcome, boolean clearCookies) {
        URI location = UriComponentsBuilder.fromUriString(next)
                .queryParam("oura", outcome)
                .build().toUri();
        ResponseEntity.BodyBuilder b = ResponseEntity.status(HttpStatus.FOUND).location(location);
        if (clearCookies) {
            b.header(HttpHeaders.SET_COOKIE, cookie(STATE_COOKIE, "", Duration.ZERO).toString());
            b.header(HttpHeaders.SET_COOKIE, cookie(NEXT_COOKIE, "", Duration.ZERO).toString());
        }
        return b.build();
    }

    private static ResponseCookie cookie(String name, String value, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}
