package com.pulsefocus.backend.controller;

import com.pulsefocus.backend.dto.FocusTelemetryRequest;
import com.pulsefocus.backend.dto.HeartRateSample;
import com.pulsefocus.backend.dto.MetricsResponse;
import com.pulsefocus.backend.dto.ProfileSnapshot;
import com.pulsefocus.backend.dto.ScopeDebug;
import com.pulsefocus.backend.exception.OuraNotConfiguredException;
import com.pulsefocus.backend.exception.TelemetryValidationException;
import com.pulsefocus.backend.service.OuraMetricsService;
import com.pulsefocus.backend.service.OuraTokenService;
import com.pulsefocus.backend.service.ProfileLearner;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@WebFluxTest(OuraController.class)
class OuraControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean private OuraTokenService tokenService;
    @MockBean private OuraMetricsService metricsService;
    @MockBean private ProfileLearner profileLearner;

    @Test
    void metricsReturnsPayloadForHeaderUser() {
        MetricsResponse body = new MetricsResponse(true, List.of(), true,
                List.of(new HeartRateSample("2025-03-10T08:00:00+00:00", 71.0)), 71.0,
                "2025-03-10T08:00:00+00:00", null, new ProfileSnapshot(68.0, 7.0, 3), null, false);
        Mockito.when(metricsService.metrics("u1", "2025-03-10T07:55:00Z")).thenReturn(Mono.just(body));

        webTestClient.get().uri("/api/oura/metrics?focusStart=2025-03-10T07:55:00Z")
                .header(OuraController.USER_HEADER, "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.connected").isEqualTo(true)
                .jsonPath("$.latestHeartRate").isEqualTo(71.0)
                .jsonPath("$.heartRateSamples[0].bpm").isEqualTo(71.0)
                .jsonPath("$.profile.sampleCount").isEqualTo(3)
                .jsonPath("$.rateLimited").isEqualTo(false);
    }

    @Test
    void missingUserHeaderIsBadRequest() {
        webTestClient.get().uri("/api/oura/metrics")
                .exchange()
                .expectStatus().isBadRequest();

        verify(metricsService, never()).metrics(anyString(), any());
    }

    @Test
    void telemetryReturnsUpdatedProfile() {
        Mockito.when(profileLearner.recordSession(eq("u1"), any(FocusTelemetryRequest.class)))
                .thenReturn(Mono.just(new ProfileSnapshot(68.0, 12.0, 1)));

        webTestClient.post().uri("/api/oura/focus-telemetry")
                .header(OuraController.USER_HEADER, "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new FocusTelemetryRequest("2025-03-10T09:00:00Z", "2025-03-10T09:25:00Z", 68.0, 80.0, 74.0, 2))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(true)
                .jsonPath("$.profile.baselineMedianBpm").isEqualTo(68.0)
                .jsonPath("$.profile.sampleCount").isEqualTo(1);
    }

    @Test
    void invalidTelemetryIsBadRequest() {
        Mockito.when(profileLearner.recordSession(eq("u1"), any(FocusTelemetryRequest.class)))
                .thenReturn(Mono.error(new TelemetryValidationException("baselineBpm must be between 30 and 220")));

        webTestClient.post().uri("/api/oura/focus-telemetry")
                .header(OuraController.USER_HEADER, "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"sessionStartedAt\":\"2025-03-10T09:00:00Z\",\"sessionEndedAt\":\"2025-03-10T09:25:00Z\","
                        + "\"baselineBpm\":10,\"peakRollingBpm\":80,\"avgRollingBpm\":74}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("baselineBpm must be between 30 and 220");
    }

    @Test
    void connectRedirectsToOuraAndSetsStateCookies() {
        Mockito.when(tokenService.buildAuthorizeUrl(anyString()))
                .thenReturn("https://cloud.ouraring.com/oauth/authorize?state=abc");

        webTestClient.get().uri("/api/oura/connect?next=//evil.example.com")
                .header(OuraController.USER_HEADER, "u1")
                .exchange()
                .expectStatus().isFound()
                .expectHeader().location("https://cloud.ouraring.com/oauth/authorize?state=abc")
                .expectCookie().exists(OuraController.STATE_COOKIE)
                .expectCookie().httpOnly(OuraController.STATE_COOKIE, true)
                .expectCookie().valueEquals(OuraController.NEXT_COOKIE, "/settings");
    }

    @Test
    void connectWithoutConfigurationReportsMissingVariables() {
        Mockito.when(tokenService.buildAuthorizeUrl(anyString()))
                .thenThrow(new OuraNotConfiguredException(List.of("OURA_CLIENT_ID")));

        webTestClient.get().uri("/api/oura/connect")
                .header(OuraController.USER_HEADER, "u1")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.missing[0]").isEqualTo("OURA_CLIENT_ID");
    }

    @Test
    void callbackWithMismatchedStateIsRejected() {
        webTestClient.get().uri("/api/oura/callback?code=c1&state=forged")
                .header(OuraController.USER_HEADER, "u1")
                .cookie(OuraController.STATE_COOKIE, "expected")
                .exchange()
                .expectStatus().isFound()
                .expectHeader().location("/settings?oura=invalid_state");

        verify(tokenService, never()).exchangeCode(anyString(), anyString());
    }

    @Test
    void callbackExchangesCodeAndReturnsToNextPath() {
        Mockito.when(tokenService.exchangeCode("u1", "c1")).thenReturn(Mono.empty());

        webTestClient.get().uri("/api/oura/callback?code=c1&state=s1")
                .header(OuraController.USER_HEADER, "u1")
                .cookie(OuraController.STATE_COOKIE, "s1")
                .cookie(OuraController.NEXT_COOKIE, "/focus")
                .exchange()
                .expectStatus().isFound()
                .expectHeader().location("/focus?oura=connected")
                .expectCookie().maxAge(OuraController.STATE_COOKIE, Duration.ZERO);
    }

    @Test
    void callbackReportsFailedExchange() {
        Mockito.when(tokenService.exchangeCode("u1", "c1")).thenReturn(Mono.error(new IllegalStateException("boom")));

        webTestClient.get().uri("/api/oura/callback?code=c1&state=s1")
                .header(OuraController.USER_HEADER, "u1")
                .cookie(OuraController.STATE_COOKIE, "s1")
                .exchange()
                .expectStatus().isFound()
                .expectHeader().location("/settings?oura=connect_failed");
    }

    @Test
    void disconnectRevokesCredential() {
        Mockito.when(tokenService.revoke("u1")).thenReturn(Mono.empty());

        webTestClient.post().uri("/api/oura/disconnect")
                .header(OuraController.USER_HEADER, "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(true);

        verify(tokenService).revoke("u1");
    }

    @Test
    void debugReportsScopes() {
        Mockito.when(tokenService.scopeDebug("u1")).thenReturn(Mono.just(new ScopeDebug(true, true, "heartrate",
                List.of("heartrate"), List.of("heartrate", "daily"), List.of("daily"), null, "Bearer")));

        webTestClient.get().uri("/api/oura/debug")
                .header(OuraController.USER_HEADER, "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.missingScopes[0]").isEqualTo("daily")
                .jsonPath("$.tokenType").isEqualTo("Bearer");
    }

    @Test
    void safeNextOnlyAllowsSameSitePaths() {
        assertEquals("/focus", OuraController.safeNext("/focus"));
        assertEquals("/settings", OuraController.safeNext("https://evil.example.com"));
        assertEquals("/settings", OuraController.safeNext("//evil.example.com"));
        assertEquals("/settings", OuraController.safeNext(null));
    }
}
