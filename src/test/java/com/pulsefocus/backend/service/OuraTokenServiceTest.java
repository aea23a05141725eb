package com.pulsefocus.backend.service;

import com.pulsefocus.backend.config.OuraSettings;
import com.pulsefocus.backend.entity.OuraCredential;
import com.pulsefocus.backend.exception.AuthExpiredException;
import com.pulsefocus.backend.exception.VendorUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OuraTokenServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private CredentialStore store;

    static OuraSettings settings() {
        return new OuraSettings("client-1", "secret-1", "https://app.example.com/api/oura/callback",
                "https://cloud.ouraring.com/oauth/authorize", "https://api.ouraring.com", "daily heartrate",
                Duration.ofSeconds(90), 25, Duration.ofSeconds(5), ZoneId.of("UTC"), true);
    }

    @BeforeEach
    void setUp() {
        store = mock(CredentialStore.class);
        when(store.upsert(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
    }

    private OuraTokenService service(ExchangeFunction fn) {
        WebClient client = WebClient.builder().baseUrl("https://api.ouraring.com").exchangeFunction(fn).build();
        return new OuraTokenService(client, store, settings(), clock);
    }

    private static OuraCredential credential(String access, Instant expiresAt) {
        return new OuraCredential("u1", access, "refresh-1", "Bearer", "daily heartrate", expiresAt, NOW);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header("Content-Type", "application/json")
                .body(body)
                .build();
    }

    @Test
    void freshTokenIsReturnedWithoutNetworkCall() {
        AtomicInteger calls = new AtomicInteger();
        when(store.find("u1")).thenReturn(Mono.just(credential("access-live", NOW.plusSeconds(3600))));

        String token = service(req -> {
            calls.incrementAndGet();
            return Mono.error(new IllegalStateException("unexpected"));
        }).getValidAccessToken("u1").block();

        assertEquals("access-live", token);
        assertEquals(0, calls.get());
    }

    @Test
    void missingCredentialCompletesEmpty() {
        when(store.find("u1")).thenReturn(Mono.empty());
        assertNull(service(req -> Mono.error(new IllegalStateException())).getValidAccessToken("u1").block());
    }

    @Test
    void tokenInsideExpiryBufferIsRefreshed() {
        AtomicInteger calls = new AtomicInteger();
        when(store.find("u1")).thenReturn(Mono.just(credential("access-old", NOW.plusSeconds(60))));

        String token = service(req -> {
            calls.incrementAndGet();
            return Mono.just(json(HttpStatus.OK,
                    "{\"access_token\":\"access-new\",\"refresh_token\":\"refresh-2\",\"expires_in\":86400}"));
        }).getValidAccessToken("u1").block();

        assertEquals("access-new", token);
        assertEquals(1, calls.get());
        ArgumentCaptor<OuraCredential> saved = ArgumentCaptor.forClass(OuraCredential.class);
        verify(store).upsert(saved.capture());
        assertEquals("refresh-2", saved.getValue().getRefreshToken());
        assertEquals(NOW.plusSeconds(86400), saved.getValue().getExpiresAt());
    }

    @Test
    void concurrentCallersShareOneRefresh() {
        AtomicInteger calls = new AtomicInteger();
        when(store.find("u1")).thenReturn(Mono.just(credential("access-old", NOW.minusSeconds(10))));
        OuraTokenService svc = service(req -> {
            calls.incrementAndGet();
            return Mono.delay(Duration.ofMillis(100)).map(i -> json(HttpStatus.OK,
                    "{\"access_token\":\"access-new\",\"refresh_token\":\"refresh-2\",\"expires_in\":86400}"));
        });

        List<String> tokens = Flux.range(0, 8)
                .flatMap(i -> svc.getValidAccessToken("u1"))
                .collectList()
                .block();

        assertEquals(8, tokens.size());
        assertTrue(tokens.stream().allMatch("access-new"::equals));
        assertEquals(1, calls.get());
        assertFalse(svc.isRefreshing("u1"));
    }

    @Test
    void refreshKeepsPreviousRefreshTokenWhenResponseOmitsIt() {
        when(store.find("u1")).thenReturn(Mono.just(credential("access-old", NOW.minusSeconds(10))));

        service(req -> Mono.just(json(HttpStatus.OK, "{\"access_token\":\"access-new\",\"expires_in\":600}")))
                .getValidAccessToken("u1").block();

        ArgumentCaptor<OuraCredential> saved = ArgumentCaptor.forClass(OuraCredential.class);
        verify(store).upsert(saved.capture());
        assertEquals("refresh-1", saved.getValue().getRefreshToken());
        assertEquals("Bearer", saved.getValue().getTokenType());
    }

    @Test
    void missingExpiryGetsDefaultLifetime() {
        when(store.find("u1")).thenReturn(Mono.just(credential("access-old", NOW.minusSeconds(10))));

        service(req -> Mono.just(json(HttpStatus.OK, "{\"access_token\":\"access-new\"}")))
                .getValidAccessToken("u1").block();

        ArgumentCaptor<OuraCredential> saved = ArgumentCaptor.forClass(OuraCredential.class);
        verify(store).upsert(saved.capture());
        assertEquals(NOW.plusSeconds(OuraTokenService.DEFAULT_TTL_SECONDS), saved.getValue().getExpiresAt());
    }

    @Test
    void rotationRaceFallsBackToCredentialStoredByOtherProcess() {
        when(store.find("u1")).thenReturn(
                Mono.just(credential("access-old", NOW.minusSeconds(10))),
                Mono.just(credential("access-rotated", NOW.plusSeconds(86400))));

        String token = service(req -> Mono.just(json(HttpStatus.BAD_REQUEST,
                "{\"error\":\"invalid_grant\",\"error_description\":\"refresh token already used\"}")))
                .getValidAccessToken("u1").block();

        assertEquals("access-rotated", token);
        verify(store, never()).upsert(any());
    }

    @Test
    void rotationRaceWithoutFreshCredentialFails() {
        when(store.find("u1")).thenReturn(Mono.just(credential("access-old", NOW.minusSeconds(10))));
        OuraTokenService svc = service(req -> Mono.just(json(HttpStatus.BAD_REQUEST, "{\"error\":\"invalid_grant\"}")));

        AuthExpiredException e = assertThrows(AuthExpiredException.class, () -> svc.getValidAccessToken("u1").block());
        assertFalse(e.getMessage().contains("refresh-1"));
        assertFalse(svc.isRefreshing("u1"));
    }

    @Test
    void otherClientErrorIsAuthExpired() {
        when(store.find("u1")).thenReturn(Mono.just(credential("access-old", NOW.minusSeconds(10))));
        OuraTokenService svc = service(req -> Mono.just(json(HttpStatus.UNAUTHORIZED, "{\"error\":\"invalid_client\"}")));

        assertThrows(AuthExpiredException.class, () -> svc.getValidAccessToken("u1").block());
    }

    @Test
    void serverErrorIsVendorUnavailable() {
        when(store.find("u1")).thenReturn(Mono.just(credential("access-old", NOW.minusSeconds(10))));
        OuraTokenService svc = service(req -> Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "")));

        VendorUnavailableException e = assertThrows(VendorUnavailableException.class,
                () -> svc.getValidAccessToken("u1").block());
        assertEquals(503, e.getStatus());
    }

    @Test
    void exchangeCodePersistsFullEnvelope() {
        service(req -> Mono.just(json(HttpStatus.OK,
                "{\"access_token\":\"a1\",\"refresh_token\":\"r1\",\"expires_in\":3600,\"scope\":\"daily heartrate\"}")))
                .exchangeCode("u1", "code-123").block();

        ArgumentCaptor<OuraCredential> saved = ArgumentCaptor.forClass(OuraCredential.class);
        verify(store).upsert(saved.capture());
        OuraCredential c = saved.getValue();
        assertEquals("u1", c.getUserId());
        assertEquals("a1", c.getAccessToken());
        assertEquals("r1", c.getRefreshToken());
        assertEquals("Bearer", c.getTokenType());
        assertEquals("daily heartrate", c.getGrantedScope());
        assertEquals(NOW.plusSeconds(3600), c.getExpiresAt());
    }

    @Test
    void authorizeUrlCarriesStateAndScope() {
        String url = service(req -> Mono.empty()).buildAuthorizeUrl("state-xyz");

        assertTrue(url.startsWith("https://cloud.ouraring.com/oauth/authorize?"));
        assertTrue(url.contains("response_type=code"));
        assertTrue(url.contains("client_id=client-1"));
        assertTrue(url.contains("state=state-xyz"));
        assertTrue(url.contains("scope=daily%20heartrate"));
    }

    @Test
    void scopeDebugReportsMissingScopesWithoutTokens() {
        OuraCredential c = credential("access-live", NOW.plusSeconds(3600));
        c.setGrantedScope("heartrate personal");
        when(store.find("u1")).thenReturn(Mono.just(c));

        var debug = service(req -> Mono.empty()).scopeDebug("u1").block();

        assertTrue(debug.connected());
        assertEquals(List.of("heartrate", "personal"), debug.grantedScopes());
        assertEquals(List.of("daily"), debug.missingScopes());
        assertFalse(debug.toString().contains("access-live"));
    }
}
