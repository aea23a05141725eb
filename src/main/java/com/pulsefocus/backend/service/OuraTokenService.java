package com.pulsefocus.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsefocus.backend.config.OuraSettings;
import com.pulsefocus.backend.dto.ScopeDebug;
import com.pulsefocus.backend.entity.OuraCredential;
import com.pulsefocus.backend.exception.AuthExpiredException;
import com.pulsefocus.backend.exception.OuraNotConfiguredException;
import com.pulsefocus.backend.exception.VendorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Owns the OAuth credential lifecycle with Oura: authorization-code exchange,
 * transparent refresh near expiry, and revocation.
 *
 * <p>Refresh tokens are single use, so refreshes are coordinated per user
 * through a {@link SingleFlight}: concurrent readers of an expired credential
 * share one token-endpoint call. When a refresh is rejected because another
 * process already rotated the token, the freshly stored credential is used
 * instead.
 */
@Service
@Slf4j
public class OuraTokenService {

    private static final String TOKEN_PATH = "/oauth/token";
    static final long DEFAULT_TTL_SECONDS = 86_400L;

    private final WebClient webClient;
    private final CredentialStore store;
    private final OuraSettings settings;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final SingleFlight<String> refreshes = new SingleFlight<>();

    public OuraTokenService(WebClient ouraWebClient, CredentialStore store, OuraSettings settings, Clock clock) {
        this.webClient = ouraWebClient;
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }

    /** Build the Oura consent URL; {@code state} is echoed back to the callback. */
    public String buildAuthorizeUrl(String state) {
        requireConfigured();
        return UriComponentsBuilder
                .fromUriString(settings.authorizeUrl())
                .queryParam("response_type", "code")
                .queryParam("client_id", settings.clientId())
                .queryParam("redirect_uri", settings.redirectUri())
                .queryParam("scope", settings.scope())
                .queryParam("state", state)
                .encode()
                .build().toUriString();
    }

    /** Exchange an authorization code and persist the resulting envelope. */
    public Mono<Void> exchangeCode(String userId, String code) {
        return Mono.defer(() -> {
            requireConfigured();
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            form.add("grant_type", "authorization_code");
            form.add("code", code);
            form.add("redirect_uri", settings.redirectUri());
            return requestToken(form)
                    .flatMap(tok -> store.upsert(toCredential(userId, tok, null)))
                    .doOnNext(c -> log.info("Oura connected for user {} (scope={}, expires {})",
                            userId, c.getGrantedScope(), c.getExpiresAt()))
                    .then();
        });
    }

    /**
     * Current access token for {@code userId}, refreshing it when it is within
     * the expiry buffer. Completes empty when the user has no credential.
     * Fails with {@link AuthExpiredException} when the credential cannot be
     * refreshed, or {@link VendorUnavailableException} when the token endpoint
     * could not be reached.
     */
    public Mono<String> getValidAccessToken(String userId) {
        return store.find(userId)
                .flatMap(conn -> {
                    if (isFresh(conn)) {
                        return Mono.just(conn.getAccessToken());
                    }
                    return refreshes.run(userId, () -> refresh(userId, conn));
                });
    }

    /** Delete the stored credential so the user is prompted to reconnect. */
    public Mono<Void> revoke(String userId) {
        return store.delete(userId);
    }

    public Mono<ScopeDebug> scopeDebug(String userId) {
        List<String> required = OuraSettings.REQUIRED_SCOPES;
        if (!settings.isConfigured()) {
            return Mono.just(new ScopeDebug(false, false, null, List.of(), required, required, null, null));
        }
        return store.find(userId)
                .map(conn -> {
                    List<String> granted = splitScope(conn.getGrantedScope());
                    List<String> missing = required.stream().filter(s -> !granted.contains(s)).toList();
                    Instant exp = conn.getExpiresAt();
                    return new ScopeDebug(true, true, conn.getGrantedScope(), granted, required, missing,
                            exp != null ? exp.toString() : null, conn.getTokenType());
                })
                .defaultIfEmpty(new ScopeDebug(true, false, null, List.of(), required, required, null, null));
    }

    /** True while a refresh for {@code userId} is outstanding. */
    boolean isRefreshing(String userId) {
        return refreshes.isInFlight(userId);
    }

    private Mono<String> refresh(String userId, OuraCredential conn) {
        requireConfigured();
        log.info("Oura access token for user {} expires {}; refreshing", userId, conn.getExpiresAt());
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", conn.getRefreshToken());
        return requestToken(form)
                .flatMap(tok -> store.upsert(toCredential(userId, tok, conn.getRefreshToken())))
                .map(OuraCredential::getAccessToken)
                .onErrorResume(TokenRejectedException.class, e -> recoverRotationRace(userId, e));
    }

    /**
     * A rejected refresh token usually means another process rotated it first.
     * If that process already stored a usable credential, take it.
     */
    private Mono<String> recoverRotationRace(String userId, TokenRejectedException e) {
        if (!e.isInvalidGrant()) {
            return Mono.error(new AuthExpiredException("Oura refresh rejected (" + e.status + " " + e.errorCode + ")"));
        }
        return store.find(userId)
                .filter(this::isFresh)
                .map(c -> {
                    log.warn("Oura refresh token for user {} was already rotated; using stored credential", userId);
                    return c.getAccessToken();
                })
                .switchIfEmpty(Mono.error(() -> new AuthExpiredException("Oura refresh token no longer valid")));
    }

    private Mono<Map<String, Object>> requestToken(MultiValueMap<String, String> params) {
        BodyInserters.FormInserter<String> body = BodyInserters.fromFormData(params)
                .with("client_id", settings.clientId())
                .with("client_secret", settings.clientSecret());
        return webClient.post()
                .uri(TOKEN_PATH)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new TokenRejectedException(resp.statusCode().value(), errorCode(text))))
                .onStatus(HttpStatusCode::is5xxServerError, resp -> Mono.just(
                        new VendorUnavailableException("Oura token endpoint failed", resp.statusCode().value())))
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(settings.requestTimeout())
                .onErrorMap(e -> !(e instanceof TokenRejectedException || e instanceof VendorUnavailableException),
                        e -> new VendorUnavailableException("Oura token endpoint unreachable", e))
                .flatMap(tok -> {
                    Object at = tok.get("access_token");
                    if (!(at instanceof String s) || s.isBlank()) {
                        return Mono.error(new AuthExpiredException("Oura token response had no access_token"));
                    }
                    return Mono.just(tok);
                });
    }

    private OuraCredential toCredential(String userId, Map<String, Object> tok, String previousRefreshToken) {
        Instant now = clock.instant();
        Object ttl = tok.get("expires_in");
        long ttlSeconds = ttl instanceof Number n ? n.longValue() : DEFAULT_TTL_SECONDS;
        String rt = (String) tok.get("refresh_token");
        if (rt == null || rt.isBlank()) {
            rt = previousRefreshToken;
        }
        String type = (String) tok.get("token_type");
        return new OuraCredential(
                userId,
                (String) tok.get("access_token"),
                rt,
                type != null && !type.isBlank() ? type : "Bearer",
                (String) tok.get("scope"),
                now.plusSeconds(ttlSeconds),
                now);
    }

    private boolean isFresh(OuraCredential conn) {
        Instant exp = conn.getExpiresAt();
        return exp != null && exp.minus(settings.tokenExpiryBuffer()).isAfter(clock.instant());
    }

    private void requireConfigured() {
        if (!settings.isConfigured()) {
            throw new OuraNotConfiguredException(settings.missing());
        }
    }

    private String errorCode(String body) {
        if (body == null || body.isBlank()) return "";
        try {
            JsonNode node = mapper.readTree(body);
            return node.path("error").asText("");
        } catch (IOException e) {
            return body.contains("invalid_grant") ? "invalid_grant" : "";
        }
    }

    static List<String> splitScope(String scope) {
        if (scope == null || scope.isBlank()) return List.of();
        return Arrays.stream(scope.split("[\\s,]+"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /** 4xx from the token endpoint. Holds only the OAuth error code, never the request. */
    static final class TokenRejectedException extends RuntimeException {
        final int status;
        final String errorCode;

        TokenRejectedException(int status, String errorCode) {
            super("Oura token endpoint rejected request: " + status + " " + errorCode);
            this.status = status;
            this.errorCode = errorCode;
        }

        boolean isInvalidGrant() {
            return "invalid_grant".equals(errorCode);
        }
    }
}
