package com.pulsefocus.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
@Slf4j
public class OuraClientConfig {

    @Value("${oura.client-id:}")
    private String clientId;

    @Value("${oura.client-secret:}")
    private String clientSecret;

    @Value("${oura.redirect-uri:}")
    private String redirectUri;

    @Value("${oura.authorize-url:https://cloud.ouraring.com/oauth/authorize}")
    private String authorizeUrl;

    @Value("${oura.api-base:https://api.ouraring.com}")
    private String apiBase;

    @Value("${oura.scope:daily heartrate}")
    private String scope;

    @Value("${oura.token-expiry-buffer-seconds:90}")
    private long tokenExpiryBufferSeconds;

    @Value("${oura.page-ceiling:25}")
    private int pageCeiling;

    @Value("${oura.request-timeout-seconds:10}")
    private long requestTimeoutSeconds;

    @Value("${oura.zone:}")
    private String zone;

    @Value("${oura.telemetry.audit-enabled:true}")
    private boolean telemetryAuditEnabled;

    @Bean
    public OuraSettings ouraSettings() {
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        OuraSettings settings = new OuraSettings(clientId, clientSecret, redirectUri, authorizeUrl, apiBase, scope,
                Duration.ofSeconds(tokenExpiryBufferSeconds), pageCeiling,
                Duration.ofSeconds(requestTimeoutSeconds), zoneId, telemetryAuditEnabled);
        if (settings.isConfigured()) {
            log.info("Oura integration configured (api={}, zone={})", apiBase, zoneId);
        } else {
            log.warn("Oura integration not configured; missing {}", settings.missing());
        }
        return settings;
    }

    /**
     * Client for both the token endpoint and the usercollection endpoints,
     * which share the same host.
     */
    @Bean
    public WebClient ouraWebClient(WebClient.Builder builder) {
        return builder.baseUrl(apiBase).build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
