package com.pulsefocus.backend.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable view of the {@code oura.*} properties. Built once by
 * {@link OuraClientConfig} so services can be constructed without a Spring
 * context in tests.
 */
public record OuraSettings(
        String clientId,
        String clientSecret,
        String redirectUri,
        String authorizeUrl,
        String apiBase,
        String scope,
        Duration tokenExpiryBuffer,
        int pageCeiling,
        Duration requestTimeout,
        ZoneId zone,
        boolean telemetryAuditEnabled
) {

    public static final List<String> REQUIRED_SCOPES = List.of("heartrate", "daily");

    public boolean isConfigured() {
        return missing().isEmpty();
    }

    /** Names of the environment variables that still need a value. */
    public List<String> missing() {
        List<String> out = new ArrayList<>();
        if (isBlank(clientId)) out.add("OURA_CLIENT_ID");
        if (isBlank(clientSecret)) out.add("OURA_CLIENT_SECRET");
        if (isBlank(redirectUri)) out.add("OURA_REDIRECT_URI");
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
