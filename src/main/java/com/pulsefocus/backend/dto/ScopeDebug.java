package com.pulsefocus.backend.dto;

import java.util.List;

/** Scope and expiry introspection. Never carries token values. */
public record ScopeDebug(
        boolean configured,
        boolean connected,
        String storedScope,
        List<String> grantedScopes,
        List<String> requiredScopes,
        List<String> missingScopes,
        String expiresAt,
        String tokenType
) {}
