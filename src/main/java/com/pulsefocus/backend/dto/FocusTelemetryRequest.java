package com.pulsefocus.backend.dto;

/**
 * Body of {@code POST /api/oura/focus-telemetry}. Boxed types so missing
 * fields reach validation instead of defaulting to zero.
 */
public record FocusTelemetryRequest(
        String sessionStartedAt,
        String sessionEndedAt,
        Double baselineBpm,
        Double peakRollingBpm,
        Double avgRollingBpm,
        Integer alertWindows
) {}
