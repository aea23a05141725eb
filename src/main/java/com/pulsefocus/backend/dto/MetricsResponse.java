package com.pulsefocus.backend.dto;

import java.util.List;

/**
 * Body of {@code GET /api/oura/metrics}. Every field is always present so the
 * dashboard can render any degraded state.
 */
public record MetricsResponse(
        boolean configured,
        List<String> missing,
        boolean connected,
        List<HeartRateSample> heartRateSamples,
        Double latestHeartRate,
        String latestHeartRateTime,
        StressBuckets stressToday,
        ProfileSnapshot profile,
        String warning,
        boolean rateLimited
) {

    public static MetricsResponse notConfigured(List<String> missing) {
        return new MetricsResponse(false, missing, false, List.of(), null, null, null, ProfileSnapshot.empty(), null, false);
    }

    public static MetricsResponse disconnected(ProfileSnapshot profile, String warning) {
        return new MetricsResponse(true, List.of(), false, List.of(), null, null, null,
                profile != null ? profile : ProfileSnapshot.empty(), warning, false);
    }

    public static MetricsResponse connected(BiofeedbackSummary summary, ProfileSnapshot profile,
                                            String warning, boolean rateLimited) {
        HeartRateSample latest = summary.latest();
        return new MetricsResponse(true, List.of(), true, summary.samples(),
                latest != null ? latest.bpm() : null,
                latest != null ? latest.timestamp() : null,
                summary.stressBuckets(), profile, warning, rateLimited);
    }
}
