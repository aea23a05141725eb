package com.pulsefocus.backend.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Converts vendor stress durations to hours.
 *
 * <p>Oura has reported these fields in seconds, minutes, or hours depending on
 * the API version. Each bucket lists its candidate fields in priority order
 * with the unit when it is known; fields of unknown unit go through
 * {@link #guessHours(double)}.
 */
public final class StressDurations {

    public enum Unit { SECONDS, MINUTES, HOURS, UNKNOWN }

    public record Candidate(String field, Unit unit) {}

    public static final List<Candidate> STRESSED = List.of(
            new Candidate("stressed_hours", Unit.HOURS),
            new Candidate("high_stress_minutes", Unit.MINUTES),
            new Candidate("stressed_minutes", Unit.MINUTES),
            new Candidate("stress_high_seconds", Unit.SECONDS),
            new Candidate("stress_high", Unit.UNKNOWN));

    public static final List<Candidate> ENGAGED = List.of(
            new Candidate("engaged_hours", Unit.HOURS),
            new Candidate("engaged_minutes", Unit.MINUTES),
            new Candidate("engagement_high", Unit.UNKNOWN),
            new Candidate("engaged", Unit.UNKNOWN));

    public static final List<Candidate> RELAXED = List.of(
            new Candidate("relaxed_hours", Unit.HOURS),
            new Candidate("relaxed_minutes", Unit.MINUTES),
            new Candidate("relaxation_high", Unit.UNKNOWN),
            new Candidate("relaxed", Unit.UNKNOWN));

    public static final List<Candidate> RESTORED = List.of(
            new Candidate("restored_hours", Unit.HOURS),
            new Candidate("restored_minutes", Unit.MINUTES),
            new Candidate("recovery_high_seconds", Unit.SECONDS),
            new Candidate("recovery_high", Unit.UNKNOWN));

    private StressDurations() {}

    /**
     * Hours for the first candidate present on {@code row} with a numeric
     * value, rounded to one decimal; 0 when none is present.
     */
    public static double hours(JsonNode row, List<Candidate> candidates) {
        if (row == null) return 0.0;
        for (Candidate c : candidates) {
            Double raw = BiofeedbackAggregator.asNumber(row.get(c.field()));
            if (raw != null) {
                return round1(toHours(raw, c.unit()));
            }
        }
        return 0.0;
    }

    static double toHours(double value, Unit unit) {
        return switch (unit) {
            case SECONDS -> value / 3600.0;
            case MINUTES -> value / 60.0;
            case HOURS -> value;
            case UNKNOWN -> guessHours(value);
        };
    }

    /**
     * Magnitude heuristic: {@code >= 3600} is seconds, {@code > 24} is
     * minutes, anything else is already hours. Approximate by nature; a
     * 30-second reading reads as 30 minutes.
     */
    public static double guessHours(double value) {
        if (value >= 3600) return value / 3600.0;
        if (value > 24) return value / 60.0;
        return value;
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
