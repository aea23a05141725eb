package com.pulsefocus.backend.dto;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * One heart-rate reading. {@code timestamp} is kept as the vendor's ISO-8601
 * string so samples order lexicographically.
 */
public record HeartRateSample(String timestamp, double bpm) {

    /** Parsed instant, or {@code null} when the vendor string is not ISO-8601. */
    public Instant instant() {
        return parseInstant(timestamp);
    }

    public static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
