package com.pulsefocus.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulsefocus.backend.dto.BiofeedbackSummary;
import com.pulsefocus.backend.dto.HeartRateSample;
import com.pulsefocus.backend.dto.StressBuckets;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Turns raw Oura rows into {@link BiofeedbackSummary}. Stateless; field names
 * differ across API versions so every read tries several candidates.
 */
@Component
public class BiofeedbackAggregator {

    public static final Duration ROLLING_WINDOW = Duration.ofMinutes(5);

    static final List<String> BPM_FIELDS = List.of("bpm", "heart_rate", "heartrate", "hr", "value");
    static final List<String> TIMESTAMP_FIELDS = List.of("timestamp", "time", "datetime", "start_datetime");
    static final List<String> STATE_FIELDS = List.of(
            "stress_state", "state", "level", "status", "category", "day_summary", "resilience_level");

    /** Shown when the vendor labels the day stressed but reports no stressed time. */
    static final double NOMINAL_STRESSED_HOURS = 0.1;

    public BiofeedbackSummary summarize(List<JsonNode> heartRows, JsonNode stressRow) {
        List<HeartRateSample> samples = toSamples(heartRows);
        HeartRateSample latest = samples.isEmpty() ? null : samples.get(samples.size() - 1);
        return new BiofeedbackSummary(samples, latest, stressRow != null ? toStressBuckets(stressRow) : null);
    }

    /** Samples in ascending timestamp order; rows without a bpm and a timestamp are dropped. */
    public List<HeartRateSample> toSamples(List<JsonNode> rows) {
        List<HeartRateSample> out = new ArrayList<>();
        if (rows == null) return out;
        for (JsonNode row : rows) {
            Double bpm = firstNumber(row, BPM_FIELDS);
            String ts = firstText(row, TIMESTAMP_FIELDS);
            if (bpm == null || ts == null) {
                continue;
            }
            out.add(new HeartRateSample(ts, bpm));
        }
        // List.sort is stable, duplicate timestamps keep vendor order
        out.sort(Comparator.comparing(HeartRateSample::timestamp));
        return out;
    }

    public StressBuckets toStressBuckets(JsonNode row) {
        String state = stressState(row);
        double stressed = StressDurations.hours(row, StressDurations.STRESSED);
        if ("Stressed".equals(state) && stressed == 0.0) {
            stressed = NOMINAL_STRESSED_HOURS;
        }
        return new StressBuckets(
                firstText(row, List.of("day", "date")),
                state,
                stressed,
                StressDurations.hours(row, StressDurations.ENGAGED),
                StressDurations.hours(row, StressDurations.RELAXED),
                StressDurations.hours(row, StressDurations.RESTORED));
    }

    /**
     * Mean bpm of the samples within {@link #ROLLING_WINDOW} of the latest
     * one. Empty when there are no samples with a parseable timestamp.
     */
    public static OptionalDouble rollingAverage(List<HeartRateSample> samples) {
        if (samples == null || samples.isEmpty()) return OptionalDouble.empty();
        Instant latest = samples.stream()
                .map(HeartRateSample::instant)
                .filter(i -> i != null)
                .max(Comparator.naturalOrder())
                .orElse(null);
        if (latest == null) return OptionalDouble.empty();
        Instant cutoff = latest.minus(ROLLING_WINDOW);
        return samples.stream()
                .filter(s -> {
                    Instant i = s.instant();
                    return i != null && !i.isBefore(cutoff);
                })
                .mapToDouble(HeartRateSample::bpm)
                .average();
    }

    static String normalizeStateLabel(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) return null;
        if (normalized.contains("restore")) return "Restored";
        if (normalized.contains("relax")) return "Relaxed";
        if (normalized.contains("engag")) return "Engaged";
        if (normalized.contains("stress")) return "Stressed";
        return Character.toUpperCase(normalized.charAt(0)) + normalized.substring(1);
    }

    private static String stressState(JsonNode row) {
        for (String f : STATE_FIELDS) {
            JsonNode v = row.get(f);
            if (v != null && v.isTextual()) {
                return normalizeStateLabel(v.asText());
            }
        }
        return null;
    }

    /** Finite number from a numeric or numeric-string node. */
    static Double asNumber(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) {
            double d = node.asDouble();
            return Double.isFinite(d) ? d : null;
        }
        if (node.isTextual()) {
            try {
                double d = Double.parseDouble(node.asText().trim());
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Double firstNumber(JsonNode row, List<String> fields) {
        for (String f : fields) {
            Double d = asNumber(row.get(f));
            if (d != null) return d;
        }
        return null;
    }

    private static String firstText(JsonNode row, List<String> fields) {
        for (String f : fields) {
            JsonNode v = row.get(f);
            if (v != null && v.isTextual() && !v.asText().isBlank()) {
                return v.asText();
            }
        }
        return null;
    }
}
