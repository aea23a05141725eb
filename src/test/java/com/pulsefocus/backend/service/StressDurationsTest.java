package com.pulsefocus.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StressDurationsTest {

    @Test
    void magnitudeHeuristicBoundaries() {
        assertEquals(1.0, StressDurations.guessHours(3600));
        assertEquals(59.99, StressDurations.guessHours(3599), 0.01);
        assertEquals(0.5, StressDurations.guessHours(30));
        assertEquals(24.0, StressDurations.guessHours(24));
        assertEquals(2.5, StressDurations.guessHours(2.5));
    }

    @Test
    void firstPresentCandidateWins() throws Exception {
        var row = new ObjectMapper().readTree("{\"stressed_minutes\":45,\"stress_high\":7200}");

        assertEquals(0.8, StressDurations.hours(row, StressDurations.STRESSED));
    }

    @Test
    void absentFieldsReadAsZero() throws Exception {
        var row = new ObjectMapper().readTree("{\"stressed\":null}");

        assertEquals(0.0, StressDurations.hours(row, StressDurations.STRESSED));
        assertEquals(0.0, StressDurations.hours(null, StressDurations.RESTORED));
    }

    @Test
    void roundsToOneDecimal() {
        assertEquals(1.3, StressDurations.round1(1.26));
        assertEquals(0.0, StressDurations.round1(0.04));
    }
}
