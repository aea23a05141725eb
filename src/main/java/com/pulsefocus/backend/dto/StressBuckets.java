package com.pulsefocus.backend.dto;

/**
 * Daily stress summary with every duration normalized to hours (one decimal).
 * {@code state} is the vendor's qualitative label, when it sent one.
 */
public record StressBuckets(
        String date,
        String state,
        double stressedHours,
        double engagedHours,
        double relaxedHours,
        double restoredHours
) {}
