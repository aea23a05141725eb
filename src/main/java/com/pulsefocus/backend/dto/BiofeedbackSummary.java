package com.pulsefocus.backend.dto;

import java.util.List;

public record BiofeedbackSummary(List<HeartRateSample> samples, HeartRateSample latest, StressBuckets stressBuckets) {
}
