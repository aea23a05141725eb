package com.pulsefocus.backend.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/** Append-only record of one finished focus run. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "focus_telemetry")
public class FocusTelemetry {

    @Id
    private String id;

    @Field("user_id")
    private String userId;

    @Field("session_started_at")
    private Instant sessionStartedAt;

    @Field("session_ended_at")
    private Instant sessionEndedAt;

    @Field("baseline_bpm")
    private double baselineBpm;

    @Field("peak_rolling_bpm")
    private double peakRollingBpm;

    @Field("avg_rolling_bpm")
    private double avgRollingBpm;

    @Field("alert_windows")
    private int alertWindows;

    @Field("created_at")
    private Instant createdAt;
}
