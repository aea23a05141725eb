package com.pulsefocus.backend.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Learned heart-rate baseline and typical focus drift for one user.
 * {@code sampleCount} only ever grows. Writes are checked against
 * {@code version}, so a save based on a stale read is rejected.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "focus_profiles")
public class FocusProfile {

    @Id
    private String userId;

    @Field("baseline_median_bpm")
    private Double baselineMedianBpm;

    @Field("typical_drift_bpm")
    private Double typicalDriftBpm;

    @Field("sample_count")
    private int sampleCount;

    @Field("updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public static FocusProfile empty(String userId) {
        return new FocusProfile(userId, null, null, 0, null, null);
    }
}
