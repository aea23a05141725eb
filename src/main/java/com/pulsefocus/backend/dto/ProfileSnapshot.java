package com.pulsefocus.backend.dto;

import com.pulsefocus.backend.entity.FocusProfile;

public record ProfileSnapshot(Double baselineMedianBpm, Double typicalDriftBpm, int sampleCount) {

    public static ProfileSnapshot empty() {
        return new ProfileSnapshot(null, null, 0);
    }

    public static ProfileSnapshot of(FocusProfile profile) {
        if (profile == null) return empty();
        return new ProfileSnapshot(profile.getBaselineMedianBpm(), profile.getTypicalDriftBpm(), profile.getSampleCount());
    }
}
