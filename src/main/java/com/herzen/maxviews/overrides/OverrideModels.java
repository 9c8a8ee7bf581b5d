package com.herzen.maxviews.overrides;

import java.time.Instant;
import java.util.List;

public class OverrideModels {
    // Raw column values: null and 0 mean "not set".
    public record OverrideRecord(String moduleId, String userId, Integer limitDelta, Long resetTimestamp) {
        public int delta() {
            return limitDelta == null ? 0 : limitDelta;
        }

        public Instant resetInstant() {
            if (resetTimestamp == null || resetTimestamp == 0 || !isValidResetTimestamp(resetTimestamp)) return null;
            return Instant.ofEpochSecond(resetTimestamp);
        }
    }

    public static boolean isValidResetTimestamp(long epochSecond) {
        return epochSecond >= 0 && epochSecond <= Instant.MAX.getEpochSecond();
    }

    public record OverrideView(String moduleId, String userId, int limitDelta, Instant resetAt) {}

    public record CourseOverridesResponse(String courseId, List<OverrideView> overrides) {}

    public record SaveOverrideRequest(Integer limitDelta, Long resetTimestamp) {}
}
