package com.herzen.maxviews.quota;

import java.time.Instant;
import java.util.List;

public class QuotaModels {
    public enum ViewStatus { HAS_REMAINING_VIEWS, OUT_OF_VIEWS }

    public enum Outcome { EVALUATED, FAILED }

    // windowStart == null counts the whole history.
    public record EffectiveLimit(long viewsLimit, Instant windowStart, boolean unrestricted) {}

    public record QuotaResult(long viewsCount, long viewsLimit, long viewsRemaining, boolean unrestricted) {
        public static QuotaResult of(long viewsCount, long viewsLimit) {
            return new QuotaResult(viewsCount, viewsLimit, viewsLimit - viewsCount, false);
        }

        public static QuotaResult of(long viewsCount, EffectiveLimit limit) {
            return new QuotaResult(viewsCount, limit.viewsLimit(), limit.viewsLimit() - viewsCount, limit.unrestricted());
        }

        public ViewStatus status() {
            return viewsLimit > viewsCount ? ViewStatus.HAS_REMAINING_VIEWS : ViewStatus.OUT_OF_VIEWS;
        }
    }

    public record ItemEvaluation(String moduleId,
                                 Outcome outcome,
                                 QuotaResult result,
                                 ViewStatus status,
                                 String errorCode,
                                 String errorMessage) {
        public static ItemEvaluation evaluated(String moduleId, QuotaResult result) {
            return new ItemEvaluation(moduleId, Outcome.EVALUATED, result, result.status(), null, null);
        }

        public static ItemEvaluation failed(String moduleId, String errorCode, String errorMessage) {
            return new ItemEvaluation(moduleId, Outcome.FAILED, null, null, errorCode, errorMessage);
        }
    }

    public record CourseViewsReport(String courseId, String userId, List<ItemEvaluation> items) {}
}
