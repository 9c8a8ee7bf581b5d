package com.herzen.maxviews.availability;

import java.util.List;

public class AvailabilityModels {
    public interface ConditionNode {}

    public record Composite(String op, List<ConditionNode> children) implements ConditionNode {
        public Composite {
            children = children == null ? List.of() : List.copyOf(children);
        }

        public static Composite empty() {
            return new Composite("&", List.of());
        }
    }

    public record ViewLimitCondition(int viewsLimit) implements ConditionNode {
        public ViewLimitCondition {
            if (viewsLimit < 0) {
                throw new IllegalArgumentException("viewsLimit must be non-negative: " + viewsLimit);
            }
        }
    }

    public record OtherCondition(String type) implements ConditionNode {}
}
