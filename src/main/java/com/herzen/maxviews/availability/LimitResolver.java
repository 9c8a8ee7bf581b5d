package com.herzen.maxviews.availability;

import com.herzen.maxviews.availability.AvailabilityModels.*;
import org.springframework.stereotype.Component;

@Component
public class LimitResolver {
    // Base limit of a tree without any view-limit condition. Not a real count.
    public static final int UNLIMITED = Integer.MAX_VALUE;

    public int resolveBaseLimit(ConditionNode tree) {
        int viewsLimit = UNLIMITED;
        if (!(tree instanceof Composite root)) return viewsLimit;

        for (ConditionNode child : root.children()) {
            if (child instanceof ViewLimitCondition condition && condition.viewsLimit() < viewsLimit) {
                viewsLimit = condition.viewsLimit();
            }
        }
        return viewsLimit;
    }
}
