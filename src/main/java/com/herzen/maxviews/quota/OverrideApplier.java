package com.herzen.maxviews.quota;

import com.herzen.maxviews.availability.LimitResolver;
import com.herzen.maxviews.overrides.OverrideModels.OverrideRecord;
import com.herzen.maxviews.quota.QuotaModels.EffectiveLimit;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class OverrideApplier {
    public EffectiveLimit applyOverride(int baseLimit, Optional<OverrideRecord> override) {
        boolean unrestricted = baseLimit == LimitResolver.UNLIMITED;
        if (override.isEmpty()) return new EffectiveLimit(baseLimit, null, unrestricted);

        OverrideRecord record = override.get();
        // Not clamped.
        long viewsLimit = (long) baseLimit + record.delta();
        return new EffectiveLimit(viewsLimit, record.resetInstant(), unrestricted);
    }
}
