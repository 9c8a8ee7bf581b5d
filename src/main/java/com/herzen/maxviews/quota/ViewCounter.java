package com.herzen.maxviews.quota;

import com.herzen.maxviews.config.MaxViewsProperties;
import com.herzen.maxviews.log.LogModels;
import com.herzen.maxviews.repository.LogStoreJdbcRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class ViewCounter {
    private final LogStoreJdbcRepository logStore;
    private final MaxViewsProperties properties;

    public ViewCounter(LogStoreJdbcRepository logStore, MaxViewsProperties properties) {
        this.logStore = logStore;
        this.properties = properties;
    }

    public long countViews(String contextId, String userId, Instant windowStart) {
        return logStore.countEvents(new LogModels.LogQuery(contextId, userId, properties.readCrud(), windowStart));
    }
}
