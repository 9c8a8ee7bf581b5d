package com.herzen.maxviews.log;

import java.time.Instant;
import java.util.List;

public class LogModels {
    public record EventIngestRequest(List<EventIn> events) {}

    public record EventIn(String contextId, String userId, String crud, String eventName, Instant ts) {}

    public record EventAck(int accepted, int rejected) {}

    public record LogQuery(String contextId, String userId, String crud, Instant since) {}
}
