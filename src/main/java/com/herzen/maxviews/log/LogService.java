package com.herzen.maxviews.log;

import com.herzen.maxviews.repository.LogStoreJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

@Service
public class LogService {
    private static final Logger log = LoggerFactory.getLogger(LogService.class);

    private final LogStoreJdbcRepository repository;

    public LogService(LogStoreJdbcRepository repository) {
        this.repository = repository;
    }

    public LogModels.EventAck recordEvents(LogModels.EventIngestRequest request) {
        if (request == null || request.events() == null) return new LogModels.EventAck(0, 0);
        List<LogModels.EventIn> accepted = request.events().stream()
                .filter(Objects::nonNull)
                .filter(e -> CrudKinds.SUPPORTED.contains(e.crud()))
                .filter(e -> !isBlank(e.contextId()) && !isBlank(e.userId()))
                .toList();
        repository.saveEvents(accepted);

        int rejected = request.events().size() - accepted.size();
        if (rejected > 0) {
            log.debug("Rejected {} of {} log events", rejected, request.events().size());
        }
        return new LogModels.EventAck(accepted.size(), rejected);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
