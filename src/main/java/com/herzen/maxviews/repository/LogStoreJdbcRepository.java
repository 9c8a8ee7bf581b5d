package com.herzen.maxviews.repository;

import com.herzen.maxviews.log.LogModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Repository
public class LogStoreJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public LogStoreJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveEvents(List<LogModels.EventIn> events) {
        events.forEach(e -> jdbcTemplate.update(
                "INSERT INTO logstore_standard_log(contextid, userid, crud, eventname, timecreated) VALUES (?,?,?,?,?)",
                e.contextId(), e.userId(), e.crud(), e.eventName(),
                (e.ts() == null ? Instant.now() : e.ts()).getEpochSecond()
        ));
    }

    public long countEvents(LogModels.LogQuery query) {
        StringBuilder sql = new StringBuilder(
                "SELECT COUNT(*) FROM logstore_standard_log WHERE contextid = ? AND userid = ? AND crud = ?");
        List<Object> params = new ArrayList<>(List.of(query.contextId(), query.userId(), query.crud()));
        if (query.since() != null) {
            sql.append(" AND timecreated >= ?");
            params.add(query.since().getEpochSecond());
        }
        Long value = jdbcTemplate.queryForObject(sql.toString(), Long.class, params.toArray());
        return value == null ? 0 : value;
    }
}
